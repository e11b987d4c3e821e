// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;

import javax.annotation.CheckReturnValue;

/**
 * An immutable set of cell values drawn from [1..9], recorded as a bit vector
 * (bit k-1 is set when k is a member).
 */
@CheckReturnValue
public final class ValueSet {
    private static final int MASK = (1 << Square.SIZE) - 1;
    public static final ValueSet EMPTY = new ValueSet(0);
    public static final ValueSet ALL = new ValueSet(MASK);

    private final int bits;

    private ValueSet(int bits) { this.bits = bits; }

    public static ValueSet of(int... values) {
        int bits = 0;
        for (int v : values) bits |= bit(v);
        return new ValueSet(bits);
    }

    private static int bit(int value) {
        Preconditions.checkArgument(value >= 1 && value <= Square.SIZE, "value out of range: %s", value);
        return 1 << (value - 1);
    }

    public ValueSet with(int value) { return new ValueSet(bits | bit(value)); }
    public ValueSet union(ValueSet other) { return new ValueSet(bits | other.bits); }
    public ValueSet difference(ValueSet other) { return new ValueSet(bits & ~other.bits); }
    public ValueSet complement() { return new ValueSet(~bits & MASK); }

    public boolean contains(int value) {
        return value >= 1 && value <= Square.SIZE && (bits & (1 << (value - 1))) != 0;
    }

    public int size() { return Integer.bitCount(bits); }
    public boolean isEmpty() { return bits == 0; }

    /**
     * @return the smallest member of the set
     * @throws IllegalStateException if the set is empty
     */
    public int first() {
        Preconditions.checkState(bits != 0, "empty value set");
        return Integer.numberOfTrailingZeros(bits) + 1;
    }

    /**
     * @return members in ascending order
     */
    public TIntArrayList toList() {
        TIntArrayList values = new TIntArrayList(size());
        for (int b = bits; b != 0; b &= b - 1) values.add(Integer.numberOfTrailingZeros(b) + 1);
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return bits == ((ValueSet) o).bits;
    }

    @Override
    public int hashCode() { return bits; }

    @Override
    public String toString() { return toList().toString(); }
}
