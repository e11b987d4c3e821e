// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.util.Objects;

/**
 * One entry of a game's provenance: a value written to a cell, and why.
 */
public final class Placement {
    private final int row;
    private final int column;
    private final int value;
    private final boolean initial;  // given in the puzzle input
    private final boolean guess;    // chosen at a branching point rather than deduced

    public Placement(int row, int column, int value, boolean initial, boolean guess) {
        this.row = row;
        this.column = column;
        this.value = value;
        this.initial = initial;
        this.guess = guess;
    }

    public int row() { return row; }
    public int column() { return column; }
    public int value() { return value; }
    public boolean isInitial() { return initial; }
    public boolean isGuess() { return guess; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Placement p = (Placement) o;
        return row == p.row && column == p.column && value == p.value && initial == p.initial && guess == p.guess;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, value, initial, guess);
    }

    @Override
    public String toString() {
        return String.format("%d-%d=%d%s", row + 1, column + 1, value, initial ? " (clue)" : guess ? " (guess)" : "");
    }
}
