package net.littleredcomputer.sudoku;

import gnu.trove.list.array.TIntArrayList;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class ValueSetTest {
    @Test
    public void setAlgebra() {
        ValueSet a = ValueSet.of(1, 2, 3);
        ValueSet b = ValueSet.of(3, 9);
        assertThat(a.union(b), is(ValueSet.of(1, 2, 3, 9)));
        assertThat(a.difference(b), is(ValueSet.of(1, 2)));
        assertThat(b.complement(), is(ValueSet.of(1, 2, 4, 5, 6, 7, 8)));
        assertThat(ValueSet.ALL.complement(), is(ValueSet.EMPTY));
    }

    @Test
    public void membersInAscendingOrder() {
        ValueSet s = ValueSet.of(8, 2, 5);
        assertThat(s.size(), is(3));
        assertThat(s.first(), is(2));
        assertThat(s.toList(), is(new TIntArrayList(new int[]{2, 5, 8})));
        assertThat(s.contains(5), is(true));
        assertThat(s.contains(6), is(false));
        assertThat(s.contains(0), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZero() {
        ValueSet.of(0);
    }

    @Test(expected = IllegalStateException.class)
    public void emptyHasNoFirst() {
        ValueSet.EMPTY.first();
    }
}
