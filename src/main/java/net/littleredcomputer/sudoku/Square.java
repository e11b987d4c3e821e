// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * A 9x9 grid of cells, each either empty or holding a value in [1..9]. The
 * grid answers which values are in use along any row, column or 3x3 box. No
 * consistency is enforced by {@link #set}; callers check {@link #isAllowed}
 * first when that matters.
 */
public class Square {
    public static final int SIZE = 9;
    public static final int BOX = 3;
    private static final int EMPTY = 0;

    private final int[][] board = new int[SIZE][SIZE];

    @FunctionalInterface
    public interface Visitor {
        /**
         * @param r row index [0..9)
         * @param c column index [0..9)
         * @param value contents of cell [1..9], or 0 when the cell is empty
         */
        void visit(int r, int c, int value);
    }

    public Square() {}

    private Square(Square other) {
        for (int i = 0; i < SIZE; ++i) board[i] = other.board[i].clone();
    }

    public boolean exists(int r, int c) {
        return r >= 0 && r < SIZE && c >= 0 && c < SIZE;
    }

    private void checkCell(int r, int c) {
        Preconditions.checkElementIndex(r, SIZE, "row");
        Preconditions.checkElementIndex(c, SIZE, "column");
    }

    public int get(int r, int c) {
        checkCell(r, c);
        return board[r][c];
    }

    public boolean has(int r, int c) {
        return get(r, c) != EMPTY;
    }

    public void set(int r, int c, int value) {
        checkCell(r, c);
        Preconditions.checkArgument(value >= 1 && value <= SIZE, "value out of range: %s", value);
        board[r][c] = value;
    }

    public void clear(int r, int c) {
        checkCell(r, c);
        board[r][c] = EMPTY;
    }

    /**
     * @return true if value could be written at (r, c) without repeating it on the
     * cell's row, column or box. The cell's own current contents are not counted.
     */
    public boolean isAllowed(int r, int c, int value) {
        if (!exists(r, c) || value < 1 || value > SIZE) return false;
        for (int k = 0; k < SIZE; ++k) {
            if (k != c && board[r][k] == value) return false;
            if (k != r && board[k][c] == value) return false;
        }
        int br = r - r % BOX, bc = c - c % BOX;
        for (int i = br; i < br + BOX; ++i) {
            for (int j = bc; j < bc + BOX; ++j) {
                if ((i != r || j != c) && board[i][j] == value) return false;
            }
        }
        return true;
    }

    public ValueSet rowValues(int r) {
        Preconditions.checkElementIndex(r, SIZE, "row");
        ValueSet s = ValueSet.EMPTY;
        for (int v : board[r]) if (v != EMPTY) s = s.with(v);
        return s;
    }

    public ValueSet columnValues(int c) {
        Preconditions.checkElementIndex(c, SIZE, "column");
        ValueSet s = ValueSet.EMPTY;
        for (int[] row : board) if (row[c] != EMPTY) s = s.with(row[c]);
        return s;
    }

    /**
     * @return the values present in the 3x3 box containing (r, c)
     */
    public ValueSet blockValues(int r, int c) {
        checkCell(r, c);
        ValueSet s = ValueSet.EMPTY;
        int br = r - r % BOX, bc = c - c % BOX;
        for (int i = br; i < br + BOX; ++i) {
            for (int j = bc; j < bc + BOX; ++j) {
                if (board[i][j] != EMPTY) s = s.with(board[i][j]);
            }
        }
        return s;
    }

    /**
     * Visit every cell in row-major order.
     */
    public void iterate(Visitor visitor) {
        for (int i = 0; i < SIZE; ++i) {
            for (int j = 0; j < SIZE; ++j) {
                visitor.visit(i, j, board[i][j]);
            }
        }
    }

    public int countEmpty() {
        int n = 0;
        for (int[] row : board) for (int v : row) if (v == EMPTY) ++n;
        return n;
    }

    /**
     * @return an independent deep copy of this grid
     */
    public Square copy() {
        return new Square(this);
    }

    /**
     * @return the grid as nine groups of three digits per row, '.' for an empty
     * cell, e.g. "793 412 685 415 638 297 ..."
     */
    public String toBoardString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < SIZE; ++i) {
            for (int j = 0; j < SIZE; ++j) {
                sb.append(board[i][j] == EMPTY ? '.' : (char) ('0' + board[i][j]));
                if (j % BOX == BOX - 1) sb.append(' ');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.deepEquals(board, ((Square) o).board);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(board);
    }

    /**
     * @return nine lines of space-separated cells, '_' for empty; the format read by
     * {@link Game#parseFrom(String)}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < SIZE; ++i) {
            for (int j = 0; j < SIZE; ++j) {
                if (j > 0) sb.append(' ');
                if (board[i][j] == EMPTY) sb.append('_');
                else sb.append(board[i][j]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
