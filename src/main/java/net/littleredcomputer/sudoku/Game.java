// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.io.CharStreams;
import com.google.common.primitives.Ints;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static net.littleredcomputer.sudoku.Square.SIZE;

/**
 * A search node: a grid together with the history of how each of its cells came
 * to be filled. Games are created by one of the loaders, which validate the
 * clues, and are then driven toward a solution by {@link #step} and by branching
 * on {@link #branchCell}. A game is never shared between search tasks; each
 * branch works on its own {@link #copy}.
 */
public class Game {
    /** Returned by {@link #step} when some empty cell has no remaining candidate. */
    public static final int CONTRADICTION = -1;

    private static final Splitter lineSplitter = Splitter.on('\n');
    private static final Splitter cellSplitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final CharMatcher blank = CharMatcher.anyOf("_.");

    private final Square square;
    private final List<Placement> placements;
    private int cellsToBeSolved;
    private int guessCount;

    /**
     * A cell chosen for branching, with the values to try there.
     */
    public static final class Branch {
        public final int row;
        public final int column;
        public final ValueSet candidates;

        Branch(int row, int column, ValueSet candidates) {
            this.row = row;
            this.column = column;
            this.candidates = candidates;
        }

        @Override
        public String toString() {
            return String.format("%d-%d %s", row + 1, column + 1, candidates);
        }
    }

    private Game() {
        square = new Square();
        placements = new ArrayList<>();
        cellsToBeSolved = SIZE * SIZE;
    }

    private Game(Game other) {
        square = other.square.copy();
        placements = new ArrayList<>(other.placements);
        cellsToBeSolved = other.cellsToBeSolved;
        guessCount = other.guessCount;
    }

    /**
     * @return an independent copy: grid and provenance are duplicated, nothing is shared
     */
    public Game copy() {
        return new Game(this);
    }

    /**
     * Parse the nine-line text format: each line holds nine cells separated by
     * whitespace, each cell a digit 1-9 or '_' (or '.') for empty. Reading stops at
     * the first blank line or after the ninth row.
     *
     * @param lines puzzle text
     * @return the initial game
     * @throws IllegalArgumentException naming the offending row if the text is malformed
     * or any clue repeats a value on its row, column or box
     */
    public static Game parseFrom(String lines) {
        Game game = new Game();
        int rowsRead = 0;
        for (String line : lineSplitter.split(lines)) {
            if (rowsRead >= SIZE || CharMatcher.whitespace().matchesAllOf(line)) break;
            List<String> cells = cellSplitter.splitToList(line);
            int r = rowsRead;
            if (cells.size() != SIZE) {
                throw new IllegalArgumentException(String.format(
                        "Invalid number of columns for row %d: needs %d, actual %d", r + 1, SIZE, cells.size()));
            }
            for (int c = 0; c < SIZE; ++c) {
                String token = cells.get(c);
                if (token.length() == 1 && blank.matches(token.charAt(0))) continue;
                Integer value = Ints.tryParse(token);
                if (value == null) {
                    throw new IllegalArgumentException(String.format(
                            "Invalid value '%s' for item row:%d, column:%d", token, r + 1, c + 1));
                }
                game.addClue(r, c, value, "");
            }
            ++rowsRead;
        }
        if (rowsRead != SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Missing row %d: needs %d rows, actual %d", rowsRead + 1, SIZE, rowsRead));
        }
        return game;
    }

    public static Game parseFrom(Reader reader) throws IOException {
        return parseFrom(CharStreams.toString(reader));
    }

    /**
     * Construct a game from a compact board string. The string uses the digits 1-9
     * in row by row, left to right order; '.' marks an empty cell and any other
     * character is ignored, so "..3 .1. ... 415 ..." is accepted.
     *
     * @param boardString board representation with 81 cells
     * @return the initial game
     */
    public static Game fromBoardString(String boardString) {
        Game game = new Game();
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if (ch != '.' && (ch <= '0' || ch > '9')) continue;
            if (p >= SIZE * SIZE) throw new IllegalArgumentException("board has more than " + SIZE * SIZE + " cells");
            if (ch != '.') game.addClue(p / SIZE, p % SIZE, ch - '0', "");
            ++p;
        }
        if (p != SIZE * SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Missing row %d: board has %d cells, needs %d", p / SIZE + 1, p, SIZE * SIZE));
        }
        return game;
    }

    /**
     * Construct a game from structured clues. Only the coordinates and values of
     * the placements are used; every one is recorded as a clue.
     */
    public static Game fromPlacements(Iterable<Placement> clues) {
        Game game = new Game();
        int idx = 0;
        for (Placement p : clues) {
            if (!game.square.exists(p.row(), p.column())) {
                throw new IllegalArgumentException(String.format(
                        "Invalid offset: %d-%d for placement %d", p.row(), p.column(), idx));
            }
            game.addClue(p.row(), p.column(), p.value(), " for placement " + idx);
            ++idx;
        }
        return game;
    }

    private void addClue(int r, int c, int value, String where) {
        if (value < 1 || value > SIZE) {
            throw new IllegalArgumentException(String.format(
                    "Invalid value %d for item row:%d, column:%d%s", value, r + 1, c + 1, where));
        }
        if (square.has(r, c) || !square.isAllowed(r, c, value)) {
            throw new IllegalArgumentException(String.format(
                    "Duplicate value %d for item row:%d, column:%d%s", value, r + 1, c + 1, where));
        }
        set(r, c, value, true, false);
    }

    void set(int r, int c, int value, boolean initial, boolean guess) {
        if (!square.has(r, c)) --cellsToBeSolved;
        square.set(r, c, value);
        placements.add(new Placement(r, c, value, initial, guess));
        if (guess) ++guessCount;
    }

    /**
     * @return a copy of this game with one additional, guessed, placement
     */
    Game withGuess(int r, int c, int value) {
        Game child = copy();
        child.set(r, c, value, false, true);
        return child;
    }

    /**
     * @return values not yet used on the row, column or box of the empty cell (r, c).
     * An empty result means this game contradicts itself.
     */
    public ValueSet candidates(int r, int c) {
        return square.rowValues(r)
                .union(square.columnValues(c))
                .union(square.blockValues(r, c))
                .complement();
    }

    /**
     * Sweep the grid once in row-major order, filling every empty cell that has
     * exactly one candidate. A value placed during the sweep constrains the cells
     * visited after it.
     *
     * @return the number of cells filled, or {@link #CONTRADICTION} as soon as an
     * empty cell with no candidates is met
     */
    public int step() {
        int cellsSolved = 0;
        for (int r = 0; r < SIZE; ++r) {
            for (int c = 0; c < SIZE; ++c) {
                if (square.has(r, c)) continue;
                ValueSet cs = candidates(r, c);
                if (cs.isEmpty()) return CONTRADICTION;
                if (cs.size() == 1) {
                    set(r, c, cs.first(), false, false);
                    ++cellsSolved;
                }
            }
        }
        return cellsSolved;
    }

    /**
     * Minimum-remaining-values choice: among the empty cells with more than one
     * candidate, the one with the fewest, ties going to the earliest in row-major
     * order.
     */
    public Optional<Branch> branchCell() {
        Branch best = null;
        for (int r = 0; r < SIZE; ++r) {
            for (int c = 0; c < SIZE; ++c) {
                if (square.has(r, c)) continue;
                ValueSet cs = candidates(r, c);
                if (cs.size() > 1 && (best == null || cs.size() < best.candidates.size())) {
                    best = new Branch(r, c, cs);
                    if (cs.size() == 2) return Optional.of(best);
                }
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean isSolved() { return cellsToBeSolved == 0; }
    public int cellsToBeSolved() { return cellsToBeSolved; }
    public int guessCount() { return guessCount; }

    /**
     * @return placements in the order they were made, clues first
     */
    public List<Placement> placements() { return Collections.unmodifiableList(placements); }

    /**
     * @return a copy of the current grid
     */
    public Square square() { return square.copy(); }

    boolean sameGrid(Game other) { return square.equals(other.square); }

    public String toBoardString() { return square.toBoardString(); }

    /**
     * Render the grid with each empty cell replaced by its candidate list; meant for
     * diagnostic logging.
     */
    public String dump() {
        String rule = "+" + String.join("+", Collections.nCopies(SIZE / Square.BOX, "-----------------------------------")) + "+\n";
        StringBuilder sb = new StringBuilder(rule);
        for (int r = 0; r < SIZE; ++r) {
            for (int c = 0; c < SIZE; ++c) {
                if (c % Square.BOX == 0) sb.append("| ");
                String cell;
                if (square.has(r, c)) {
                    cell = Integer.toString(square.get(r, c));
                } else {
                    StringBuilder alternatives = new StringBuilder("[");
                    candidates(r, c).toList().forEach(v -> { alternatives.append(v); return true; });
                    cell = alternatives.append(']').toString();
                }
                sb.append(String.format("%-11s", cell));
            }
            sb.append("|\n");
            if (r % Square.BOX == Square.BOX - 1) sb.append(rule);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return square.toString();
    }
}
