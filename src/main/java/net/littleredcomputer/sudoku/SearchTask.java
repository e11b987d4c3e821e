// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Drives one game toward a solution. The task alternates deterministic sweeps
 * ({@link Game#step}) until the grid is solved, contradicts itself, or no sweep
 * makes progress. In the last case it forks one new task per candidate of the
 * most constrained cell and ends; the parent does no further work.
 *
 * <p>Failures are local: a contradicted or expired task simply stops, without
 * reporting anything and without affecting its siblings.
 */
final class SearchTask implements Runnable {
    private static final Logger log = LogManager.getFormatterLogger(SearchTask.class);
    // Each productive sweep fills at least one cell.
    private static final int MAX_SWEEPS = Square.SIZE * Square.SIZE;

    enum Outcome {
        SOLVED,
        BRANCHED,
        CONTRADICTED,
        EXPIRED,
        EXHAUSTED,
    }

    private final SearchContext context;
    private final long id;
    private final Game game;
    private final Level level;

    SearchTask(SearchContext context, long id, Game game) {
        this.context = context;
        this.id = id;
        this.game = game;
        this.level = context.traceLevel();
    }

    long id() { return id; }

    @Override
    public void run() {
        try {
            search();
        } finally {
            context.finished();
        }
    }

    Outcome search() {
        log.log(level, "task %d: start solving, %d cells to go, %d guesses", id, game.cellsToBeSolved(), game.guessCount());
        if (game.isSolved()) return solved();
        for (int i = 0; i < MAX_SWEEPS; ++i) {
            if (context.isCancelled() || context.isExpired()) {
                log.log(level, "task %d: abort, %s", id, context.isCancelled() ? "search cancelled" : "deadline expired");
                return Outcome.EXPIRED;
            }
            int cellsSolved = game.step();
            if (cellsSolved == Game.CONTRADICTION) {
                log.log(level, "task %d: contradiction, wrong guess upstream", id);
                return Outcome.CONTRADICTED;
            }
            if (cellsSolved == 0) return branch();
            log.log(level, "task %d: solved %d cells in sweep %d", id, cellsSolved, i + 1);
            if (game.isSolved()) return solved();
        }
        log.log(level, "task %d: abort with %d cells to go", id, game.cellsToBeSolved());
        return Outcome.EXHAUSTED;
    }

    private Outcome solved() {
        log.log(level, "task %d: got solution after %d guesses", id, game.guessCount());
        context.report(game);
        return Outcome.SOLVED;
    }

    private Outcome branch() {
        Optional<Game.Branch> best = game.branchCell();
        if (!best.isPresent()) {
            log.log(level, "task %d: stuck with no cell to branch on", id);
            return Outcome.EXHAUSTED;
        }
        Game.Branch b = best.get();
        TIntArrayList values = b.candidates.toList();
        for (int k = 0; k < values.size(); ++k) {
            int value = values.get(k);
            log.log(level, "task %d: stuck, try %d-%d with value %d", id, b.row + 1, b.column + 1, value);
            context.submit(game.withGuess(b.row, b.column, value));
        }
        return Outcome.BRANCHED;
    }
}
