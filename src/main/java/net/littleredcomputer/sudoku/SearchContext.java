// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by every task of one search tree: the deadline, the channel on
 * which solved games are reported, and the cancellation flag. The report queue
 * is unbounded so a task never blocks when reporting. Once the last outstanding
 * task finishes, an empty report is queued to mark the tree as exhausted; it is
 * always behind every solution.
 */
final class SearchContext {
    private static final Logger log = LogManager.getFormatterLogger(SearchContext.class);

    private final Instant deadline;
    private final Executor executor;
    private final Level traceLevel;
    private final BlockingQueue<Optional<Game>> reports = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicLong taskIds = new AtomicLong();

    SearchContext(Instant deadline, Executor executor, Level traceLevel) {
        this.deadline = deadline;
        this.executor = executor;
        this.traceLevel = traceLevel;
    }

    /**
     * Start a new task searching from the given game.
     */
    void submit(Game game) {
        outstanding.incrementAndGet();
        SearchTask task = new SearchTask(this, taskIds.incrementAndGet(), game);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // Only happens once the solver has shut the executor down.
            log.log(traceLevel, "task %d: not started, executor is shut down", task.id());
            finished();
        }
    }

    void report(Game solved) {
        reports.offer(Optional.of(solved));
    }

    void finished() {
        if (outstanding.decrementAndGet() == 0) reports.offer(Optional.empty());
    }

    void cancel() { cancelled.set(true); }
    boolean isCancelled() { return cancelled.get(); }
    boolean isExpired() { return !Instant.now().isBefore(deadline); }

    Level traceLevel() { return traceLevel; }
    BlockingQueue<Optional<Game>> reports() { return reports; }
    long tasksStarted() { return taskIds.get(); }
}
