// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Concurrent Sudoku solver. The root game is searched by a tree of
 * {@link SearchTask}s, one per search node, which report solved games back here.
 * Collection stops when enough distinct solutions have arrived, when the time
 * budget runs out, or when every branch has ended; whichever comes first. On
 * return the remaining branches are cancelled.
 */
public class Solver {
    private static final Logger log = LogManager.getFormatterLogger(Solver.class);

    private final SolverOptions options;
    private final Supplier<ExecutorService> executors;

    public Solver(SolverOptions options) {
        this(options, () -> newPool(options.parallelism()));
    }

    /**
     * @param executors supplies a fresh executor for each call to {@link #solve(Game)};
     *                  it is shut down when that call returns
     */
    Solver(SolverOptions options, Supplier<ExecutorService> executors) {
        this.options = options;
        this.executors = executors;
    }

    public static ImmutableList<Game> solve(Game root, SolverOptions options) throws NoSolutionException {
        return new Solver(options).solve(root);
    }

    // Tasks forked from a worker go on that worker's own deque and are popped
    // LIFO, so each worker explores depth first.
    private static ExecutorService newPool(int parallelism) {
        final AtomicInteger threads = new AtomicInteger();
        return new ForkJoinPool(parallelism, pool -> {
            ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            t.setName("sudoku-search-" + threads.incrementAndGet());
            return t;
        }, (t, e) -> log.error("search task failed on " + t.getName(), e), false);
    }

    /**
     * Search for solutions of root. The root game itself is not modified.
     *
     * @return distinct solved games, in the order they were found; at most
     * {@link SolverOptions#minSolutions()} of them
     * @throws NoSolutionException if no solution was found
     */
    public ImmutableList<Game> solve(Game root) throws NoSolutionException {
        final Level level = options.traceLevel();
        final Stopwatch stopwatch = Stopwatch.createStarted();
        final Instant deadline = Instant.now().plus(options.timeout());
        final ExecutorService executor = executors.get();
        final SearchContext context = new SearchContext(deadline, executor, level);
        final List<Game> solutions = new ArrayList<>();
        boolean exhausted = false;

        log.log(level, "solving with %s, %d cells to go", options, root.cellsToBeSolved());
        try {
            context.submit(root.copy());
            while (solutions.size() < options.minSolutions()) {
                long remaining = Duration.between(Instant.now(), deadline).toNanos();
                Optional<Game> report = remaining > 0
                        ? context.reports().poll(remaining, TimeUnit.NANOSECONDS)
                        : context.reports().poll();
                if (report == null) {
                    log.log(level, "timeout %s expired with %d solutions", options.timeout(), solutions.size());
                    break;
                }
                if (!report.isPresent()) {
                    log.log(level, "search exhausted with %d solutions", solutions.size());
                    exhausted = true;
                    break;
                }
                Game candidate = report.get();
                if (solutions.stream().anyMatch(candidate::sameGrid)) {
                    log.log(level, "solution already known");
                    continue;
                }
                solutions.add(candidate);
                log.log(level, "solution %d is new (%s)", solutions.size(), stopwatch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while collecting solutions; returning %d", solutions.size());
        } finally {
            context.cancel();
            executor.shutdownNow();
        }
        log.log(level, "%d solutions, %d tasks started, %s", solutions.size(), context.tasksStarted(), stopwatch);
        if (solutions.isEmpty()) throw new NoSolutionException(options.timeout(), exhausted);
        return ImmutableList.copyOf(solutions);
    }
}
