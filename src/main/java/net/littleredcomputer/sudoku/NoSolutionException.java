// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import java.time.Duration;

/**
 * Thrown by {@link Solver#solve} when not a single solution was collected, either
 * because every branch ended in a contradiction or because time ran out first.
 */
public class NoSolutionException extends Exception {
    private final Duration timeout;
    private final boolean exhausted;

    NoSolutionException(Duration timeout, boolean exhausted) {
        super(exhausted
                ? "No solutions found: every branch ended in a contradiction"
                : "No solutions found within " + timeout);
        this.timeout = timeout;
        this.exhausted = exhausted;
    }

    public Duration timeout() { return timeout; }

    /**
     * @return true if the whole search tree was explored, i.e. the puzzle has no
     * solution; false if the deadline passed with branches still open
     */
    public boolean isExhausted() { return exhausted; }
}
