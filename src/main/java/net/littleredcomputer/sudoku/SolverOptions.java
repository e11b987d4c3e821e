// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.Level;

import java.time.Duration;

/**
 * Settings for one call to {@link Solver#solve}.
 */
public final class SolverOptions {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration timeout;
    private final int minSolutions;
    private final boolean verbose;
    private final int parallelism;

    private SolverOptions(Builder b) {
        this.timeout = b.timeout;
        this.minSolutions = b.minSolutions;
        this.verbose = b.verbose;
        this.parallelism = b.parallelism;
    }

    public static SolverOptions defaults() { return builder().build(); }
    public static Builder builder() { return new Builder(); }

    /** Wall-clock budget for the whole search. */
    public Duration timeout() { return timeout; }
    /** Stop collecting once this many distinct solutions are in hand. */
    public int minSolutions() { return minSolutions; }
    /** Promote per-branch tracing from TRACE to INFO. */
    public boolean verbose() { return verbose; }
    public int parallelism() { return parallelism; }

    Level traceLevel() { return verbose ? Level.INFO : Level.TRACE; }

    @Override
    public String toString() {
        return String.format("timeout=%s minSolutions=%d verbose=%b parallelism=%d",
                timeout, minSolutions, verbose, parallelism);
    }

    public static final class Builder {
        private Duration timeout = DEFAULT_TIMEOUT;
        private int minSolutions = 1;
        private boolean verbose = false;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        private Builder() {}

        public Builder setTimeout(Duration timeout) {
            Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s", timeout);
            this.timeout = timeout;
            return this;
        }

        public Builder setMinSolutions(int minSolutions) {
            Preconditions.checkArgument(minSolutions >= 1, "minSolutions must be at least 1: %s", minSolutions);
            this.minSolutions = minSolutions;
            return this;
        }

        public Builder setVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder setParallelism(int parallelism) {
            Preconditions.checkArgument(parallelism >= 1, "parallelism must be at least 1: %s", parallelism);
            this.parallelism = parallelism;
            return this;
        }

        public SolverOptions build() { return new SolverOptions(this); }
    }
}
