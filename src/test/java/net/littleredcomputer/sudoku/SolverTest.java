// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SolverTest {

    private static SolverOptions options(int minSolutions, Duration timeout) {
        return SolverOptions.builder().setMinSolutions(minSolutions).setTimeout(timeout).build();
    }

    private static List<String> solve(String board, int minSolutions, Duration timeout) throws NoSolutionException {
        Game root = Game.fromBoardString(board);
        ImmutableList<Game> solutions = Solver.solve(root, options(minSolutions, timeout));
        for (Game s : solutions) {
            Puzzles.assertValid(s.square());
            Puzzles.assertKeepsClues(root, s);
        }
        return solutions.stream().map(Game::toBoardString).collect(Collectors.toList());
    }

    /** An executor which accepts tasks and never runs them. */
    private static class IdleExecutor extends AbstractExecutorService {
        private boolean shutdown = false;
        @Override public void execute(Runnable command) {}
        @Override public void shutdown() { shutdown = true; }
        @Override public List<Runnable> shutdownNow() { shutdown = true; return Collections.emptyList(); }
        @Override public boolean isShutdown() { return shutdown; }
        @Override public boolean isTerminated() { return shutdown; }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) { return true; }
    }

    @Test
    public void ex28a() throws NoSolutionException {
        assertThat(solve(Puzzles.ex28a, 1, Duration.ofSeconds(10)), contains(Puzzles.ex28aSolution));
    }

    @Test
    public void ex28b() throws NoSolutionException {
        assertThat(solve(Puzzles.ex28b, 1, Duration.ofSeconds(10)), contains(Puzzles.ex28bSolution));
    }

    @Test
    public void seventeenClues() throws NoSolutionException {
        assertThat(solve(Puzzles.seventeen, 1, Duration.ofSeconds(10)), contains(Puzzles.seventeenSolution));
    }

    @Test
    public void supposedlyHardest() throws NoSolutionException {
        assertThat(solve(Puzzles.hardest, 1, Duration.ofSeconds(10)), contains(Puzzles.hardestSolution));
    }

    @Test
    public void askingForMoreThanExistIsNotAnError() throws NoSolutionException {
        assertThat(solve(Puzzles.ex28a, 2, Duration.ofMillis(500)), contains(Puzzles.ex28aSolution));
        assertThat(solve(Puzzles.seventeen, 2, Duration.ofSeconds(5)), contains(Puzzles.seventeenSolution));
    }

    @Test
    public void bothSolutionsOfEx28c() throws NoSolutionException {
        assertThat(ImmutableSet.copyOf(solve(Puzzles.ex28c, 2, Duration.ofSeconds(10))),
                is(ImmutableSet.of(Puzzles.ex28cSolution1, Puzzles.ex28cSolution2)));
    }

    @Test
    public void emptyGridYieldsDistinctSolutions() throws NoSolutionException {
        List<String> found = solve(Puzzles.empty, 2, Duration.ofSeconds(10));
        assertThat(found, hasSize(2));
        assertThat(found.get(0), is(not(found.get(1))));
    }

    @Test
    public void solvingTwiceFindsTheSameSolutions() throws NoSolutionException {
        Set<String> first = ImmutableSet.copyOf(solve(Puzzles.ex28c, 5, Duration.ofSeconds(10)));
        Set<String> second = ImmutableSet.copyOf(solve(Puzzles.ex28c, 5, Duration.ofSeconds(10)));
        assertThat(first, hasSize(2));
        assertThat(second, is(first));
    }

    @Test
    public void rootIsNotModified() throws NoSolutionException {
        Game root = Game.fromBoardString(Puzzles.ex28b);
        String before = root.toString();
        Solver.solve(root, options(1, Duration.ofSeconds(10)));
        assertThat(root.toString(), is(before));
        assertThat(root.placements(), hasSize(17));
    }

    @Test
    public void solutionsCarryTheirProvenance() throws NoSolutionException {
        Game s = Solver.solve(Game.fromBoardString(Puzzles.ex28b), options(1, Duration.ofSeconds(10))).get(0);
        List<Placement> ps = s.placements();
        assertThat(ps, hasSize(81));
        assertThat(ps.stream().filter(Placement::isInitial).count(), is(17L));
        assertThat(ps.stream().filter(Placement::isGuess).count(), is((long) s.guessCount()));
        assertThat(ps.stream().map(p -> p.row() * 9 + p.column()).distinct().count(), is(81L));
    }

    @Test
    public void sequentialSolverIsDeterministic() throws NoSolutionException {
        Solver solver = new Solver(options(2, Duration.ofSeconds(10)), MoreExecutors::newDirectExecutorService);
        List<String> found = solver.solve(Game.fromBoardString(Puzzles.ex28c)).stream()
                .map(Game::toBoardString)
                .collect(Collectors.toList());
        assertThat(found, contains(Puzzles.ex28cSolution2, Puzzles.ex28cSolution1));
    }

    @Test
    public void unsolvablePuzzle() {
        try {
            Solver.solve(Game.fromBoardString(Puzzles.unsolvable), options(1, Duration.ofSeconds(10)));
            fail();
        } catch (NoSolutionException e) {
            assertThat(e.isExhausted(), is(true));
        }
    }

    @Test
    public void timeoutWithoutSolution() {
        Solver solver = new Solver(options(1, Duration.ofMillis(100)), IdleExecutor::new);
        try {
            solver.solve(Game.fromBoardString(Puzzles.ex28a));
            fail();
        } catch (NoSolutionException e) {
            assertThat(e.isExhausted(), is(false));
            assertThat(e.timeout(), is(Duration.ofMillis(100)));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void minSolutionsMustBePositive() {
        SolverOptions.builder().setMinSolutions(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void timeoutMustBePositive() {
        SolverOptions.builder().setTimeout(Duration.ZERO);
    }
}
