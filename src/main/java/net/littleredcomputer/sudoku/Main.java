// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.sudoku;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Joiner lineJoiner = Joiner.on('\n');

    private static Options options() {
        return new Options()
                .addOption("problem", true, "filename of puzzle in nine-line format, or - for stdin")
                .addOption("board", true, "sudoku board [1-9.]{81}")
                .addOption("timeout", true, "time budget in ISO-8601 format, e.g. PT5S")
                .addOption("solutions", true, "number of distinct solutions wanted")
                .addOption("parallelism", true, "number of search threads")
                .addOption("verbose", false, "trace every search branch")
                .addOption("steps", false, "print the placements leading to each solution");
    }

    private static Game game(CommandLine cmd) throws IOException {
        if (cmd.hasOption("board")) return Game.fromBoardString(cmd.getOptionValue("board"));
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem or -board");
        String p = cmd.getOptionValue("problem");
        try (Reader r = new BufferedReader(p.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(p), StandardCharsets.UTF_8))) {
            return Game.parseFrom(r);
        }
    }

    private static SolverOptions solverOptions(CommandLine cmd) {
        SolverOptions.Builder b = SolverOptions.builder()
                .setMinSolutions(Integer.parseInt(cmd.getOptionValue("solutions", "1")))
                .setVerbose(cmd.hasOption("verbose"));
        if (cmd.hasOption("timeout")) b.setTimeout(Duration.parse(cmd.getOptionValue("timeout")));
        if (cmd.hasOption("parallelism")) b.setParallelism(Integer.parseInt(cmd.getOptionValue("parallelism")));
        return b.build();
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        SolverOptions options = solverOptions(cmd);
        Game game = game(cmd);
        if (options.verbose()) log.info("initial state:\n%s", game.dump());
        ImmutableList<Game> solutions;
        try {
            solutions = Solver.solve(game, options);
        } catch (NoSolutionException e) {
            System.out.println("no solution: " + e.getMessage());
            System.exit(1);
            return;
        }
        for (Game s : solutions) {
            System.out.println(s);
            if (cmd.hasOption("steps")) {
                System.out.println(lineJoiner.join(s.placements()));
                System.out.println();
            }
            System.out.printf("%d guesses%n%n", s.guessCount());
        }
    }
}
