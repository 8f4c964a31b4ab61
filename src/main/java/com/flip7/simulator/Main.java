package com.flip7.simulator;

import com.flip7.simulator.game.InvalidConfigurationException;
import com.flip7.simulator.game.MatchResult;
import com.flip7.simulator.report.ReportException;
import com.flip7.simulator.report.ReportWriter;
import com.flip7.simulator.report.SimulationReport;
import com.flip7.simulator.simulation.AggregateStats;
import com.flip7.simulator.simulation.SimulationEngine;
import com.flip7.simulator.simulation.SimulationRunner;
import com.flip7.simulator.simulation.StrategyStats;
import com.flip7.simulator.strategy.BotStrategy;
import com.flip7.simulator.strategy.StrategySpec;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

/**
 * Flip 7 strategy simulator CLI - Main entry point.
 */
@Command(name = "flip7-sim",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Flip 7 bot strategy simulator",
        subcommands = {
                Main.RunCommand.class,
                Main.ExperimentCommand.class,
                Main.TraceCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== RUN COMMAND ==========
    @Command(name = "run", description = "Seat every strategy at one table and simulate many games")
    static class RunCommand implements Callable<Integer> {
        @Option(names = {"-S", "--strategy"}, required = true,
                description = "Strategy spec, repeat per seat (bust:0.15[:sc], cards:5[:sc], points:45, "
                        + "hybrid:3:50:0.20[:sc], adaptive)")
        List<String> strategySpecs;

        @Option(names = {"-n", "--num-games"}, defaultValue = "1000",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-s", "--seed"},
                description = "Base random seed (optional)")
        Long seed;

        @Option(names = {"--sequential"},
                description = "Run games on the calling thread only")
        boolean sequential;

        @Option(names = {"--json"},
                description = "Write the results table to this JSON file")
        Path jsonPath;

        @Override
        public Integer call() {
            List<BotStrategy> strategies;
            try {
                strategies = StrategySpec.parseAll(strategySpecs);
            } catch (InvalidConfigurationException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            long baseSeed = seed != null ? seed : System.nanoTime();

            System.out.println("\n=== Flip 7 Simulation ===\n");
            System.out.println("Strategies: " + names(strategies));
            System.out.println("Games: " + numGames);
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            long startTime = System.currentTimeMillis();
            AggregateStats stats;
            try {
                stats = SimulationRunner.runSimulation(strategies, numGames, baseSeed, !sequential);
            } catch (InvalidConfigurationException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(stats.byWins());
            stats.best().ifPresent(best -> System.out.printf("%nBEST STRATEGY: %s with %d wins%n",
                    best.strategy(), best.wins()));
            printElapsed(numGames, elapsed);

            return writeReport(jsonPath, SimulationReport.of("Flip 7 simulation", baseSeed, stats));
        }
    }

    // ========== EXPERIMENT COMMAND ==========
    @Command(name = "experiment",
            description = "Round-robin: each strategy in seat 0 against up to 3 sampled opponents. "
                    + "The championship preset seats its whole pool at one table instead.")
    static class ExperimentCommand implements Callable<Integer> {
        @Option(names = {"-p", "--preset"},
                description = "Built-in strategy pool: ${COMPLETION-CANDIDATES}")
        Preset preset;

        @Option(names = {"-S", "--strategy"},
                description = "Strategy spec for a custom pool, repeatable (not with --preset)")
        List<String> strategySpecs = new ArrayList<>();

        @Option(names = {"-g", "--games"},
                description = "Games per strategy (default: the preset's own count, else "
                        + DEFAULT_EXPERIMENT_GAMES + ")")
        Integer games;

        @Option(names = {"-s", "--seed"},
                description = "Base random seed (optional)")
        Long seed;

        @Option(names = {"--sequential"},
                description = "Run games on the calling thread only")
        boolean sequential;

        @Option(names = {"--json"},
                description = "Write the results table to this JSON file")
        Path jsonPath;

        @Override
        public Integer call() {
            if (preset != null && !strategySpecs.isEmpty()) {
                System.err.println("✗ Use either --preset or --strategy, not both");
                return 1;
            }

            List<BotStrategy> pool;
            String title;
            try {
                if (preset != null) {
                    pool = preset.strategies();
                    title = preset.getTitle();
                } else {
                    pool = StrategySpec.parseAll(strategySpecs);
                    title = "Custom experiment";
                }
            } catch (InvalidConfigurationException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            int numGames = games != null ? games
                    : preset != null ? preset.getDefaultGames() : DEFAULT_EXPERIMENT_GAMES;
            boolean singleTable = preset != null && preset.getMode() == Preset.Mode.SINGLE_TABLE;
            if (pool.size() < 2 || numGames < 1) {
                System.err.println("✗ An experiment needs at least 2 strategies and a positive game count");
                return 1;
            }

            long baseSeed = seed != null ? seed : System.nanoTime();

            System.out.println("\n" + "=".repeat(60));
            System.out.println(title);
            if (singleTable) {
                System.out.println("Testing " + pool.size() + " strategies at one " + pool.size()
                        + "-player table, " + numGames + " games");
            } else {
                System.out.println("Testing " + pool.size() + " strategies in up to "
                        + (SimulationRunner.EXPERIMENT_OPPONENTS + 1) + "-player games, "
                        + numGames + " games each");
            }
            System.out.println("Seed: " + baseSeed);
            System.out.println("=".repeat(60) + "\n");

            long startTime = System.currentTimeMillis();
            SimulationReport report;
            int totalGames;
            if (singleTable) {
                AggregateStats stats = SimulationRunner.runSimulation(pool, numGames, baseSeed, !sequential);
                report = SimulationReport.of(title, baseSeed, stats);
                totalGames = numGames;
            } else {
                int poolSize = pool.size();
                List<StrategyStats> results = SimulationRunner.runExperiment(pool, numGames, baseSeed, !sequential,
                        (index, strategy) -> System.out.println("Testing " + strategy.name()
                                + " (" + (index + 1) + "/" + poolSize + ")..."));
                report = SimulationReport.of(title, numGames, baseSeed, results);
                totalGames = numGames * pool.size();
            }
            long elapsed = System.currentTimeMillis() - startTime;

            System.out.println();
            printResults(report.results());
            System.out.printf("%nBEST STRATEGY: %s%n", report.bestStrategy());
            printElapsed(totalGames, elapsed);

            return writeReport(jsonPath, report);
        }
    }

    // ========== TRACE COMMAND ==========
    @Command(name = "trace", description = "Play a single seeded game and print every turn")
    static class TraceCommand implements Callable<Integer> {
        @Option(names = {"-S", "--strategy"}, required = true,
                description = "Strategy spec, repeat per seat")
        List<String> strategySpecs;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"--json"},
                description = "Write the round-by-round record to this JSON file")
        Path jsonPath;

        @Override
        public Integer call() {
            List<BotStrategy> strategies;
            try {
                strategies = StrategySpec.parseAll(strategySpecs);
            } catch (InvalidConfigurationException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            long gameSeed = seed != null ? seed : System.nanoTime();
            MatchResult result = SimulationEngine.traceGame(strategies, gameSeed, true);

            if (result.emergencyRefills() > 0) {
                System.err.println("Deck was exhausted " + result.emergencyRefills() + " time(s)");
            }
            return writeReport(jsonPath, result);
        }
    }

    // ========== PRESETS ==========

    static final int DEFAULT_EXPERIMENT_GAMES = 500;

    /**
     * The strategy pools of the standard experiments, with their game counts.
     */
    enum Preset {
        BUST("EXPERIMENT 1: Bust Probability Strategies (0% to 100%)", Mode.ROUND_ROBIN, 500),
        CARDS("EXPERIMENT 2: Card Count Strategies", Mode.ROUND_ROBIN, 1000),
        POINTS("EXPERIMENT 3: Point Threshold Strategies (20-80 points)", Mode.ROUND_ROBIN, 500),
        CHAMPIONSHIP("EXPERIMENT 4: Championship - Best Strategies Head-to-Head", Mode.SINGLE_TABLE, 2000);

        /**
         * How a pool is played: seat-0 matchups against sampled opponents, or everyone at one table.
         */
        enum Mode {
            ROUND_ROBIN,
            SINGLE_TABLE
        }

        private final String title;
        private final Mode mode;
        private final int defaultGames;

        Preset(String title, Mode mode, int defaultGames) {
            this.title = title;
            this.mode = mode;
            this.defaultGames = defaultGames;
        }

        String getTitle() {
            return title;
        }

        Mode getMode() {
            return mode;
        }

        int getDefaultGames() {
            return defaultGames;
        }

        List<BotStrategy> strategies() {
            List<BotStrategy> pool = new ArrayList<>();
            switch (this) {
                case BUST -> {
                    for (int pct = 0; pct <= 100; pct += 5) {
                        pool.add(StrategySpec.parse("bust:" + (pct / 100.0)));
                    }
                }
                case CARDS -> {
                    for (int count = 2; count <= 7; count++) {
                        pool.add(StrategySpec.parse("cards:" + count));
                    }
                }
                case POINTS -> {
                    for (int points = 20; points <= 80; points += 5) {
                        pool.add(StrategySpec.parse("points:" + points));
                    }
                }
                case CHAMPIONSHIP -> {
                    for (String spec : List.of("bust:0.15", "bust:0.20", "bust:0.25", "cards:5",
                            "points:45", "points:50", "hybrid:3:50:0.20", "hybrid:4:45:0.25", "adaptive")) {
                        pool.add(StrategySpec.parse(spec));
                    }
                }
            }
            return pool;
        }
    }

    // ========== HELPER METHODS ==========

    private static String names(List<BotStrategy> strategies) {
        return strategies.stream().map(BotStrategy::name).toList().toString();
    }

    /**
     * Print the results table.
     */
    private static void printResults(List<StrategyStats> rows) {
        System.out.println("=== Results ===\n");
        System.out.printf("%-28s %7s %8s %10s %10s %7s %7s%n",
                "Strategy", "Wins", "Win %", "Avg score", "Avg rounds", "Busts", "Flip 7");
        System.out.println("-".repeat(83));
        for (StrategyStats row : rows) {
            System.out.printf("%-28s %7d %7.1f%% %10.1f %10.1f %7d %7d%n",
                    row.strategy(), row.wins(), row.winRate() * 100.0, row.avgFinalScore(),
                    row.avgRoundsToWin(), row.busts(), row.flip7s());
        }
    }

    private static void printElapsed(int games, long elapsedMs) {
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? games / elapsedSec : 0;
        System.out.printf("%nSimulation completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }

    private static int writeReport(Path path, Object report) {
        if (path == null) {
            return 0;
        }
        try {
            new ReportWriter().write(path, report);
            System.err.println("✓ Results written to " + path);
            return 0;
        } catch (ReportException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
    }
}
