package com.flip7.simulator.simulation;

import com.flip7.simulator.game.InvalidConfigurationException;
import com.flip7.simulator.rng.GameRng;
import com.flip7.simulator.strategy.BotStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.stream.IntStream;

/**
 * Runs batches of independent matches and aggregates the results.
 * Game i of a batch is seeded with baseSeed + i, so a base seed reproduces the
 * whole batch no matter how the games are spread across threads.
 */
public final class SimulationRunner {

    /** Opponents per experiment game; 4-player tables keep deck exhaustion down. */
    public static final int EXPERIMENT_OPPONENTS = 3;

    private SimulationRunner() {
        // Utility class - prevent instantiation
    }

    /**
     * Run {@code numGames} matches with every strategy seated in the given order.
     */
    public static AggregateStats runSimulation(List<BotStrategy> strategies, int numGames) {
        return runSimulation(strategies, numGames, System.nanoTime(), true);
    }

    /**
     * Run {@code numGames} matches seeded from {@code baseSeed}.
     *
     * @param parallel spread games over the common fork-join pool
     */
    public static AggregateStats runSimulation(List<BotStrategy> strategies, int numGames,
                                               long baseSeed, boolean parallel) {
        requireStrategies(strategies, 1);
        requireGames(numGames);
        List<BotStrategy> seats = List.copyOf(strategies);

        IntStream games = IntStream.range(0, numGames);
        if (parallel) {
            games = games.parallel();
        }

        // Each worker fills its own accumulator; they are merged once the games finish
        StatsAccumulator totals = games
                .mapToObj(i -> SimulationEngine.runGame(seats, baseSeed + i, false))
                .collect(() -> newAccumulator(seats), StatsAccumulator::addGame, StatsAccumulator::merge);

        return new AggregateStats(numGames, totals.toStats());
    }

    /**
     * Round-robin experiment: each strategy plays {@code gamesPerMatchup} games in seat 0
     * against up to three opponents sampled from the rest of the pool.
     * Only the seat-0 player's outcome is counted.
     */
    public static List<StrategyStats> runExperiment(List<BotStrategy> strategies, int gamesPerMatchup) {
        return runExperiment(strategies, gamesPerMatchup, System.nanoTime(), true);
    }

    public static List<StrategyStats> runExperiment(List<BotStrategy> strategies, int gamesPerMatchup,
                                                    long baseSeed, boolean parallel) {
        return runExperiment(strategies, gamesPerMatchup, baseSeed, parallel, (index, strategy) -> { });
    }

    /**
     * Round-robin experiment reporting each matchup (pool index and strategy) before it starts.
     */
    public static List<StrategyStats> runExperiment(List<BotStrategy> strategies, int gamesPerMatchup,
                                                    long baseSeed, boolean parallel,
                                                    BiConsumer<Integer, BotStrategy> onMatchup) {
        requireStrategies(strategies, 2);
        requireGames(gamesPerMatchup);
        List<BotStrategy> pool = List.copyOf(strategies);

        List<StrategyStats> results = new ArrayList<>(pool.size());
        for (int index = 0; index < pool.size(); index++) {
            onMatchup.accept(index, pool.get(index));
            results.add(runMatchup(pool, index, gamesPerMatchup, baseSeed + (long) index * gamesPerMatchup, parallel));
        }
        return results;
    }

    /**
     * Play one strategy of the pool in seat 0 for a batch of games.
     */
    public static StrategyStats runMatchup(List<BotStrategy> pool, int index, int games,
                                           long baseSeed, boolean parallel) {
        requireStrategies(pool, 2);
        requireGames(games);
        if (index < 0 || index >= pool.size()) {
            throw new InvalidConfigurationException("Strategy index " + index + " is outside a pool of "
                    + pool.size());
        }
        BotStrategy subject = pool.get(index);
        List<BotStrategy> others = new ArrayList<>(pool);
        others.remove(index);
        int opponents = Math.min(EXPERIMENT_OPPONENTS, others.size());

        IntStream stream = IntStream.range(0, games);
        if (parallel) {
            stream = stream.parallel();
        }

        StatsAccumulator totals = stream
                .mapToObj(i -> {
                    GameRng rng = new GameRng(baseSeed + i);
                    List<BotStrategy> table = new ArrayList<>(opponents + 1);
                    table.add(subject);
                    table.addAll(rng.sample(others, opponents));
                    return SimulationEngine.runGame(table, rng, false);
                })
                .collect(() -> newAccumulator(List.of(subject)),
                        (acc, result) -> acc.addSeat(result, 0),
                        StatsAccumulator::merge);

        return totals.toStats().get(0);
    }

    private static StatsAccumulator newAccumulator(List<BotStrategy> strategies) {
        StatsAccumulator accumulator = new StatsAccumulator();
        for (BotStrategy strategy : strategies) {
            accumulator.register(strategy.name());
        }
        return accumulator;
    }

    private static void requireStrategies(List<BotStrategy> strategies, int minimum) {
        if (strategies == null || strategies.size() < minimum) {
            throw new InvalidConfigurationException("Need at least " + minimum + " strateg"
                    + (minimum == 1 ? "y" : "ies") + ", got " + (strategies == null ? 0 : strategies.size()));
        }
    }

    private static void requireGames(int games) {
        if (games < 1) {
            throw new InvalidConfigurationException("Number of games must be positive, got " + games);
        }
    }
}
