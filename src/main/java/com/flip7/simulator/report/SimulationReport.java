package com.flip7.simulator.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flip7.simulator.simulation.AggregateStats;
import com.flip7.simulator.simulation.StrategyStats;

import java.util.Comparator;
import java.util.List;

/**
 * Flat results table handed to the JSON sink.
 * Rows are sorted by win rate, best first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationReport(
    @JsonProperty("title") String title,
    @JsonProperty("games_per_strategy") int gamesPerStrategy,
    @JsonProperty("seed") Long seed,
    @JsonProperty("best_strategy") String bestStrategy,
    @JsonProperty("results") List<StrategyStats> results
) {
    public static SimulationReport of(String title, int gamesPerStrategy, Long seed, List<StrategyStats> rows) {
        List<StrategyStats> sorted = rows.stream()
                .sorted(Comparator.comparingDouble(StrategyStats::winRate).reversed())
                .toList();
        String best = sorted.isEmpty() ? null : sorted.get(0).strategy();
        return new SimulationReport(title, gamesPerStrategy, seed, best, sorted);
    }

    public static SimulationReport of(String title, Long seed, AggregateStats stats) {
        return of(title, stats.gamesPlayed(), seed, stats.strategies());
    }
}
