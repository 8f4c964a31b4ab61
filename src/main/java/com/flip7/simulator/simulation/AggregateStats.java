package com.flip7.simulator.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Summary of a simulation batch: one row per strategy name, in the order the
 * strategies were supplied. This is what reporting sinks receive.
 */
public record AggregateStats(
    @JsonProperty("games_played") int gamesPlayed,
    @JsonProperty("strategies") List<StrategyStats> strategies
) {
    /**
     * Row for a strategy name, if it took part.
     */
    public Optional<StrategyStats> forStrategy(String name) {
        return strategies.stream().filter(s -> s.strategy().equals(name)).findFirst();
    }

    /**
     * Strategy with the most wins; ties go to the one listed first.
     */
    public Optional<StrategyStats> best() {
        StrategyStats best = null;
        for (StrategyStats stats : strategies) {
            if (best == null || stats.wins() > best.wins()) {
                best = stats;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Rows sorted by wins, most first.
     */
    public List<StrategyStats> byWins() {
        return strategies.stream()
                .sorted(Comparator.comparingInt(StrategyStats::wins).reversed())
                .toList();
    }
}
