package com.flip7.simulator.simulation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated outcome for one strategy - one row of the results table.
 */
public record StrategyStats(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("games") int games,
    @JsonProperty("wins") int wins,
    @JsonProperty("total_score") long totalScore,
    @JsonProperty("total_win_rounds") long totalWinRounds,
    @JsonProperty("busts") int busts,
    @JsonProperty("flip7s") int flip7s
) {
    @JsonProperty("win_rate")
    public double winRate() {
        return games == 0 ? 0.0 : (double) wins / games;
    }

    @JsonProperty("avg_final_score")
    public double avgFinalScore() {
        return games == 0 ? 0.0 : (double) totalScore / games;
    }

    /**
     * Average rounds in the games this strategy won.
     */
    @JsonProperty("avg_rounds_to_win")
    public double avgRoundsToWin() {
        return (double) totalWinRounds / Math.max(wins, 1);
    }

    @JsonProperty("busts_per_game")
    public double bustsPerGame() {
        return games == 0 ? 0.0 : (double) busts / games;
    }
}
