package com.flip7.simulator.game;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final state of a completed match.
 */
public record MatchResult(
    @JsonProperty("winner") int winnerSeat,
    @JsonProperty("rounds_played") int roundsPlayed,
    @JsonProperty("final_scores") List<Integer> finalScores,
    @JsonProperty("rounds") List<RoundResult> rounds,
    @JsonProperty("reshuffles") int reshuffles,
    @JsonProperty("emergency_refills") int emergencyRefills
) {}
