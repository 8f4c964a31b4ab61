package com.flip7.simulator.game;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flip7.simulator.card.Card;

import java.util.List;

/**
 * What happened in one round.
 */
public record RoundResult(
    @JsonProperty("round") int roundNumber,
    @JsonProperty("dealer") int dealerIndex,
    @JsonProperty("turns") int turnsTaken,
    @JsonProperty("ended_by_flip7") boolean endedByFlip7,
    @JsonProperty("players") List<PlayerRound> players
) {
    /**
     * One seat's outcome for the round.
     */
    public record PlayerRound(
        @JsonProperty("seat") int seat,
        @JsonProperty("status") RoundStatus status,
        @JsonProperty("round_score") int roundScore,
        @JsonProperty("total_score") int totalScore,
        @JsonProperty("hand") List<Card> hand
    ) {}
}
