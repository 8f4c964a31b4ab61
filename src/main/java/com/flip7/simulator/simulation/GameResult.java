package com.flip7.simulator.simulation;

import java.util.List;

/**
 * Result of a single simulated match.
 */
public record GameResult(
    /**
     * Seat that won.
     */
    int winnerSeat,

    /**
     * Rounds played, including the deciding one.
     */
    int rounds,

    /**
     * Per-seat outcome, in seat order.
     */
    List<PlayerResult> players
) {
    public PlayerResult winner() {
        return players.get(winnerSeat);
    }

    /**
     * One seat's totals over the match.
     */
    public record PlayerResult(String strategyName, int finalScore, int busts, int flip7s) {}
}
