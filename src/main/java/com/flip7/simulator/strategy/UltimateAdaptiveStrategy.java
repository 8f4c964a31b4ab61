package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Adapts to table size, Second Chance and how many opponents are still in the round.
 * Tolerance and point target grow with the player count. Holding Second Chance
 * doubles tolerance and adds 10 to the target.
 */
public record UltimateAdaptiveStrategy() implements BotStrategy {

    static final double BASE_TOLERANCE = 0.20;
    static final double TOLERANCE_PER_EXTRA_PLAYER = 0.02;
    static final int BASE_POINT_TARGET = 40;
    static final int MIN_CARDS = 3;
    static final int FLIP7_CHASE_CARDS = 6;
    static final int PROTECTED_TARGET_BONUS = 10;
    static final int PROTECTED_PUSH_MARGIN = 15;
    static final double HERD_DAMPING = 0.8;

    @Override
    public boolean shouldHit(Player player, MatchState state) {
        int numCards = player.numberCardCount();
        int score = player.currentScore();
        int playerCount = state.playerCount();
        int activePlayers = state.getActivePlayers().size();
        double bustProbability = BustOdds.bustProbability(player);

        double tolerance = BASE_TOLERANCE + (playerCount - 2) * TOLERANCE_PER_EXTRA_PLAYER;
        int pointTarget = BASE_POINT_TARGET + 2 * playerCount;

        if (player.hasSecondChance()) {
            tolerance = BustOdds.doubled(tolerance);
            pointTarget += PROTECTED_TARGET_BONUS;
        }

        if (numCards < MIN_CARDS) {
            return true;
        }

        // One more distinct card completes Flip 7, and a bust is covered
        if (numCards == FLIP7_CHASE_CARDS && player.hasSecondChance()) {
            return true;
        }

        if (score >= pointTarget) {
            if (player.hasSecondChance() && score < pointTarget + PROTECTED_PUSH_MARGIN) {
                return bustProbability <= tolerance;
            }
            return false;
        }

        if (activePlayers <= playerCount / 2.0) {
            tolerance *= HERD_DAMPING;
        }
        return bustProbability <= tolerance;
    }

    @Override
    public String name() {
        return "Ultimate_Adaptive";
    }
}
