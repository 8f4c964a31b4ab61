package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Hits until the hand is worth at least the target, bonus excluded.
 */
public record PointThresholdStrategy(int targetPoints) implements BotStrategy {

    public PointThresholdStrategy {
        BustOdds.requireNonNegative("Target points", targetPoints);
    }

    @Override
    public boolean shouldHit(Player player, MatchState state) {
        return player.currentScore() < targetPoints;
    }

    @Override
    public String name() {
        return "PointThreshold_" + targetPoints;
    }
}
