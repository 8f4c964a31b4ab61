package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Hits while the estimated bust chance stays at or under a threshold.
 *
 * @param maxBustProbability hit if the bust estimate is at most this (0.0 to 1.0)
 * @param secondChanceAware  double the threshold while holding Second Chance
 */
public record BustProbabilityStrategy(double maxBustProbability, boolean secondChanceAware)
        implements BotStrategy {

    public BustProbabilityStrategy {
        BustOdds.requireProbability("Max bust probability", maxBustProbability);
    }

    public BustProbabilityStrategy(double maxBustProbability) {
        this(maxBustProbability, false);
    }

    @Override
    public boolean shouldHit(Player player, MatchState state) {
        if (state.getDeck().cardsRemaining() == 0) {
            return false;
        }

        double threshold = maxBustProbability;
        if (secondChanceAware && player.hasSecondChance()) {
            threshold = BustOdds.doubled(maxBustProbability);
        }
        return BustOdds.bustProbability(player) <= threshold;
    }

    @Override
    public String name() {
        return "BustProb_" + BustOdds.percent(maxBustProbability) + (secondChanceAware ? "_SC" : "");
    }
}
