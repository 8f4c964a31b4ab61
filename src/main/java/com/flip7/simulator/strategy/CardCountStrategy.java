package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Hits until holding a target number of number cards.
 *
 * @param targetCount       stop once this many number cards are held
 * @param secondChanceAware go for one more card while holding Second Chance
 */
public record CardCountStrategy(int targetCount, boolean secondChanceAware) implements BotStrategy {

    public CardCountStrategy {
        BustOdds.requireNonNegative("Target card count", targetCount);
    }

    public CardCountStrategy(int targetCount) {
        this(targetCount, false);
    }

    @Override
    public boolean shouldHit(Player player, MatchState state) {
        int target = targetCount;
        if (secondChanceAware && player.hasSecondChance()) {
            target = targetCount + 1;
        }
        return player.numberCardCount() < target;
    }

    @Override
    public String name() {
        return "CardCount_" + targetCount + (secondChanceAware ? "_SC" : "");
    }
}
