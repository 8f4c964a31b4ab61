package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Card floor, point ceiling and bust threshold combined.
 * <ol>
 *   <li>Below {@code minCards} number cards: always hit.</li>
 *   <li>At or above {@code targetPoints}: stay, except a second-chance-aware
 *       bot holding Second Chance keeps going until target + 10.</li>
 *   <li>Otherwise hit while the bust estimate is at most {@code maxBustProbability}
 *       (doubled while protected, if second-chance-aware).</li>
 * </ol>
 */
public record HybridStrategy(int minCards, int targetPoints, double maxBustProbability,
                             boolean secondChanceAware) implements BotStrategy {

    static final int PROTECTED_POINT_MARGIN = 10;

    public HybridStrategy {
        BustOdds.requireNonNegative("Minimum cards", minCards);
        BustOdds.requireNonNegative("Target points", targetPoints);
        BustOdds.requireProbability("Max bust probability", maxBustProbability);
    }

    public HybridStrategy(int minCards, int targetPoints, double maxBustProbability) {
        this(minCards, targetPoints, maxBustProbability, false);
    }

    @Override
    public boolean shouldHit(Player player, MatchState state) {
        if (player.numberCardCount() < minCards) {
            return true;
        }

        boolean protectedRun = secondChanceAware && player.hasSecondChance();
        int score = player.currentScore();
        if (score >= targetPoints && !(protectedRun && score < targetPoints + PROTECTED_POINT_MARGIN)) {
            return false;
        }

        double threshold = protectedRun ? BustOdds.doubled(maxBustProbability) : maxBustProbability;
        return BustOdds.bustProbability(player) <= threshold;
    }

    @Override
    public String name() {
        return "Hybrid_C" + minCards + "_P" + targetPoints + "_B" + BustOdds.percent(maxBustProbability)
                + (secondChanceAware ? "_SC" : "");
    }
}
