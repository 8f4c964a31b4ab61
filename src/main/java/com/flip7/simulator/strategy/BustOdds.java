package com.flip7.simulator.strategy;

import com.flip7.simulator.game.GameRules;
import com.flip7.simulator.game.InvalidConfigurationException;
import com.flip7.simulator.game.Player;

/**
 * Shared bust-risk arithmetic for the strategies.
 */
final class BustOdds {

    private BustOdds() {
        // Utility class - prevent instantiation
    }

    /**
     * Bust estimate: sum of the distinct values held over 78.
     * Each value v appears v times per deck copy, so holding v "covers" v of the 78 number cards.
     * This is a fixed per-copy estimate, not a count of what is left in the deck.
     */
    static double bustProbability(Player player) {
        int bustCards = 0;
        for (int value : player.getHand().distinctNumberValues()) {
            bustCards += value;
        }
        return (double) bustCards / GameRules.NUMBER_CARD_TOTAL;
    }

    /**
     * Twice the threshold, capped at 1, for a protected player.
     */
    static double doubled(double threshold) {
        return Math.min(1.0, threshold * 2.0);
    }

    static String percent(double probability) {
        return Math.round(probability * 100) + "%";
    }

    static void requireProbability(String label, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(label + " must be between 0 and 1, got " + value);
        }
    }

    static void requireNonNegative(String label, int value) {
        if (value < 0) {
            throw new InvalidConfigurationException(label + " must not be negative, got " + value);
        }
    }
}
