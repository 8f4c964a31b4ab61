package com.flip7.simulator.game;

/**
 * Fixed rule constants for Flip 7 matches.
 */
public final class GameRules {

    /** Cumulative score that ends the match. */
    public static final int WINNING_SCORE = 200;

    /** Flat bonus for holding seven distinct number values. */
    public static final int FLIP7_BONUS = 15;

    /** Distinct number values needed for Flip 7. */
    public static final int FLIP7_CARD_COUNT = 7;

    /** Number-card count at which a player is forced to stay. */
    public static final int MAX_NUMBER_CARDS = 10;

    /** Turn limit per round; guards against strategies that never finish. */
    public static final int MAX_TURNS_PER_ROUND = 100;

    /** Sum of 0..12, the number-card weight of a single deck copy. */
    public static final int NUMBER_CARD_TOTAL = 78;

    /** Cards drawn on a hit while Flip Three is pending. */
    public static final int FLIP_THREE_DRAWS = 3;

    private GameRules() {
        // Constants holder - prevent instantiation
    }
}
