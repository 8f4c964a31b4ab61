package com.flip7.simulator.strategy;

import com.flip7.simulator.game.MatchState;
import com.flip7.simulator.game.Player;

/**
 * Hit-or-stay policy for a bot seat.
 * The set of policies is closed; each one is a pure function of its
 * construction parameters, the player and the match state.
 */
public sealed interface BotStrategy
        permits BustProbabilityStrategy, CardCountStrategy, PointThresholdStrategy,
                HybridStrategy, UltimateAdaptiveStrategy {

    /**
     * Decide whether the player draws again.
     * Only called for a player who is still active this round.
     */
    boolean shouldHit(Player player, MatchState state);

    /**
     * Display name; statistics are keyed by it.
     */
    String name();
}
