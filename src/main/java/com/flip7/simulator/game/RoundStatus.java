package com.flip7.simulator.game;

/**
 * Where a player stands within the current round.
 * Every status other than ACTIVE is terminal until the next round starts.
 */
public enum RoundStatus {
    ACTIVE,
    STAYED,
    BUSTED,
    FLIP7;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
