package com.flip7.simulator.game;

/**
 * Thrown when a match, strategy or simulation is configured with values
 * that cannot produce a valid game. Raised before any simulation starts.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
