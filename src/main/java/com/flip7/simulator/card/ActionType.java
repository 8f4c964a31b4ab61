package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Action card kinds.
 * FREEZE is recognized but has no effect during turn resolution.
 */
public enum ActionType {
    FREEZE("freeze"),
    FLIP_THREE("flipThree"),
    SECOND_CHANCE("secondChance");

    private final String jsonValue;

    ActionType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
