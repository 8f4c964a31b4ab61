package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Modifier card kinds.
 */
public enum ModifierType {
    ADD("add"),
    MULTIPLY("multiply");

    private final String jsonValue;

    ModifierType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
