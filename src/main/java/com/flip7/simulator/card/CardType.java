package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three kinds of Flip 7 card.
 */
public enum CardType {
    NUMBER("number"),
    ACTION("action"),
    MODIFIER("modifier");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
