package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number card with a face value from 0 to 12.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class NumberCard implements Card {
    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 12;

    @JsonProperty("value")
    private final int value;

    public NumberCard(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException("Number card value out of range: " + value);
        }
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public CardType getCardType() {
        return CardType.NUMBER;
    }

    @Override
    public String toString() {
        return "[" + value + "]";
    }
}
