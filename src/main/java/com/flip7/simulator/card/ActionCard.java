package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Action card: Freeze, Flip Three or Second Chance.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class ActionCard implements Card {
    @JsonProperty("action_type")
    private final ActionType actionType;

    public ActionCard(ActionType actionType) {
        this.actionType = Objects.requireNonNull(actionType, "Action type cannot be null");
    }

    public ActionType getActionType() {
        return actionType;
    }

    @Override
    public CardType getCardType() {
        return CardType.ACTION;
    }

    @Override
    public String toString() {
        return "[" + actionType.getJsonValue() + "]";
    }
}
