package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single Flip 7 card - a sealed interface over the three card kinds.
 * Cards are immutable and compared by identity; two "7" cards are distinct objects.
 * Serialized with a "card_type" discriminator when written into reports.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "card_type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = NumberCard.class, name = "number"),
    @JsonSubTypes.Type(value = ActionCard.class, name = "action"),
    @JsonSubTypes.Type(value = ModifierCard.class, name = "modifier")
})
public sealed interface Card permits NumberCard, ActionCard, ModifierCard {

    CardType getCardType();

    default boolean isNumber() {
        return getCardType() == CardType.NUMBER;
    }

    default boolean isAction() {
        return getCardType() == CardType.ACTION;
    }

    default boolean isModifier() {
        return getCardType() == CardType.MODIFIER;
    }

    static NumberCard number(int value) {
        return new NumberCard(value);
    }

    static ActionCard action(ActionType actionType) {
        return new ActionCard(actionType);
    }

    static ModifierCard add(int amount) {
        return new ModifierCard(ModifierType.ADD, amount);
    }

    static ModifierCard multiply(int amount) {
        return new ModifierCard(ModifierType.MULTIPLY, amount);
    }
}
