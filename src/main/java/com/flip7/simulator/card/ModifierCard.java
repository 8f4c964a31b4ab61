package com.flip7.simulator.card;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Set;

/**
 * Modifier card: +2, +4, +6, +8, +10 or x2.
 */
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class ModifierCard implements Card {
    public static final Set<Integer> ADD_AMOUNTS = Set.of(2, 4, 6, 8, 10);
    public static final int MULTIPLY_AMOUNT = 2;

    @JsonProperty("modifier_type")
    private final ModifierType modifierType;

    @JsonProperty("amount")
    private final int amount;

    public ModifierCard(ModifierType modifierType, int amount) {
        this.modifierType = Objects.requireNonNull(modifierType, "Modifier type cannot be null");
        boolean valid = switch (modifierType) {
            case ADD -> ADD_AMOUNTS.contains(amount);
            case MULTIPLY -> amount == MULTIPLY_AMOUNT;
        };
        if (!valid) {
            throw new IllegalArgumentException("Invalid amount " + amount + " for " + modifierType + " modifier");
        }
        this.amount = amount;
    }

    public ModifierType getModifierType() {
        return modifierType;
    }

    public int getAmount() {
        return amount;
    }

    public boolean isMultiply() {
        return modifierType == ModifierType.MULTIPLY;
    }

    @Override
    public CardType getCardType() {
        return CardType.MODIFIER;
    }

    @Override
    public String toString() {
        return isMultiply() ? "[x" + amount + "]" : "[+" + amount + "]";
    }
}
