package com.flip7.simulator.game.zones;

import com.flip7.simulator.card.Card;
import com.flip7.simulator.card.ModifierCard;
import com.flip7.simulator.card.NumberCard;
import com.flip7.simulator.game.GameRules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cards a player has drawn this round, in draw order, and the scoring rules over them.
 */
public class Hand {
    private final List<Card> cards;

    public Hand() {
        this.cards = new ArrayList<>();
    }

    public void clear() {
        cards.clear();
    }

    public void add(Card card) {
        cards.add(card);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }

    /**
     * Values of all number cards, in draw order.
     */
    public List<Integer> numberValues() {
        List<Integer> values = new ArrayList<>();
        for (Card card : cards) {
            if (card instanceof NumberCard number) {
                values.add(number.getValue());
            }
        }
        return values;
    }

    public Set<Integer> distinctNumberValues() {
        return new HashSet<>(numberValues());
    }

    public int numberCardCount() {
        int count = 0;
        for (Card card : cards) {
            if (card.isNumber()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether taking this card would bust: a number whose value is already held.
     */
    public boolean wouldBust(Card card) {
        if (!(card instanceof NumberCard number)) {
            return false;
        }
        return numberValues().contains(number.getValue());
    }

    public boolean hasFlip7() {
        return distinctNumberValues().size() == GameRules.FLIP7_CARD_COUNT;
    }

    /**
     * Round score for this hand.
     * Numbers are summed, then every x2 is applied in hand order, then every
     * +N is added, then the Flip 7 bonus. Swapping the multiply and add steps
     * changes the result.
     */
    public int score(boolean isFlip7) {
        int total = 0;
        for (int value : numberValues()) {
            total += value;
        }

        for (Card card : cards) {
            if (card instanceof ModifierCard modifier && modifier.isMultiply()) {
                total *= modifier.getAmount();
            }
        }

        for (Card card : cards) {
            if (card instanceof ModifierCard modifier && !modifier.isMultiply()) {
                total += modifier.getAmount();
            }
        }

        if (isFlip7) {
            total += GameRules.FLIP7_BONUS;
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            sb.append(card);
        }
        return sb.toString();
    }
}
