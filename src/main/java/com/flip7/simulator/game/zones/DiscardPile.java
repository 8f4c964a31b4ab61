package com.flip7.simulator.game.zones;

import com.flip7.simulator.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Discard pile - spent cards, most recent at the end.
 * Only busting cards cancelled by Second Chance end up here; hands are
 * dropped at round end without passing through the pile.
 */
public class DiscardPile {
    private final List<Card> cards;

    public DiscardPile() {
        this.cards = new ArrayList<>();
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
     * Remove and return all cards from the pile.
     */
    public List<Card> removeAll() {
        List<Card> removed = new ArrayList<>(cards);
        cards.clear();
        return removed;
    }
}
