package com.flip7.simulator.game.zones;

import com.flip7.simulator.card.Card;
import com.flip7.simulator.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Draw pile - ordered stack of face-down cards.
 * Top of the pile is at index 0.
 */
public class DrawPile {
    private Deque<Card> cards;

    public DrawPile() {
        this.cards = new ArrayDeque<>();
    }

    public DrawPile(int capacity) {
        this.cards = new ArrayDeque<>(capacity);
    }

    /**
     * Add a card to the bottom of the pile.
     */
    public void addCard(Card card) {
        cards.addLast(card);
    }

    public void addAll(List<? extends Card> toAdd) {
        for (Card card : toAdd) {
            cards.addLast(card);
        }
    }

    /**
     * Put a card on top of the pile so it is the next one drawn.
     */
    public void putOnTop(Card card) {
        cards.addFirst(card);
    }

    /**
     * Draw the top card.
     * @throws NoSuchElementException if the pile is empty
     */
    public Card draw() {
        Card card = cards.pollFirst();
        if (card == null) {
            throw new NoSuchElementException("Cannot draw from empty pile");
        }
        return card;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Shuffle the pile using the provided RNG.
     */
    public void shuffle(GameRng rng) {
        List<Card> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Get an unmodifiable view of the cards, top first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
