package com.flip7.simulator.game.zones;

import com.flip7.simulator.card.Card;
import com.flip7.simulator.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the draw pile stack.
 */
class DrawPileTest {

    @Test
    void testDrawsFromTop() {
        DrawPile pile = new DrawPile();
        Card first = Card.number(1);
        Card second = Card.number(2);
        pile.addCard(first);
        pile.addCard(second);

        Card top = Card.number(3);
        pile.putOnTop(top);

        assertSame(top, pile.draw());
        assertSame(first, pile.draw());
        assertSame(second, pile.draw());
        assertTrue(pile.isEmpty());
    }

    @Test
    void testDrawFromEmptyPileThrows() {
        assertThrows(NoSuchElementException.class, () -> new DrawPile().draw());
    }

    @Test
    void testShuffleKeepsCards() {
        DrawPile pile = new DrawPile();
        for (int value = 0; value <= 12; value++) {
            pile.addCard(Card.number(value));
        }
        var before = pile.getCards();

        pile.shuffle(new GameRng(99));

        assertEquals(13, pile.size());
        assertTrue(pile.getCards().containsAll(before));
    }
}
