package com.flip7.simulator.game;

import com.flip7.simulator.card.ActionType;
import com.flip7.simulator.card.Card;
import com.flip7.simulator.card.ModifierCard;
import com.flip7.simulator.game.zones.DiscardPile;
import com.flip7.simulator.game.zones.DrawPile;
import com.flip7.simulator.rng.GameRng;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the draw pile, the discard pile and the match's RNG.
 * {@link #draw()} always returns a card: it reshuffles the discard pile when the
 * draw pile runs dry and, failing that, synthesizes a small emergency deck.
 */
public class DeckManager {
    /** Cards in one copy of the base deck: 79 numbers, 16 modifiers, 9 actions. */
    public static final int CARDS_PER_COPY = 104;

    private final DrawPile drawPile;
    private final DiscardPile discardPile;
    private final GameRng rng;
    private final boolean verbose;

    private int reshuffles;
    private int emergencyRefills;

    public DeckManager(DrawPile drawPile, GameRng rng, boolean verbose) {
        this.drawPile = drawPile;
        this.discardPile = new DiscardPile();
        this.rng = rng;
        this.verbose = verbose;
    }

    /**
     * Build and shuffle a full deck sized for the given number of players.
     */
    public static DeckManager forPlayers(int playerCount, GameRng rng, boolean verbose) {
        DrawPile pile = new DrawPile(deckCopies(playerCount) * CARDS_PER_COPY);
        pile.addAll(buildDeck(playerCount, rng));
        return new DeckManager(pile, rng, verbose);
    }

    /**
     * Number of base-deck copies for a player count: max(2, ceil((players + 2) / 3)).
     */
    public static int deckCopies(int playerCount) {
        if (playerCount < 1) {
            throw new InvalidConfigurationException("Player count must be at least 1, got " + playerCount);
        }
        int copies = (playerCount + 2 + 2) / 3;
        return Math.max(2, copies);
    }

    /**
     * Build the shuffled card list for a player count.
     */
    public static List<Card> buildDeck(int playerCount, GameRng rng) {
        int copies = deckCopies(playerCount);
        List<Card> deck = new ArrayList<>(copies * CARDS_PER_COPY);

        for (int copy = 0; copy < copies; copy++) {
            // Number cards: one 0, otherwise as many copies as the face value
            for (int value = 0; value <= 12; value++) {
                int count = value > 0 ? value : 1;
                for (int i = 0; i < count; i++) {
                    deck.add(Card.number(value));
                }
            }

            for (int amount : new int[] {2, 4, 6, 8, 10}) {
                for (int i = 0; i < 3; i++) {
                    deck.add(Card.add(amount));
                }
            }
            deck.add(Card.multiply(ModifierCard.MULTIPLY_AMOUNT));

            for (ActionType action : ActionType.values()) {
                for (int i = 0; i < 3; i++) {
                    deck.add(Card.action(action));
                }
            }
        }

        rng.shuffle(deck);
        return deck;
    }

    /**
     * Number-only deck used when both piles are empty: max(1, v / 2) copies of each value.
     */
    public static List<Card> buildEmergencyDeck(GameRng rng) {
        List<Card> deck = new ArrayList<>();
        for (int value = 0; value <= 12; value++) {
            int count = Math.max(1, value / 2);
            for (int i = 0; i < count; i++) {
                deck.add(Card.number(value));
            }
        }
        rng.shuffle(deck);
        return deck;
    }

    /**
     * Draw the top card, refilling the draw pile first if it is empty.
     */
    public Card draw() {
        if (drawPile.isEmpty() && !discardPile.isEmpty()) {
            List<Card> recycled = discardPile.removeAll();
            rng.shuffle(recycled);
            drawPile.addAll(recycled);
            reshuffles++;
            if (verbose) {
                System.out.println("  (reshuffled " + recycled.size() + " discarded cards into the deck)");
            }
        }

        if (drawPile.isEmpty()) {
            List<Card> emergency = buildEmergencyDeck(rng);
            drawPile.addAll(emergency);
            emergencyRefills++;
            if (verbose) {
                System.out.println("  (deck exhausted - added " + emergency.size() + " emergency number cards)");
            }
        }

        return drawPile.draw();
    }

    public void discard(Card card) {
        discardPile.add(card);
    }

    /**
     * Cards still available to draw without synthesizing new ones.
     */
    public int cardsRemaining() {
        return drawPile.size() + discardPile.size();
    }

    public DrawPile getDrawPile() {
        return drawPile;
    }

    public DiscardPile getDiscardPile() {
        return discardPile;
    }

    public int getReshuffles() {
        return reshuffles;
    }

    public int getEmergencyRefills() {
        return emergencyRefills;
    }
}
