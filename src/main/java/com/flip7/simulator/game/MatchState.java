package com.flip7.simulator.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Complete state of one match: seats, cards, turn order and the result once decided.
 */
public class MatchState {
    private final List<Player> players;
    private final DeckManager deck;

    private int currentPlayerIndex;
    private int dealerIndex;
    private int roundNumber;
    private boolean over;
    private Player winner;

    public MatchState(List<Player> players, DeckManager deck) {
        if (players.isEmpty()) {
            throw new InvalidConfigurationException("A match needs at least one player");
        }
        this.players = Collections.unmodifiableList(new ArrayList<>(players));
        this.deck = deck;
        this.dealerIndex = 0;
        this.roundNumber = 1;
        this.currentPlayerIndex = 1 % players.size();
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int playerCount() {
        return players.size();
    }

    public Player getPlayer(int seat) {
        return players.get(seat);
    }

    public List<Player> getActivePlayers() {
        return players.stream().filter(Player::isActive).toList();
    }

    public boolean anyActive() {
        for (Player player : players) {
            if (player.isActive()) {
                return true;
            }
        }
        return false;
    }

    public Player getCurrentPlayer() {
        return players.get(currentPlayerIndex);
    }

    /**
     * Advance to the next active seat, wrapping around.
     * Stops back where it started if nobody else is active.
     */
    public void nextPlayer() {
        int start = currentPlayerIndex;
        while (true) {
            currentPlayerIndex = (currentPlayerIndex + 1) % players.size();
            if (players.get(currentPlayerIndex).isActive() || currentPlayerIndex == start) {
                return;
            }
        }
    }

    /**
     * Move to the next round: dealer rotates and the seat after the dealer acts first.
     */
    public void advanceRound() {
        roundNumber++;
        dealerIndex = (dealerIndex + 1) % players.size();
        currentPlayerIndex = (dealerIndex + 1) % players.size();
    }

    public void declareWinner(Player player) {
        this.winner = player;
        this.over = true;
    }

    // ---- Accessors ----

    public DeckManager getDeck() {
        return deck;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public int getDealerIndex() {
        return dealerIndex;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public boolean isOver() {
        return over;
    }

    public Player getWinner() {
        return winner;
    }
}
