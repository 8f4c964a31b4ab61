package com.flip7.simulator.game;

import com.flip7.simulator.rng.GameRng;
import com.flip7.simulator.strategy.BotStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a match: rounds repeat until someone reaches the winning score.
 * Seat i is played by strategy i.
 */
public class MatchController {
    private final List<BotStrategy> strategies;
    private final MatchState state;
    private final boolean verbose;

    /**
     * Set up a match with a freshly built deck.
     */
    public MatchController(List<BotStrategy> strategies, GameRng rng, boolean verbose) {
        this(strategies, DeckManager.forPlayers(requireStrategies(strategies).size(), rng, verbose), verbose);
    }

    /**
     * Set up a match over a prepared deck (used to stack cards in tests).
     */
    public MatchController(List<BotStrategy> strategies, DeckManager deck, boolean verbose) {
        this.strategies = List.copyOf(requireStrategies(strategies));
        List<Player> players = new ArrayList<>(strategies.size());
        for (int seat = 0; seat < strategies.size(); seat++) {
            players.add(new Player(seat, strategies.get(seat).name()));
        }
        this.state = new MatchState(players, deck);
        this.verbose = verbose;
    }

    private static List<BotStrategy> requireStrategies(List<BotStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new InvalidConfigurationException("A match needs at least one strategy");
        }
        return strategies;
    }

    /**
     * Play rounds until the first seat (in seat order) at or above the winning score wins.
     */
    public MatchResult playMatch() {
        List<RoundResult> rounds = new ArrayList<>();

        while (!state.isOver()) {
            rounds.add(TurnResolver.playRound(state, strategies, verbose));

            Player winner = findWinner();
            if (winner != null) {
                state.declareWinner(winner);
                if (verbose) {
                    System.out.println();
                    System.out.println(winner.getName() + " WINS with " + winner.getTotalScore()
                            + " points after " + state.getRoundNumber() + " rounds!");
                }
                break;
            }

            state.advanceRound();
        }

        List<Integer> finalScores = state.getPlayers().stream().map(Player::getTotalScore).toList();
        return new MatchResult(state.getWinner().getSeat(), state.getRoundNumber(), finalScores, rounds,
                state.getDeck().getReshuffles(), state.getDeck().getEmergencyRefills());
    }

    private Player findWinner() {
        for (Player player : state.getPlayers()) {
            if (player.getTotalScore() >= GameRules.WINNING_SCORE) {
                return player;
            }
        }
        return null;
    }

    public MatchState getState() {
        return state;
    }
}
