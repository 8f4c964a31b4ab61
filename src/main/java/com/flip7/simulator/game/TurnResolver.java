package com.flip7.simulator.game;

import com.flip7.simulator.card.Card;
import com.flip7.simulator.strategy.BotStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves turns and drives a round to completion.
 * A round ends when nobody is active, when someone completes Flip 7, or at the turn limit.
 */
public final class TurnResolver {

    private TurnResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Reset every player and deal one card each, in seat order.
     * Action cards dealt here take effect like drawn ones.
     */
    public static void startRound(MatchState state, boolean verbose) {
        for (Player player : state.getPlayers()) {
            player.resetForRound();
        }

        DeckManager deck = state.getDeck();
        for (Player player : state.getPlayers()) {
            player.takeCard(deck.draw());
        }

        if (verbose) {
            System.out.println();
            System.out.println("=== Round " + state.getRoundNumber() + " ===");
            System.out.println("Dealer: " + state.getPlayer(state.getDealerIndex()).getName());
            for (Player player : state.getPlayers()) {
                System.out.println("  " + player.getName() + " dealt " + player.getHand());
            }
        }
    }

    /**
     * Play one turn for a player.
     *
     * @return false if the round is over for everyone (Flip 7), true otherwise
     */
    public static boolean playTurn(MatchState state, Player player, BotStrategy strategy, boolean verbose) {
        if (!player.isActive()) {
            return true;
        }

        if (player.hasFlip7()) {
            player.completeFlip7();
            if (verbose) {
                System.out.println("  " + player.getName() + " achieved FLIP 7! Score: " + player.getRoundScore());
            }
            return false;
        }

        if (player.numberCardCount() >= GameRules.MAX_NUMBER_CARDS) {
            player.stay();
            if (verbose) {
                System.out.println("  " + player.getName() + " forced to STAY (" + GameRules.MAX_NUMBER_CARDS
                        + "+ cards) with " + player.getRoundScore() + " points");
            }
            return true;
        }

        if (!strategy.shouldHit(player, state)) {
            player.stay();
            if (verbose) {
                System.out.println("  " + player.getName() + " STAYS with " + player.getRoundScore() + " points");
            }
            return true;
        }

        int draws = player.hasFlipThreePending() ? GameRules.FLIP_THREE_DRAWS : 1;
        StringBuilder trace = verbose ? new StringBuilder() : null;
        if (verbose) {
            trace.append("  ").append(player.getName()).append(" HITS (drawing ").append(draws).append(" card(s))");
        }

        DeckManager deck = state.getDeck();
        for (int i = 0; i < draws; i++) {
            Card card = deck.draw();

            if (player.wouldBust(card)) {
                if (player.hasSecondChance()) {
                    player.consumeSecondChance();
                    deck.discard(card);
                    if (verbose) {
                        trace.append(" drew ").append(card).append(" (SECOND CHANCE USED!)");
                    }
                    continue;
                }

                player.bust();
                if (verbose) {
                    trace.append(" drew ").append(card).append(" - BUST!");
                    System.out.println(trace);
                }
                return true;
            }

            player.takeCard(card);
            if (verbose) {
                trace.append(' ').append(card);
            }
        }

        if (verbose) {
            trace.append(" (score: ").append(player.currentScore()).append(')');
            System.out.println(trace);
        }

        // Seven distinct values mid-batch still has to survive the rest of the batch
        if (player.hasFlip7()) {
            player.completeFlip7();
            if (verbose) {
                System.out.println("  " + player.getName() + " achieved FLIP 7! Score: " + player.getRoundScore());
            }
            return false;
        }

        if (draws == GameRules.FLIP_THREE_DRAWS) {
            player.clearFlipThree();
        }
        return true;
    }

    /**
     * Play a full round starting from the current player, then bank every round score.
     * Players still active when the round stops score nothing for it.
     */
    public static RoundResult playRound(MatchState state, List<BotStrategy> strategies, boolean verbose) {
        startRound(state, verbose);

        int turns = 0;
        boolean endedByFlip7 = false;
        while (state.anyActive() && turns < GameRules.MAX_TURNS_PER_ROUND) {
            Player current = state.getCurrentPlayer();
            boolean roundContinues = playTurn(state, current, strategies.get(current.getSeat()), verbose);
            turns++;

            if (!roundContinues) {
                endedByFlip7 = true;
                break;
            }
            state.nextPlayer();
        }

        List<RoundResult.PlayerRound> outcomes = new ArrayList<>(state.playerCount());
        for (Player player : state.getPlayers()) {
            player.bankRoundScore();
            outcomes.add(new RoundResult.PlayerRound(player.getSeat(), player.getStatus(),
                    player.getRoundScore(), player.getTotalScore(), player.getHand().getCards()));
            if (verbose) {
                System.out.println(player.getName() + ": +" + player.getRoundScore()
                        + " (Total: " + player.getTotalScore() + ")");
            }
        }

        return new RoundResult(state.getRoundNumber(), state.getDealerIndex(), turns, endedByFlip7, outcomes);
    }
}
