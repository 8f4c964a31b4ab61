package com.flip7.simulator.game;

import com.flip7.simulator.card.ActionCard;
import com.flip7.simulator.card.ActionType;
import com.flip7.simulator.card.Card;
import com.flip7.simulator.rng.GameRng;
import com.flip7.simulator.strategy.BotStrategy;
import com.flip7.simulator.strategy.CardCountStrategy;
import com.flip7.simulator.strategy.PointThresholdStrategy;
import com.flip7.simulator.strategy.UltimateAdaptiveStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end match tests.
 */
class MatchControllerTest {

    @Test
    void testAlwaysStayMatchTakesOneTurnPerPlayerPerRound() {
        List<BotStrategy> strategies = List.of(new PointThresholdStrategy(0), new PointThresholdStrategy(0));
        MatchController controller = new MatchController(strategies, new GameRng(2024), false);

        MatchResult result = controller.playMatch();

        assertEquals(result.roundsPlayed(), result.rounds().size());
        for (RoundResult round : result.rounds()) {
            assertEquals(2, round.turnsTaken(), "Round " + round.roundNumber());
            assertFalse(round.endedByFlip7());
            for (RoundResult.PlayerRound player : round.players()) {
                assertEquals(RoundStatus.STAYED, player.status());
                assertEquals(1, player.hand().size());
            }
        }
    }

    @Test
    void testWinnerIsFirstSeatToReachWinningScore() {
        for (long seed = 1; seed <= 10; seed++) {
            List<BotStrategy> strategies = List.of(new PointThresholdStrategy(0), new PointThresholdStrategy(0));
            MatchController controller = new MatchController(strategies, new GameRng(seed), false);

            MatchResult result = controller.playMatch();
            List<Integer> scores = result.finalScores();

            assertTrue(scores.get(result.winnerSeat()) >= GameRules.WINNING_SCORE);
            for (int seat = 0; seat < result.winnerSeat(); seat++) {
                assertTrue(scores.get(seat) < GameRules.WINNING_SCORE,
                        "Earlier seat " + seat + " would have won (seed " + seed + ")");
            }

            // Nobody had crossed the line before the deciding round
            List<RoundResult> rounds = result.rounds();
            if (rounds.size() > 1) {
                for (RoundResult.PlayerRound player : rounds.get(rounds.size() - 2).players()) {
                    assertTrue(player.totalScore() < GameRules.WINNING_SCORE);
                }
            }
            assertTrue(controller.getState().isOver());
            assertSame(controller.getState().getPlayer(result.winnerSeat()), controller.getState().getWinner());
        }
    }

    @Test
    void testDealerRotatesEveryRound() {
        List<BotStrategy> strategies = List.of(new PointThresholdStrategy(0), new PointThresholdStrategy(0),
                new PointThresholdStrategy(0));
        MatchResult result = new MatchController(strategies, new GameRng(5), false).playMatch();

        for (int i = 0; i < result.rounds().size(); i++) {
            RoundResult round = result.rounds().get(i);
            assertEquals(i + 1, round.roundNumber());
            assertEquals(i % 3, round.dealerIndex());
        }
    }

    @Test
    void testTotalsOnlyGrow() {
        List<BotStrategy> strategies = List.of(new UltimateAdaptiveStrategy(), new CardCountStrategy(4, true));
        MatchResult result = new MatchController(strategies, new GameRng(31), false).playMatch();

        int[] previous = new int[2];
        for (RoundResult round : result.rounds()) {
            for (RoundResult.PlayerRound player : round.players()) {
                assertEquals(previous[player.seat()] + player.roundScore(), player.totalScore());
                assertTrue(player.roundScore() >= 0);
                previous[player.seat()] = player.totalScore();
            }
        }
    }

    @Test
    void testCardCountBotStopsAtExactlyFiveNumberCards() {
        int checkedRounds = 0;
        for (long seed = 100; seed < 120; seed++) {
            List<BotStrategy> strategies = List.of(new CardCountStrategy(5), new PointThresholdStrategy(20));
            MatchResult result = new MatchController(strategies, new GameRng(seed), false).playMatch();

            for (RoundResult round : result.rounds()) {
                RoundResult.PlayerRound bot = round.players().get(0);
                if (bot.status() != RoundStatus.STAYED) {
                    continue;
                }
                long numbers = bot.hand().stream().filter(Card::isNumber).count();
                assertTrue(numbers >= 5, "Stayed early with " + numbers + " cards (seed " + seed + ")");

                boolean drewFlipThree = bot.hand().stream()
                        .anyMatch(c -> c instanceof ActionCard a && a.getActionType() == ActionType.FLIP_THREE);
                if (!drewFlipThree) {
                    // One card per hit, so it stops the moment it holds five
                    assertEquals(5, numbers, "Kept hitting past five (seed " + seed + ")");
                    checkedRounds++;
                }
            }
        }
        assertTrue(checkedRounds > 0, "Expected rounds where the bot stayed without Flip Three");
    }

    @Test
    void testSameSeedReplaysSameMatch() {
        List<BotStrategy> strategies = List.of(new UltimateAdaptiveStrategy(), new PointThresholdStrategy(30),
                new CardCountStrategy(5, true));

        MatchResult first = new MatchController(strategies, new GameRng(404), false).playMatch();
        MatchResult second = new MatchController(strategies, new GameRng(404), false).playMatch();

        assertEquals(first.winnerSeat(), second.winnerSeat());
        assertEquals(first.roundsPlayed(), second.roundsPlayed());
        assertEquals(first.finalScores(), second.finalScores());
    }

    @Test
    void testNoStrategiesRejected() {
        assertThrows(InvalidConfigurationException.class,
                () -> new MatchController(List.of(), new GameRng(1), false));
    }
}
