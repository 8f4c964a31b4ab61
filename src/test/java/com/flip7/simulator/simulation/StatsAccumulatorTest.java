package com.flip7.simulator.simulation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running totals and the derived statistics.
 */
class StatsAccumulatorTest {

    private static GameResult game(int winner, int rounds, int scoreA, int scoreB) {
        return new GameResult(winner, rounds, List.of(
                new GameResult.PlayerResult("A", scoreA, 1, 0),
                new GameResult.PlayerResult("B", scoreB, 2, 1)));
    }

    @Test
    void testAddGameCountsEverySeat() {
        StatsAccumulator acc = new StatsAccumulator();
        acc.addGame(game(0, 8, 205, 150));
        acc.addGame(game(1, 10, 120, 210));

        List<StrategyStats> rows = acc.toStats();
        StrategyStats a = rows.get(0);
        assertEquals("A", a.strategy());
        assertEquals(2, a.games());
        assertEquals(1, a.wins());
        assertEquals(325, a.totalScore());
        assertEquals(8, a.totalWinRounds());
        assertEquals(2, a.busts());

        StrategyStats b = rows.get(1);
        assertEquals(1, b.wins());
        assertEquals(10, b.totalWinRounds());
        assertEquals(2, b.flip7s());
    }

    @Test
    void testAddSeatIgnoresOtherSeats() {
        StatsAccumulator acc = new StatsAccumulator();
        acc.addSeat(game(1, 9, 100, 200), 0);

        List<StrategyStats> rows = acc.toStats();
        assertEquals(1, rows.size());
        assertEquals(0, rows.get(0).wins());
    }

    @Test
    void testMergeKeepsFirstSeenOrder() {
        StatsAccumulator left = new StatsAccumulator();
        left.register("A");
        left.register("B");
        StatsAccumulator right = new StatsAccumulator();
        right.addGame(game(1, 7, 50, 200));

        left.merge(right);

        List<StrategyStats> rows = left.toStats();
        assertEquals("A", rows.get(0).strategy());
        assertEquals("B", rows.get(1).strategy());
        assertEquals(1, rows.get(1).wins());
    }

    @Test
    void testDerivedValues() {
        StrategyStats stats = new StrategyStats("A", 4, 2, 600, 18, 6, 1);

        assertEquals(0.5, stats.winRate(), 1e-9);
        assertEquals(150.0, stats.avgFinalScore(), 1e-9);
        assertEquals(9.0, stats.avgRoundsToWin(), 1e-9);
        assertEquals(1.5, stats.bustsPerGame(), 1e-9);
    }

    @Test
    void testDerivedValuesWithNoGames() {
        StrategyStats stats = new StrategyStats("A", 0, 0, 0, 0, 0, 0);

        assertEquals(0.0, stats.winRate());
        assertEquals(0.0, stats.avgFinalScore());
        assertEquals(0.0, stats.avgRoundsToWin());
    }

    @Test
    void testBestPrefersFirstOnTie() {
        AggregateStats stats = new AggregateStats(10, List.of(
                new StrategyStats("A", 10, 4, 0, 0, 0, 0),
                new StrategyStats("B", 10, 4, 0, 0, 0, 0),
                new StrategyStats("C", 10, 2, 0, 0, 0, 0)));

        assertEquals("A", stats.best().orElseThrow().strategy());
        assertEquals("C", stats.byWins().get(2).strategy());
        assertTrue(stats.forStrategy("B").isPresent());
        assertTrue(stats.forStrategy("D").isEmpty());
    }
}
