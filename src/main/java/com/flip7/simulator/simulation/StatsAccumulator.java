package com.flip7.simulator.simulation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable running totals keyed by strategy name, in first-seen order.
 * Not thread-safe: each worker owns one and they are merged afterwards.
 */
public class StatsAccumulator {
    private final Map<String, Row> rows = new LinkedHashMap<>();

    /**
     * Register a strategy so it appears in the output even with no games.
     */
    public void register(String strategyName) {
        rows.computeIfAbsent(strategyName, k -> new Row());
    }

    /**
     * Count every seat of a game.
     */
    public void addGame(GameResult result) {
        for (int seat = 0; seat < result.players().size(); seat++) {
            addSeat(result, seat);
        }
    }

    /**
     * Count one seat of a game.
     */
    public void addSeat(GameResult result, int seat) {
        GameResult.PlayerResult player = result.players().get(seat);
        Row row = rows.computeIfAbsent(player.strategyName(), k -> new Row());
        row.games++;
        row.totalScore += player.finalScore();
        row.busts += player.busts();
        row.flip7s += player.flip7s();
        if (result.winnerSeat() == seat) {
            row.wins++;
            row.totalWinRounds += result.rounds();
        }
    }

    public void merge(StatsAccumulator other) {
        for (Map.Entry<String, Row> entry : other.rows.entrySet()) {
            Row row = rows.computeIfAbsent(entry.getKey(), k -> new Row());
            row.add(entry.getValue());
        }
    }

    public List<StrategyStats> toStats() {
        return rows.entrySet().stream()
                .map(e -> e.getValue().toStats(e.getKey()))
                .toList();
    }

    private static final class Row {
        int games;
        int wins;
        long totalScore;
        long totalWinRounds;
        int busts;
        int flip7s;

        void add(Row other) {
            games += other.games;
            wins += other.wins;
            totalScore += other.totalScore;
            totalWinRounds += other.totalWinRounds;
            busts += other.busts;
            flip7s += other.flip7s;
        }

        StrategyStats toStats(String name) {
            return new StrategyStats(name, games, wins, totalScore, totalWinRounds, busts, flip7s);
        }
    }
}
