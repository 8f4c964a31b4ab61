package com.flip7.simulator.simulation;

import com.flip7.simulator.game.MatchController;
import com.flip7.simulator.game.MatchResult;
import com.flip7.simulator.game.Player;
import com.flip7.simulator.rng.GameRng;
import com.flip7.simulator.strategy.BotStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs single matches and condenses them into {@link GameResult}s.
 */
public final class SimulationEngine {

    private SimulationEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Run a complete match.
     * @param strategies one strategy per seat
     * @param seed Random seed for reproducibility
     * @param verbose Whether to print the match trace
     * @return The game result
     */
    public static GameResult runGame(List<BotStrategy> strategies, long seed, boolean verbose) {
        if (verbose) {
            System.out.println("=== Game Start (seed: " + seed + ") ===");
        }
        return runGame(strategies, new GameRng(seed), verbose);
    }

    /**
     * Run a complete match drawing all randomness from the given RNG.
     */
    public static GameResult runGame(List<BotStrategy> strategies, GameRng rng, boolean verbose) {
        MatchController controller = new MatchController(strategies, rng, verbose);
        MatchResult match = controller.playMatch();
        return toGameResult(controller, match);
    }

    /**
     * Run a complete match and keep the full round-by-round record.
     */
    public static MatchResult traceGame(List<BotStrategy> strategies, long seed, boolean verbose) {
        return new MatchController(strategies, new GameRng(seed), verbose).playMatch();
    }

    private static GameResult toGameResult(MatchController controller, MatchResult match) {
        List<GameResult.PlayerResult> players = new ArrayList<>();
        for (Player player : controller.getState().getPlayers()) {
            players.add(new GameResult.PlayerResult(player.getName(), player.getTotalScore(),
                    player.getBusts(), player.getFlip7s()));
        }
        return new GameResult(match.winnerSeat(), match.roundsPlayed(), players);
    }
}
