package com.flip7.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the experiment subcommand's option handling.
 */
class ExperimentCommandTest {

    @TempDir
    Path tempDir;

    private static int execute(String... args) {
        return new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Test
    void testPresetAndCustomPoolRejectedTogether() {
        assertEquals(1, execute("experiment", "--preset", "cards", "-S", "adaptive", "-g", "1"));
    }

    @Test
    void testSingleStrategyPoolRejected() {
        assertEquals(1, execute("experiment", "-S", "adaptive", "-g", "1"));
    }

    @Test
    void testNonPositiveGamesRejected() {
        assertEquals(1, execute("experiment", "-S", "adaptive", "-S", "cards:4", "-g", "0"));
    }

    @Test
    void testChampionshipSeatsWholePoolAtOneTable() throws Exception {
        Path out = tempDir.resolve("championship.json");

        assertEquals(0, execute("experiment", "--preset", "championship", "-g", "4", "-s", "9",
                "--sequential", "--json", out.toString()));

        JsonNode root = new ObjectMapper().readTree(out.toFile());
        assertEquals(4, root.get("games_per_strategy").asInt());
        JsonNode rows = root.get("results");
        assertEquals(9, rows.size());
        int wins = 0;
        for (JsonNode row : rows) {
            // Every strategy sat at every game
            assertEquals(4, row.get("games").asInt(), row.toString());
            wins += row.get("wins").asInt();
        }
        assertEquals(4, wins);
    }

    @Test
    void testCustomPoolRunsRoundRobin() throws Exception {
        Path out = tempDir.resolve("custom.json");

        assertEquals(0, execute("experiment", "-S", "cards:3", "-S", "points:40", "-S", "adaptive",
                "-g", "3", "-s", "5", "--sequential", "--json", out.toString()));

        JsonNode rows = new ObjectMapper().readTree(out.toFile()).get("results");
        assertEquals(3, rows.size());
        for (JsonNode row : rows) {
            assertEquals(3, row.get("games").asInt());
        }
    }
}
