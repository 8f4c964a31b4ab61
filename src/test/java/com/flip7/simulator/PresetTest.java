package com.flip7.simulator;

import com.flip7.simulator.strategy.BotStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in experiment pools.
 */
class PresetTest {

    private static List<String> names(Main.Preset preset) {
        return preset.strategies().stream().map(BotStrategy::name).toList();
    }

    @Test
    void testBustPoolCoversZeroToHundredPercent() {
        List<String> names = names(Main.Preset.BUST);

        assertEquals(21, names.size());
        assertEquals("BustProb_0%", names.get(0));
        assertEquals("BustProb_5%", names.get(1));
        assertEquals("BustProb_35%", names.get(7));
        assertEquals("BustProb_100%", names.get(20));
    }

    @Test
    void testCardPool() {
        assertEquals(List.of("CardCount_2", "CardCount_3", "CardCount_4", "CardCount_5", "CardCount_6",
                "CardCount_7"), names(Main.Preset.CARDS));
    }

    @Test
    void testPointPool() {
        List<String> names = names(Main.Preset.POINTS);

        assertEquals(13, names.size());
        assertEquals("PointThreshold_20", names.get(0));
        assertEquals("PointThreshold_80", names.get(12));
    }

    @Test
    void testChampionshipPool() {
        assertEquals(List.of("BustProb_15%", "BustProb_20%", "BustProb_25%", "CardCount_5",
                "PointThreshold_45", "PointThreshold_50", "Hybrid_C3_P50_B20%", "Hybrid_C4_P45_B25%",
                "Ultimate_Adaptive"), names(Main.Preset.CHAMPIONSHIP));
    }

    @Test
    void testModesAndGameCounts() {
        assertEquals(Main.Preset.Mode.ROUND_ROBIN, Main.Preset.BUST.getMode());
        assertEquals(500, Main.Preset.BUST.getDefaultGames());
        assertEquals(Main.Preset.Mode.ROUND_ROBIN, Main.Preset.CARDS.getMode());
        assertEquals(1000, Main.Preset.CARDS.getDefaultGames());
        assertEquals(Main.Preset.Mode.ROUND_ROBIN, Main.Preset.POINTS.getMode());
        assertEquals(500, Main.Preset.POINTS.getDefaultGames());
        assertEquals(Main.Preset.Mode.SINGLE_TABLE, Main.Preset.CHAMPIONSHIP.getMode());
        assertEquals(2000, Main.Preset.CHAMPIONSHIP.getDefaultGames());
    }
}
