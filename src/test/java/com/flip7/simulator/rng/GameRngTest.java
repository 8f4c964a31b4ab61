package com.flip7.simulator.rng;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameRng reproducibility.
 */
class GameRngTest {

    @Test
    void testSameSeedProducesSameSequence() {
        GameRng rng1 = new GameRng(12345);
        GameRng rng2 = new GameRng(12345);

        for (int i = 0; i < 100; i++) {
            assertEquals(rng1.next(), rng2.next(), "Same seed should produce same random sequence");
        }
    }

    @Test
    void testDifferentSeedsProduceDifferentSequences() {
        GameRng rng1 = new GameRng(12345);
        GameRng rng2 = new GameRng(54321);

        int sameCount = 0;
        for (int i = 0; i < 100; i++) {
            if (Math.abs(rng1.next() - rng2.next()) < 1e-10) {
                sameCount++;
            }
        }
        assertTrue(sameCount < 5, "Different seeds should produce different sequences");
    }

    /**
     * Known Mulberry32 output for seed 12345.
     */
    @Test
    void testMulberry32ReferenceValues() {
        double[] expected = {
            0.9797282677609473,
            0.3067522644996643,
            0.484205421525985,
            0.817934412509203,
            0.5094283693470061
        };

        GameRng rng = new GameRng(12345);
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i], rng.next(), 1e-15, "Value " + i + " mismatch");
        }
    }

    @Test
    void testShuffleReproducibility() {
        List<Integer> arr1 = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));
        List<Integer> arr2 = new ArrayList<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

        new GameRng(42).shuffle(arr1);
        new GameRng(42).shuffle(arr2);

        assertEquals(arr1, arr2, "Same seed should produce same shuffle");
        assertEquals(new HashSet<>(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)), new HashSet<>(arr1),
                "Shuffle must keep every element");
    }

    @Test
    void testNextIntInRange() {
        GameRng rng = new GameRng(42);
        for (int i = 0; i < 1000; i++) {
            int val = rng.nextInt(100);
            assertTrue(val >= 0 && val < 100, "nextInt should be in [0, bound)");
        }
    }

    @Test
    void testSampleIsDistinctAndBounded() {
        List<String> pool = List.of("a", "b", "c", "d", "e");
        GameRng rng = new GameRng(7);
        for (int i = 0; i < 100; i++) {
            List<String> picked = rng.sample(pool, 3);
            assertEquals(3, picked.size());
            assertEquals(3, new HashSet<>(picked).size(), "Sample must not repeat elements");
            assertTrue(pool.containsAll(picked));
        }

        assertEquals(5, rng.sample(pool, 10).size(), "Oversized sample returns the whole pool");
        assertEquals(List.of("a", "b", "c", "d", "e"), pool, "Source list must be untouched");
    }
}
