package com.flip7.simulator.rng;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator owned by a single match.
 * Uses the Mulberry32 PRNG so a seed always replays the same shuffles,
 * which is what makes strategy comparisons reproducible.
 */
public class GameRng {
    private long state;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        return (int) (next() * bound);
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Pick {@code count} distinct elements without replacement, in draw order.
     * Returns all of them (shuffled) when {@code count} exceeds the list size.
     */
    public <T> List<T> sample(List<T> population, int count) {
        List<T> pool = new ArrayList<>(population);
        int n = Math.min(count, pool.size());
        for (int i = 0; i < n; i++) {
            int j = i + nextInt(pool.size() - i);
            Collections.swap(pool, i, j);
        }
        return List.copyOf(pool.subList(0, n));
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
