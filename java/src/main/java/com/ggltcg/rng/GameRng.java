package com.ggltcg.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator so games can be replayed from a seed.
 * Mulberry32 over a 32-bit state.
 */
public class GameRng {
    private long state;

    /**
     * Create a GameRng with the given seed. Only the lower 32 bits are used.
     */
    public GameRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Next value in [0, 1).
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
     * Random integer in [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(next() * bound);
    }

    /**
     * Uniformly chosen element of a non-empty list.
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Current internal state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
