package com.butterfly.engine;

import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * All randomness of one cascade invocation: delay jitter, text variation and ids.
 * Seed the underlying {@link Random} to make a run reproducible.
 */
public class CascadeRandom {

    private final Random random;

    public CascadeRandom(Random random) {
        this.random = random;
    }

    /**
     * Uniform value in {@code [0, bound)}.
     */
    public double jitter(double bound) {
        return random.nextDouble() * bound;
    }

    public <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    /**
     * Random (version 4) UUID drawn from this source.
     */
    public String nextId() {
        long most = random.nextLong();
        long least = random.nextLong();
        most = (most & ~0xF000L) | 0x4000L;                         // version 4
        least = (least & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // IETF variant
        return new UUID(most, least).toString();
    }
}
