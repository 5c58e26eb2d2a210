package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Derives independent per-replicate seeds from a base seed, so that a replicate's draws
 * depend only on (base seed, replicate index) and never on scheduling order or pool size.
 */
public final class SeedSequence {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SeedSequence() {
    }

    public static long forReplicate(long baseSeed, int replicate) {
        if (replicate < 0) {
            throw new IllegalArgumentException("Replicate index cannot be negative: " + replicate);
        }
        return mix64(baseSeed + GOLDEN_GAMMA * (replicate + 1L));
    }

    /**
     * Creates the random source of one replicate.
     */
    public static RandomGenerator generatorFor(long baseSeed, int replicate) {
        return new Well19937c(forReplicate(baseSeed, replicate));
    }

    /**
     * SplitMix64 finalizer.
     */
    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
