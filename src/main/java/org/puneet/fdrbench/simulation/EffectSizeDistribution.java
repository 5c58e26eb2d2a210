package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Sampler for the true effect sizes of non-null hypotheses.
 */
@FunctionalInterface
public interface EffectSizeDistribution {

    /**
     * Draws {@code n} effect sizes.
     *
     * @param n number of non-null hypotheses
     * @param rng random source of the current replicate
     * @return array of length {@code n}
     */
    double[] sample(int n, RandomGenerator rng);
}
