package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Sampler for the per-hypothesis covariate, with values in [0, 1].
 */
@FunctionalInterface
public interface CovariateSampler {

    double[] sample(int m, RandomGenerator rng);
}
