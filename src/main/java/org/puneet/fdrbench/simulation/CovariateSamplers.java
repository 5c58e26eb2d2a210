package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.distribution.BetaDistribution;

/**
 * Covariate samplers on [0, 1].
 */
public final class CovariateSamplers {

    private CovariateSamplers() {
    }

    public static CovariateSampler uniform() {
        return (m, rng) -> {
            double[] x = new double[m];
            for (int i = 0; i < m; i++) {
                x[i] = rng.nextDouble();
            }
            return x;
        };
    }

    public static CovariateSampler beta(double alpha, double beta) {
        if (alpha <= 0 || beta <= 0) {
            throw new IllegalArgumentException("Beta shape parameters must be positive");
        }
        return (m, rng) -> m == 0 ? new double[0] : new BetaDistribution(rng, alpha, beta).sample(m);
    }
}
