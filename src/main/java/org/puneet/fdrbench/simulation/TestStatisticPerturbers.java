package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Noise families turning true effects into observed test statistics.
 */
public final class TestStatisticPerturbers {

    private TestStatisticPerturbers() {
    }

    /**
     * Observed statistic = effect + N(0, sd^2).
     */
    public static TestStatisticPerturber gaussian(double sd) {
        if (!(sd > 0)) {
            throw new IllegalArgumentException("sd must be positive, got " + sd);
        }
        return new TestStatisticPerturber() {
            @Override
            public double[] perturb(double[] effects, RandomGenerator rng) {
                return addNoise(effects, effects.length == 0
                    ? new double[0] : new NormalDistribution(rng, 0.0, sd).sample(effects.length));
            }

            @Override
            public double standardError() {
                return sd;
            }
        };
    }

    /**
     * Observed statistic = effect + t(df) noise.
     */
    public static TestStatisticPerturber studentT(double df) {
        if (!(df > 0)) {
            throw new IllegalArgumentException("df must be positive, got " + df);
        }
        return (effects, rng) -> addNoise(effects, effects.length == 0
            ? new double[0] : new TDistribution(rng, df).sample(effects.length));
    }

    /**
     * Non-central chi-squared statistic with {@code df} degrees of freedom and non-centrality
     * equal to the absolute effect. Null hypotheses (effect 0) follow the central distribution.
     */
    public static TestStatisticPerturber chiSquared(int df) {
        if (df < 1) {
            throw new IllegalArgumentException("df must be at least 1, got " + df);
        }
        return (effects, rng) -> {
            int n = effects.length;
            double[] out = new double[n];
            if (n == 0) {
                return out;
            }
            NormalDistribution standard = new NormalDistribution(rng, 0.0, 1.0);
            double[] rest = df > 1 ? new ChiSquaredDistribution(rng, df - 1).sample(n) : new double[n];
            for (int i = 0; i < n; i++) {
                double shifted = standard.sample() + Math.sqrt(Math.abs(effects[i]));
                out[i] = shifted * shifted + rest[i];
            }
            return out;
        };
    }

    private static double[] addNoise(double[] effects, double[] noise) {
        double[] out = new double[effects.length];
        for (int i = 0; i < effects.length; i++) {
            out[i] = effects[i] + noise[i];
        }
        return out;
    }
}
