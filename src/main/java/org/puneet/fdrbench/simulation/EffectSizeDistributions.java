package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;

import java.util.Arrays;
import java.util.Objects;

/**
 * Effect size samplers for non-null hypotheses, including the mixture shapes commonly
 * used to stress shrinkage-based FDR methods (spiky, near-normal, flat-top, skew,
 * big-normal, bimodal).
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public final class EffectSizeDistributions {

    private EffectSizeDistributions() {
    }

    public static EffectSizeDistribution normal(double mean, double sd) {
        requirePositive(sd, "sd");
        return (n, rng) -> n == 0 ? new double[0] : new NormalDistribution(rng, mean, sd).sample(n);
    }

    public static EffectSizeDistribution uniform(double lower, double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Lower bound must be below upper bound");
        }
        return (n, rng) -> n == 0 ? new double[0] : new UniformRealDistribution(rng, lower, upper).sample(n);
    }

    public static EffectSizeDistribution constant(double value) {
        return (n, rng) -> {
            double[] out = new double[n];
            Arrays.fill(out, value);
            return out;
        };
    }

    /**
     * Scaled Student t effects, heavier tailed than normal.
     */
    public static EffectSizeDistribution studentT(double df, double scale) {
        requirePositive(df, "df");
        requirePositive(scale, "scale");
        return (n, rng) -> {
            if (n == 0) {
                return new double[0];
            }
            double[] out = new TDistribution(rng, df).sample(n);
            for (int i = 0; i < n; i++) {
                out[i] *= scale;
            }
            return out;
        };
    }

    /**
     * Finite mixture: each draw picks a component with probability proportional to its weight.
     *
     * @param weights non-negative weights, at least one positive
     * @param components one sampler per weight
     */
    public static EffectSizeDistribution mixture(double[] weights, EffectSizeDistribution... components) {
        Objects.requireNonNull(weights, "Weights cannot be null");
        if (weights.length == 0 || weights.length != components.length) {
            throw new IllegalArgumentException("Need one weight per mixture component");
        }
        double total = 0.0;
        for (double w : weights) {
            if (w < 0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("Mixture weights must be non-negative");
            }
            total += w;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("At least one mixture weight must be positive");
        }
        double[] cumulative = new double[weights.length];
        double running = 0.0;
        for (int k = 0; k < weights.length; k++) {
            running += weights[k] / total;
            cumulative[k] = running;
        }
        cumulative[weights.length - 1] = 1.0;
        EffectSizeDistribution[] parts = components.clone();

        return (n, rng) -> {
            int[] choice = new int[n];
            int[] counts = new int[parts.length];
            for (int i = 0; i < n; i++) {
                double u = rng.nextDouble();
                int k = 0;
                while (u >= cumulative[k] && k < cumulative.length - 1) {
                    k++;
                }
                choice[i] = k;
                counts[k]++;
            }
            double[][] draws = new double[parts.length][];
            for (int k = 0; k < parts.length; k++) {
                draws[k] = parts[k].sample(counts[k], rng);
            }
            int[] used = new int[parts.length];
            double[] out = new double[n];
            for (int i = 0; i < n; i++) {
                int k = choice[i];
                out[i] = draws[k][used[k]++];
            }
            return out;
        };
    }

    /** 2/3 N(0, 1) + 1/3 N(0, 2^2) */
    public static EffectSizeDistribution unimodal() {
        return mixture(new double[] {2.0 / 3.0, 1.0 / 3.0}, normal(0, 1), normal(0, 2));
    }

    /** 0.5 N(-2, 1) + 0.5 N(2, 1) */
    public static EffectSizeDistribution bimodal() {
        return mixture(new double[] {0.5, 0.5}, normal(-2, 1), normal(2, 1));
    }

    /** 1/4 N(-2, 2^2) + 1/4 N(-1, 1.5^2) + 1/3 N(0, 1) + 1/6 N(1, 1) */
    public static EffectSizeDistribution skew() {
        return mixture(new double[] {0.25, 0.25, 1.0 / 3.0, 1.0 / 6.0},
            normal(-2, 2), normal(-1, 1.5), normal(0, 1), normal(1, 1));
    }

    /** 0.4 N(0, 0.25^2) + 0.2 N(0, 0.5^2) + 0.2 N(0, 1) + 0.2 N(0, 2^2) */
    public static EffectSizeDistribution spiky() {
        return mixture(new double[] {0.4, 0.2, 0.2, 0.2},
            normal(0, 0.25), normal(0, 0.5), normal(0, 1), normal(0, 2));
    }

    /** Equal mixture of N(mu, 0.5^2) for mu = -1.5, -1, ..., 1.5 */
    public static EffectSizeDistribution flatTop() {
        double[] weights = new double[7];
        EffectSizeDistribution[] parts = new EffectSizeDistribution[7];
        for (int k = 0; k < 7; k++) {
            weights[k] = 1.0;
            parts[k] = normal(-1.5 + 0.5 * k, 0.5);
        }
        return mixture(weights, parts);
    }

    /** N(0, 4^2) */
    public static EffectSizeDistribution bigNormal() {
        return normal(0, 4);
    }

    /**
     * Resolves a named shape: {@code unimodal}, {@code bimodal}, {@code skew}, {@code spiky},
     * {@code flattop} or {@code bignormal}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static EffectSizeDistribution byName(String shape) {
        switch (shape.trim().toLowerCase().replace("-", "")) {
            case "unimodal":
                return unimodal();
            case "bimodal":
                return bimodal();
            case "skew":
                return skew();
            case "spiky":
                return spiky();
            case "flattop":
                return flatTop();
            case "bignormal":
                return bigNormal();
            default:
                throw new IllegalArgumentException("Unknown effect size shape: " + shape);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
