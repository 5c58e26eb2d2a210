package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.fdrbench.data.Dataset;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException.SimulationErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Draws synthetic multiple-testing problems from a {@link SimulationConfig}.
 *
 * <p>For each replicate the generator draws covariates, then null/non-null labels from the
 * null proportion curve evaluated at each covariate, then effects for the non-nulls, then
 * noisy test statistics and p-values. An independent uninformative covariate is drawn last
 * so the informative variant of a replicate is identical whether or not it is used.</p>
 *
 * <p>All randomness comes from {@link SeedSequence#generatorFor(long, int)}, so replicate
 * {@code i} is reproducible from (seed, i) alone and generation is safe to run from
 * several threads at once.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public class SimulationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SimulationGenerator.class);

    private static final double MIN_SAMPLING_WEIGHT = 1e-12;

    private final SimulationConfig config;

    public SimulationGenerator(SimulationConfig config) {
        this.config = Objects.requireNonNull(config, "Simulation config cannot be null");
    }

    public SimulationConfig getConfig() {
        return config;
    }

    /**
     * Generates one replicate.
     *
     * @param replicate replicate index, at least 0
     * @return the informative and uninformative variants of the draw
     * @throws InvalidSimulationConfigException if a component returns malformed output or
     *         the null proportion leaves [0, 1] under {@link Pi0Policy#FAIL}
     */
    public SimulatedReplicate generate(int replicate) throws InvalidSimulationConfigException {
        int m = config.getHypotheses();
        long seed = SeedSequence.forReplicate(config.getSeed(), replicate);
        RandomGenerator rng = SeedSequence.generatorFor(config.getSeed(), replicate);

        double[] covariate = config.getCovariateSampler().sample(m, rng);
        requireLength(covariate, m, "covariate sampler");

        double[] pi0 = new double[m];
        int clamped = evaluatePi0(covariate, pi0);
        if (clamped > 0) {
            logger.warn("Replicate {}: clamped null proportion into [0, 1] for {} of {} hypotheses",
                replicate, clamped, m);
        }

        boolean[] truth = config.getNonNullCount().isPresent()
            ? drawFixedCount(pi0, config.getNonNullCount().getAsInt(), rng)
            : drawBernoulli(pi0, rng);

        int nonNull = 0;
        for (boolean t : truth) {
            if (t) {
                nonNull++;
            }
        }

        double[] drawnEffects = config.getEffectSizes().sample(nonNull, rng);
        requireLength(drawnEffects, nonNull, "effect size distribution");
        double[] effects = new double[m];
        for (int i = 0, k = 0; i < m; i++) {
            effects[i] = truth[i] ? drawnEffects[k++] : 0.0;
        }

        TestStatisticPerturber perturber = config.getPerturber();
        double[] statistics = perturber.perturb(effects, rng);
        requireLength(statistics, m, "test statistic perturber");
        double[] pValues = config.getPValueFunction().apply(statistics);

        double[] standardErrors = new double[m];
        Arrays.fill(standardErrors, perturber.standardError());

        double[] uninformative = config.getUninformativeSampler().sample(m, rng);
        requireLength(uninformative, m, "uninformative covariate sampler");

        Dataset informativeSet = Dataset.builder(pValues)
            .testStatistics(statistics)
            .effectSizes(statistics)
            .standardErrors(standardErrors)
            .covariate(covariate)
            .truth(truth)
            .feature(SimulatedReplicate.TRUE_EFFECT, effects)
            .build();
        Dataset uninformativeSet = informativeSet.withCovariate(uninformative);

        logger.debug("Replicate {}: generated {} hypotheses, {} non-null", replicate, m, nonNull);
        return new SimulatedReplicate(replicate, seed, informativeSet, uninformativeSet, clamped);
    }

    private int evaluatePi0(double[] covariate, double[] pi0) throws InvalidSimulationConfigException {
        NullProportionFunction function = config.getPi0Function();
        int clamped = 0;
        for (int i = 0; i < covariate.length; i++) {
            double value = function.pi0(covariate[i]);
            if (value >= 0.0 && value <= 1.0) {
                pi0[i] = value;
                continue;
            }
            if (config.getPi0Policy() == Pi0Policy.FAIL || Double.isNaN(value)) {
                throw InvalidSimulationConfigException.pi0OutOfRange(covariate[i], value);
            }
            pi0[i] = value < 0.0 ? 0.0 : 1.0;
            clamped++;
        }
        return clamped;
    }

    private static boolean[] drawBernoulli(double[] pi0, RandomGenerator rng) {
        boolean[] truth = new boolean[pi0.length];
        for (int i = 0; i < pi0.length; i++) {
            truth[i] = rng.nextDouble() >= pi0[i];
        }
        return truth;
    }

    /**
     * Picks exactly {@code k} non-nulls without replacement, hypothesis {@code i} weighted by
     * {@code 1 - pi0[i]} (Efraimidis-Spirakis keys).
     */
    static boolean[] drawFixedCount(double[] pi0, int k, RandomGenerator rng) {
        int m = pi0.length;
        Integer[] order = new Integer[m];
        double[] keys = new double[m];
        for (int i = 0; i < m; i++) {
            order[i] = i;
            double u = rng.nextDouble();
            double w = Math.max(1.0 - pi0[i], MIN_SAMPLING_WEIGHT);
            keys[i] = Math.log(u) / w;
        }
        Arrays.sort(order, (a, b) -> Double.compare(keys[b], keys[a]));
        boolean[] truth = new boolean[m];
        for (int j = 0; j < k; j++) {
            truth[order[j]] = true;
        }
        return truth;
    }

    private static void requireLength(double[] values, int expected, String component)
            throws InvalidSimulationConfigException {
        if (values == null || values.length != expected) {
            throw new InvalidSimulationConfigException(SimulationErrorType.INVALID_PARAMETER,
                String.format("%s returned %s values, expected %d", component,
                    values == null ? "null" : String.valueOf(values.length), expected));
        }
    }
}
