package org.puneet.fdrbench.simulation;

import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException.SimulationErrorType;

import java.util.OptionalInt;

/**
 * Pluggable components and settings of a synthetic benchmark: hypothesis count, null
 * proportion curve, effect size distribution, noise family, reference null for p-values,
 * covariate samplers and base seed.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public final class SimulationConfig {

    private final int hypotheses;
    private final NullProportionFunction pi0Function;
    private final EffectSizeDistribution effectSizes;
    private final TestStatisticPerturber perturber;
    private final PValueFunction pValueFunction;
    private final CovariateSampler covariateSampler;
    private final CovariateSampler uninformativeSampler;
    private final Integer nonNullCount;
    private final Pi0Policy pi0Policy;
    private final long seed;

    private SimulationConfig(Builder b) {
        this.hypotheses = b.hypotheses;
        this.pi0Function = b.pi0Function;
        this.effectSizes = b.effectSizes;
        this.perturber = b.perturber;
        this.pValueFunction = b.pValueFunction;
        this.covariateSampler = b.covariateSampler;
        this.uninformativeSampler = b.uninformativeSampler;
        this.nonNullCount = b.nonNullCount;
        this.pi0Policy = b.pi0Policy;
        this.seed = b.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getHypotheses() {
        return hypotheses;
    }

    public NullProportionFunction getPi0Function() {
        return pi0Function;
    }

    public EffectSizeDistribution getEffectSizes() {
        return effectSizes;
    }

    public TestStatisticPerturber getPerturber() {
        return perturber;
    }

    public PValueFunction getPValueFunction() {
        return pValueFunction;
    }

    public CovariateSampler getCovariateSampler() {
        return covariateSampler;
    }

    public CovariateSampler getUninformativeSampler() {
        return uninformativeSampler;
    }

    /**
     * Fixed number of non-null hypotheses, empty when non-null status is drawn per hypothesis.
     */
    public OptionalInt getNonNullCount() {
        return nonNullCount == null ? OptionalInt.empty() : OptionalInt.of(nonNullCount);
    }

    public Pi0Policy getPi0Policy() {
        return pi0Policy;
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig{m=%d, nonNullCount=%s, pi0Policy=%s, seed=%d}",
            hypotheses, nonNullCount, pi0Policy, seed);
    }

    /**
     * Builder. The covariate samplers default to uniform[0, 1], the p-value function to
     * the two-sided standard normal and the noise to N(0, 1).
     */
    public static final class Builder {
        private int hypotheses;
        private NullProportionFunction pi0Function;
        private EffectSizeDistribution effectSizes;
        private TestStatisticPerturber perturber = TestStatisticPerturbers.gaussian(1.0);
        private PValueFunction pValueFunction = PValueFunctions.twoSidedNormal();
        private CovariateSampler covariateSampler = CovariateSamplers.uniform();
        private CovariateSampler uninformativeSampler = CovariateSamplers.uniform();
        private Integer nonNullCount;
        private Pi0Policy pi0Policy = Pi0Policy.CLAMP;
        private long seed = 20170518L;

        public Builder hypotheses(int m) {
            this.hypotheses = m;
            return this;
        }

        public Builder pi0Function(NullProportionFunction pi0Function) {
            this.pi0Function = pi0Function;
            return this;
        }

        public Builder effectSizes(EffectSizeDistribution effectSizes) {
            this.effectSizes = effectSizes;
            return this;
        }

        public Builder perturber(TestStatisticPerturber perturber) {
            this.perturber = perturber;
            return this;
        }

        public Builder pValueFunction(PValueFunction pValueFunction) {
            this.pValueFunction = pValueFunction;
            return this;
        }

        public Builder covariateSampler(CovariateSampler sampler) {
            this.covariateSampler = sampler;
            return this;
        }

        public Builder uninformativeSampler(CovariateSampler sampler) {
            this.uninformativeSampler = sampler;
            return this;
        }

        public Builder nonNullCount(Integer count) {
            this.nonNullCount = count;
            return this;
        }

        public Builder pi0Policy(Pi0Policy policy) {
            this.pi0Policy = policy;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /**
         * Validates the settings.
         *
         * @throws InvalidSimulationConfigException if m is not positive, the non-null count is
         *         outside [0, m] or a component is missing
         */
        public SimulationConfig build() throws InvalidSimulationConfigException {
            if (hypotheses <= 0) {
                throw new InvalidSimulationConfigException(SimulationErrorType.INVALID_HYPOTHESIS_COUNT,
                    "m = " + hypotheses);
            }
            if (nonNullCount != null) {
                if (nonNullCount > hypotheses) {
                    throw InvalidSimulationConfigException.nonNullCountExceedsM(nonNullCount, hypotheses);
                }
                if (nonNullCount < 0) {
                    throw new InvalidSimulationConfigException(SimulationErrorType.INVALID_PARAMETER,
                        "non-null count cannot be negative: " + nonNullCount);
                }
            }
            requireComponent(pi0Function, "pi0Function");
            requireComponent(effectSizes, "effectSizes");
            requireComponent(perturber, "perturber");
            requireComponent(pValueFunction, "pValueFunction");
            requireComponent(covariateSampler, "covariateSampler");
            requireComponent(uninformativeSampler, "uninformativeSampler");
            requireComponent(pi0Policy, "pi0Policy");
            return new SimulationConfig(this);
        }

        private static void requireComponent(Object component, String name)
                throws InvalidSimulationConfigException {
            if (component == null) {
                throw new InvalidSimulationConfigException(SimulationErrorType.MISSING_COMPONENT,
                    name + " is not set");
            }
        }
    }
}
