package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Turns true effects (zero for null hypotheses) into observed test statistics by adding
 * noise from a declared family.
 */
@FunctionalInterface
public interface TestStatisticPerturber {

    double[] perturb(double[] effects, RandomGenerator rng);

    /**
     * Nominal standard error of the observed statistic, NaN when it has no single value.
     */
    default double standardError() {
        return Double.NaN;
    }
}
