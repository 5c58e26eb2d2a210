package org.puneet.fdrbench.simulation;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * P-value functions matching the noise families of {@link TestStatisticPerturbers}.
 */
public final class PValueFunctions {

    private PValueFunctions() {
    }

    /**
     * Two-sided p-value under N(0, sd^2).
     */
    public static PValueFunction twoSidedNormal(double sd) {
        NormalDistribution reference = new NormalDistribution(0.0, sd);
        return z -> Double.isNaN(z) ? Double.NaN
            : Math.min(1.0, 2.0 * reference.cumulativeProbability(-Math.abs(z)));
    }

    public static PValueFunction twoSidedNormal() {
        return twoSidedNormal(1.0);
    }

    /**
     * Two-sided p-value under Student t with {@code df} degrees of freedom.
     */
    public static PValueFunction twoSidedT(double df) {
        TDistribution reference = new TDistribution(df);
        return t -> Double.isNaN(t) ? Double.NaN
            : Math.min(1.0, 2.0 * reference.cumulativeProbability(-Math.abs(t)));
    }

    /**
     * Upper-tail p-value under the central chi-squared distribution.
     */
    public static PValueFunction chiSquaredUpper(double df) {
        ChiSquaredDistribution reference = new ChiSquaredDistribution(df);
        return x -> {
            if (Double.isNaN(x)) {
                return Double.NaN;
            }
            return x <= 0 ? 1.0 : 1.0 - reference.cumulativeProbability(x);
        };
    }
}
