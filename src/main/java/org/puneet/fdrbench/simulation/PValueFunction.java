package org.puneet.fdrbench.simulation;

/**
 * Maps an observed test statistic to a p-value under the reference null distribution.
 */
@FunctionalInterface
public interface PValueFunction {

    double pValue(double statistic);

    /**
     * Applies {@link #pValue(double)} element-wise, clamping into [0, 1]. NaN stays NaN.
     */
    default double[] apply(double[] statistics) {
        double[] p = new double[statistics.length];
        for (int i = 0; i < statistics.length; i++) {
            double value = pValue(statistics[i]);
            p[i] = Double.isNaN(value) ? Double.NaN : Math.max(0.0, Math.min(1.0, value));
        }
        return p;
    }
}
