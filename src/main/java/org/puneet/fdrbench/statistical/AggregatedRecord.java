package org.puneet.fdrbench.statistical;

import org.apache.commons.math3.distribution.TDistribution;

import java.util.Objects;

/**
 * Cross-replicate summary of one (method, threshold, metric) group.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public final class AggregatedRecord {

    private final String methodId;
    private final double alpha;
    private final Metric metric;
    private final double mean;
    private final double standardError;
    private final int contributingReplicates;

    /**
     * @param methodId method identifier
     * @param alpha threshold
     * @param metric metric
     * @param mean sample mean over contributing replicates
     * @param standardError sample standard deviation over sqrt(n), NaN when n is below 2
     * @param contributingReplicates replicates that contributed a value
     */
    public AggregatedRecord(String methodId, double alpha, Metric metric, double mean,
                            double standardError, int contributingReplicates) {
        this.methodId = Objects.requireNonNull(methodId, "Method id cannot be null");
        this.alpha = alpha;
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        this.mean = mean;
        this.standardError = standardError;
        this.contributingReplicates = contributingReplicates;
    }

    public String getMethodId() {
        return methodId;
    }

    public double getAlpha() {
        return alpha;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getMean() {
        return mean;
    }

    public double getStandardError() {
        return standardError;
    }

    public int getContributingReplicates() {
        return contributingReplicates;
    }

    /**
     * Half-width of the two-sided Student t confidence interval for the mean.
     *
     * @param confidenceLevel e.g. 0.95
     * @return the half-width, NaN when fewer than two replicates contributed
     */
    public double confidenceHalfWidth(double confidenceLevel) {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidenceLevel);
        }
        if (contributingReplicates < 2 || Double.isNaN(standardError)) {
            return Double.NaN;
        }
        TDistribution t = new TDistribution(contributingReplicates - 1);
        return t.inverseCumulativeProbability(1 - (1 - confidenceLevel) / 2) * standardError;
    }

    @Override
    public String toString() {
        return String.format("AggregatedRecord{method=%s, alpha=%s, %s: mean=%.4f, se=%.4f, n=%d}",
            methodId, alpha, metric.getLabel(), mean, standardError, contributingReplicates);
    }
}
