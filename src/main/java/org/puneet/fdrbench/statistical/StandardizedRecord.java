package org.puneet.fdrbench.statistical;

import java.util.Objects;

/**
 * One metric value for a (replicate, method, threshold) triple.
 */
public final class StandardizedRecord {

    private final int replicate;
    private final String methodId;
    private final double alpha;
    private final Metric metric;
    private final double value;

    public StandardizedRecord(int replicate, String methodId, double alpha, Metric metric, double value) {
        this.replicate = replicate;
        this.methodId = Objects.requireNonNull(methodId, "Method id cannot be null");
        this.alpha = alpha;
        this.metric = Objects.requireNonNull(metric, "Metric cannot be null");
        this.value = value;
    }

    public int getReplicate() {
        return replicate;
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

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StandardizedRecord)) {
            return false;
        }
        StandardizedRecord other = (StandardizedRecord) obj;
        return replicate == other.replicate
            && Double.compare(alpha, other.alpha) == 0
            && Double.compare(value, other.value) == 0
            && methodId.equals(other.methodId)
            && metric == other.metric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(replicate, methodId, alpha, metric, value);
    }

    @Override
    public String toString() {
        return String.format("StandardizedRecord{replicate=%d, method=%s, alpha=%s, %s=%s}",
            replicate, methodId, alpha, metric.getLabel(), value);
    }
}
