package org.puneet.fdrbench.statistical;

/**
 * How {@link Aggregator} reduces standardized records across replicates.
 */
public enum AggregationMode {
    /** Mean and standard error of each (method, threshold, metric) group. */
    MEAN,
    /** Mean and standard error of per-replicate differences between two joined ensembles. */
    PAIRED_DIFFERENCE
}
