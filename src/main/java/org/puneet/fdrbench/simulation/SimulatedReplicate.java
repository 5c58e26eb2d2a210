package org.puneet.fdrbench.simulation;

import org.puneet.fdrbench.data.Dataset;

/**
 * One synthetic draw in two variants that share test statistics, p-values and truth
 * labels and differ only in the covariate: the informative variant keeps the covariate
 * that drove the null proportion, the uninformative one carries an independent draw.
 */
public final class SimulatedReplicate {

    /** Feature column holding the true effect of each hypothesis (0 for nulls). */
    public static final String TRUE_EFFECT = "true_effect";

    private final int replicateId;
    private final long seed;
    private final Dataset informative;
    private final Dataset uninformative;
    private final int clampedPi0Count;

    SimulatedReplicate(int replicateId, long seed, Dataset informative, Dataset uninformative,
                       int clampedPi0Count) {
        this.replicateId = replicateId;
        this.seed = seed;
        this.informative = informative;
        this.uninformative = uninformative;
        this.clampedPi0Count = clampedPi0Count;
    }

    public int getReplicateId() {
        return replicateId;
    }

    public long getSeed() {
        return seed;
    }

    public Dataset getInformative() {
        return informative;
    }

    public Dataset getUninformative() {
        return uninformative;
    }

    /**
     * Number of hypotheses whose null proportion had to be clamped into [0, 1].
     */
    public int getClampedPi0Count() {
        return clampedPi0Count;
    }
}
