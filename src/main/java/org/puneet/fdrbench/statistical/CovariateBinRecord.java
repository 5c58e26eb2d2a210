package org.puneet.fdrbench.statistical;

/**
 * Rejections of one method within one covariate bin of one replicate.
 * TPR and FDR are NaN when the replicate has no truth labels.
 */
public final class CovariateBinRecord {

    private final int replicate;
    private final String methodId;
    private final int bin;
    private final double lowerBound;
    private final double upperBound;
    private final int hypotheses;
    private final int rejections;
    private final double tpr;
    private final double fdr;

    public CovariateBinRecord(int replicate, String methodId, int bin, double lowerBound, double upperBound,
                              int hypotheses, int rejections, double tpr, double fdr) {
        this.replicate = replicate;
        this.methodId = methodId;
        this.bin = bin;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.hypotheses = hypotheses;
        this.rejections = rejections;
        this.tpr = tpr;
        this.fdr = fdr;
    }

    public int getReplicate() {
        return replicate;
    }

    public String getMethodId() {
        return methodId;
    }

    public int getBin() {
        return bin;
    }

    /** Smallest covariate value in the bin. */
    public double getLowerBound() {
        return lowerBound;
    }

    /** Largest covariate value in the bin. */
    public double getUpperBound() {
        return upperBound;
    }

    public int getHypotheses() {
        return hypotheses;
    }

    public int getRejections() {
        return rejections;
    }

    public double getTpr() {
        return tpr;
    }

    public double getFdr() {
        return fdr;
    }

    @Override
    public String toString() {
        return String.format("CovariateBinRecord{replicate=%d, method=%s, bin=%d [%.3f, %.3f], n=%d, "
            + "rejections=%d, tpr=%.3f, fdr=%.3f}", replicate, methodId, bin, lowerBound, upperBound,
            hypotheses, rejections, tpr, fdr);
    }
}
