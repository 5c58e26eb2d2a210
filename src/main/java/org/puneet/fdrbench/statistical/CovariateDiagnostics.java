package org.puneet.fdrbench.statistical;

import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Breaks rejections down by covariate: hypotheses are split into equal-count bins of a
 * passthrough column, and each bin reports its rejection count, plus TPR and FDR when
 * truth is known. Shows where along the covariate a method gains or loses power.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-11
 */
public class CovariateDiagnostics {
    private static final Logger logger = LoggerFactory.getLogger(CovariateDiagnostics.class);

    /**
     * @param ensemble replicate results carrying {@code column} as a passthrough feature
     * @param alpha rejection threshold in (0, 1]
     * @param column feature column to bin on
     * @param bins number of equal-count bins, at least 1
     * @return records ordered by replicate, method and bin; replicates lacking the column are skipped
     */
    public List<CovariateBinRecord> rejectionsByBin(ReplicateEnsemble ensemble, double alpha,
                                                    String column, int bins) {
        Objects.requireNonNull(ensemble, "Ensemble cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
        Standardizer.validateAlphas(new double[] {alpha});
        if (bins < 1) {
            throw new IllegalArgumentException("Bin count must be at least 1: " + bins);
        }

        List<CovariateBinRecord> out = new ArrayList<>();
        int skipped = 0;
        for (int r = 0; r < ensemble.size(); r++) {
            BenchResult result = ensemble.get(r);
            double[] covariate = result.getFeature(column);
            if (covariate == null) {
                skipped++;
                continue;
            }
            binReplicate(r, result, covariate, alpha, bins, out);
        }
        if (skipped > 0) {
            logger.warn("Ensemble '{}': {} replicates lack column '{}' and were skipped",
                ensemble.getLabel(), skipped, column);
        }
        return Collections.unmodifiableList(out);
    }

    private void binReplicate(int replicate, BenchResult result, double[] covariate, double alpha,
                              int bins, List<CovariateBinRecord> out) {
        int m = covariate.length;
        Integer[] order = new Integer[m];
        for (int i = 0; i < m; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(covariate[a], covariate[b]));
        int effectiveBins = Math.min(bins, Math.max(1, m));
        boolean[] truth = result.hasTruth() ? result.getTruth() : null;

        for (String methodId : result.getMethodIds()) {
            if (result.isMissing(methodId)) {
                continue;
            }
            double[] q = result.getQValues(methodId);
            for (int b = 0; b < effectiveBins; b++) {
                int from = (int) ((long) b * m / effectiveBins);
                int to = (int) ((long) (b + 1) * m / effectiveBins);
                int rejections = 0;
                int falseRejections = 0;
                int trueRejections = 0;
                int nonNull = 0;
                for (int k = from; k < to; k++) {
                    int i = order[k];
                    boolean rejected = q[i] <= alpha;
                    if (truth != null && truth[i]) {
                        nonNull++;
                    }
                    if (rejected) {
                        rejections++;
                        if (truth != null) {
                            if (truth[i]) {
                                trueRejections++;
                            } else {
                                falseRejections++;
                            }
                        }
                    }
                }
                double tpr = truth == null ? Double.NaN : (double) trueRejections / Math.max(1, nonNull);
                double fdr = truth == null ? Double.NaN : (double) falseRejections / Math.max(1, rejections);
                double lower = to > from ? covariate[order[from]] : Double.NaN;
                double upper = to > from ? covariate[order[to - 1]] : Double.NaN;
                out.add(new CovariateBinRecord(replicate, methodId, b, lower, upper, to - from,
                    rejections, tpr, fdr));
            }
        }
    }
}
