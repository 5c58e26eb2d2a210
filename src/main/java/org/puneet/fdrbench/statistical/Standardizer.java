package org.puneet.fdrbench.statistical;

import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns a replicate ensemble into threshold-indexed metric records.
 *
 * <p>A hypothesis is rejected at threshold {@code alpha} when its q-value is at most
 * {@code alpha}; a missing (NaN) q-value is never rejected. With truth labels the
 * records carry FDR, TPR, FWER, TNR, rejections and rejectprop; without them only
 * rejections and rejectprop are emitted.</p>
 *
 * <p>Replicates are identified by their position in the ensemble. Methods whose column
 * is entirely missing in a replicate produce no records for it. The standardizer holds
 * no state, so repeated calls on the same input produce equal output.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class Standardizer {
    private static final Logger logger = LoggerFactory.getLogger(Standardizer.class);

    /**
     * Standardizes every replicate of the ensemble.
     *
     * @param ensemble replicate results
     * @param alphas thresholds, strictly ascending, each in (0, 1]
     * @return records ordered by replicate, method (registry order), threshold and metric
     * @throws IllegalArgumentException if the threshold grid is empty, unsorted or out of range
     */
    public List<StandardizedRecord> standardize(ReplicateEnsemble ensemble, double[] alphas) {
        Objects.requireNonNull(ensemble, "Ensemble cannot be null");
        validateAlphas(alphas);

        List<StandardizedRecord> records = new ArrayList<>();
        int withoutTruth = 0;
        for (int r = 0; r < ensemble.size(); r++) {
            BenchResult result = ensemble.get(r);
            if (!result.hasTruth()) {
                withoutTruth++;
            }
            standardizeReplicate(r, result, alphas, records);
        }
        if (withoutTruth > 0) {
            logger.warn("Ensemble '{}': {} of {} replicates have no ground truth; only rejections "
                + "and rejectprop were computed for them", ensemble.getLabel(), withoutTruth, ensemble.size());
        }
        logger.debug("Standardized ensemble '{}' into {} records", ensemble.getLabel(), records.size());
        return Collections.unmodifiableList(records);
    }

    private void standardizeReplicate(int replicate, BenchResult result, double[] alphas,
                                      List<StandardizedRecord> out) {
        boolean[] truth = result.hasTruth() ? result.getTruth() : null;
        int m = result.size();
        int nonNull = 0;
        if (truth != null) {
            for (boolean t : truth) {
                if (t) {
                    nonNull++;
                }
            }
        }
        int nulls = m - nonNull;

        for (String methodId : result.getMethodIds()) {
            if (result.isMissing(methodId)) {
                continue;
            }
            double[] q = result.getQValues(methodId);
            for (double alpha : alphas) {
                int rejections = 0;
                int falseRejections = 0;
                int trueRejections = 0;
                for (int i = 0; i < m; i++) {
                    // NaN <= alpha is false, so missing q-values are never rejected
                    if (q[i] <= alpha) {
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

                if (truth != null) {
                    out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.FDR,
                        (double) falseRejections / Math.max(1, rejections)));
                    out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.TPR,
                        (double) trueRejections / Math.max(1, nonNull)));
                    out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.FWER,
                        falseRejections > 0 ? 1.0 : 0.0));
                    out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.TNR,
                        (double) (nulls - falseRejections) / Math.max(1, nulls)));
                }
                out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.REJECTIONS, rejections));
                out.add(new StandardizedRecord(replicate, methodId, alpha, Metric.REJECTPROP,
                    m == 0 ? 0.0 : (double) rejections / m));
            }
        }
    }

    static void validateAlphas(double[] alphas) {
        if (alphas == null || alphas.length == 0) {
            throw new IllegalArgumentException("Threshold grid cannot be empty");
        }
        for (int i = 0; i < alphas.length; i++) {
            double a = alphas[i];
            if (!(a > 0.0 && a <= 1.0)) {
                throw new IllegalArgumentException("Threshold must be in (0, 1]: " + a);
            }
            if (i > 0 && !(a > alphas[i - 1])) {
                throw new IllegalArgumentException("Thresholds must be strictly ascending: "
                    + alphas[i - 1] + " then " + a);
            }
        }
    }
}
