package org.puneet.fdrbench.statistical;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.data.MethodFailure;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces standardized records across replicates into plotting-ready summaries.
 *
 * <p>In mean mode records are grouped by (method, threshold, metric); each group reports
 * the sample mean and the standard error (sample standard deviation over the square root
 * of the number of contributing replicates). A replicate that has no record for a group
 * is left out of that group rather than counted as zero.</p>
 *
 * <p>In paired-difference mode two ensembles are joined on (replicate, method, threshold,
 * metric), the per-replicate difference A - B is taken first, and the differences are then
 * summarized as in mean mode. Rows present on only one side are dropped.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-10
 */
public class Aggregator {
    private static final Logger logger = LoggerFactory.getLogger(Aggregator.class);

    /**
     * Mean-mode aggregation of all records.
     */
    public List<AggregatedRecord> aggregate(List<StandardizedRecord> records) {
        return aggregate(records, Collections.emptySet());
    }

    /**
     * Mean-mode aggregation.
     *
     * @param records standardized records
     * @param excludedMethods method ids to leave out
     * @return one record per group, in order of first appearance
     */
    public List<AggregatedRecord> aggregate(List<StandardizedRecord> records, Set<String> excludedMethods) {
        Objects.requireNonNull(records, "Records cannot be null");
        Objects.requireNonNull(excludedMethods, "Excluded methods cannot be null");

        Map<GroupKey, DescriptiveStatistics> groups = new LinkedHashMap<>();
        int skipped = 0;
        for (StandardizedRecord record : records) {
            if (excludedMethods.contains(record.getMethodId())) {
                continue;
            }
            if (Double.isNaN(record.getValue())) {
                skipped++;
                continue;
            }
            groups.computeIfAbsent(GroupKey.of(record), k -> new DescriptiveStatistics())
                .addValue(record.getValue());
        }
        if (skipped > 0) {
            logger.debug("Skipped {} NaN-valued records during aggregation", skipped);
        }
        return summarize(groups);
    }

    /**
     * Paired-difference aggregation of ensemble A against ensemble B.
     *
     * @param recordsA standardized records of ensemble A
     * @param recordsB standardized records of ensemble B, sharing replicate indices with A
     * @param excludedMethods method ids to leave out
     * @return mean and standard error of the per-replicate differences A - B
     */
    public List<AggregatedRecord> aggregatePairedDifference(List<StandardizedRecord> recordsA,
                                                            List<StandardizedRecord> recordsB,
                                                            Set<String> excludedMethods) {
        Objects.requireNonNull(recordsA, "Records A cannot be null");
        Objects.requireNonNull(recordsB, "Records B cannot be null");

        Map<PairKey, Double> indexB = new HashMap<>();
        for (StandardizedRecord record : recordsB) {
            indexB.put(PairKey.of(record), record.getValue());
        }

        List<StandardizedRecord> differences = new ArrayList<>();
        int unmatched = 0;
        for (StandardizedRecord a : recordsA) {
            Double b = indexB.get(PairKey.of(a));
            if (b == null) {
                unmatched++;
                continue;
            }
            differences.add(new StandardizedRecord(a.getReplicate(), a.getMethodId(), a.getAlpha(),
                a.getMetric(), a.getValue() - b));
        }
        if (unmatched > 0) {
            logger.debug("{} records of ensemble A had no partner in ensemble B", unmatched);
        }
        return aggregate(differences, excludedMethods);
    }

    /**
     * Dispatches on the aggregation mode.
     *
     * @param recordsB required in {@link AggregationMode#PAIRED_DIFFERENCE} mode, ignored otherwise
     */
    public List<AggregatedRecord> aggregate(AggregationMode mode, List<StandardizedRecord> recordsA,
                                            List<StandardizedRecord> recordsB, Set<String> excludedMethods) {
        Objects.requireNonNull(mode, "Mode cannot be null");
        if (mode == AggregationMode.PAIRED_DIFFERENCE) {
            if (recordsB == null) {
                throw new IllegalArgumentException("Paired-difference mode needs a second ensemble");
            }
            return aggregatePairedDifference(recordsA, recordsB, excludedMethods);
        }
        return aggregate(recordsA, excludedMethods);
    }

    /**
     * Counts per method the replicates in which it failed or produced no usable column.
     *
     * @param ensemble replicate results
     * @return one summary per method, in order of first appearance
     */
    public List<MethodFailureSummary> summarizeFailures(ReplicateEnsemble ensemble) {
        Objects.requireNonNull(ensemble, "Ensemble cannot be null");
        List<MethodFailureSummary> summaries = new ArrayList<>();
        for (String methodId : ensemble.getMethodIds()) {
            int failed = 0;
            Map<FailureType, Integer> byType = new EnumMap<>(FailureType.class);
            for (BenchResult result : ensemble.getResults()) {
                Optional<MethodFailure> failure = result.getFailure(methodId);
                if (failure.isPresent()) {
                    failed++;
                    byType.merge(failure.get().getType(), 1, Integer::sum);
                } else if (result.isMissing(methodId)) {
                    failed++;
                }
            }
            MethodFailureSummary summary = new MethodFailureSummary(methodId, failed, ensemble.size(), byType);
            if (failed > 0) {
                logger.info("Ensemble '{}': {}", ensemble.getLabel(), summary);
            }
            summaries.add(summary);
        }
        return summaries;
    }

    private static List<AggregatedRecord> summarize(Map<GroupKey, DescriptiveStatistics> groups) {
        List<AggregatedRecord> out = new ArrayList<>(groups.size());
        for (Map.Entry<GroupKey, DescriptiveStatistics> e : groups.entrySet()) {
            DescriptiveStatistics stats = e.getValue();
            long n = stats.getN();
            double se = n < 2 ? Double.NaN : stats.getStandardDeviation() / Math.sqrt(n);
            GroupKey key = e.getKey();
            out.add(new AggregatedRecord(key.methodId, key.alpha, key.metric, stats.getMean(), se, (int) n));
        }
        return out;
    }

    private static final class GroupKey {
        private final String methodId;
        private final double alpha;
        private final Metric metric;

        private GroupKey(String methodId, double alpha, Metric metric) {
            this.methodId = methodId;
            this.alpha = alpha;
            this.metric = metric;
        }

        static GroupKey of(StandardizedRecord r) {
            return new GroupKey(r.getMethodId(), r.getAlpha(), r.getMetric());
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof GroupKey)) {
                return false;
            }
            GroupKey other = (GroupKey) obj;
            return Double.compare(alpha, other.alpha) == 0
                && methodId.equals(other.methodId)
                && metric == other.metric;
        }

        @Override
        public int hashCode() {
            return Objects.hash(methodId, alpha, metric);
        }
    }

    private static final class PairKey {
        private final int replicate;
        private final GroupKey group;

        private PairKey(int replicate, GroupKey group) {
            this.replicate = replicate;
            this.group = group;
        }

        static PairKey of(StandardizedRecord r) {
            return new PairKey(r.getReplicate(), GroupKey.of(r));
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof PairKey)) {
                return false;
            }
            PairKey other = (PairKey) obj;
            return replicate == other.replicate && group.equals(other.group);
        }

        @Override
        public int hashCode() {
            return 31 * replicate + group.hashCode();
        }
    }
}
