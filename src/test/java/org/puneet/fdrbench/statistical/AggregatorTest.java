package org.puneet.fdrbench.statistical;

import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.data.MethodFailure;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private static final double EPS = 1e-12;

    private final Aggregator aggregator = new Aggregator();

    private static AggregatedRecord find(List<AggregatedRecord> records, String method, Metric metric) {
        return records.stream()
            .filter(r -> r.getMethodId().equals(method) && r.getMetric() == metric)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No aggregate for " + method + " " + metric));
    }

    @Test
    void testMeanAndStandardError() {
        List<StandardizedRecord> records = List.of(
            new StandardizedRecord(0, "m", 0.05, Metric.FDR, 0.1),
            new StandardizedRecord(1, "m", 0.05, Metric.FDR, 0.3),
            new StandardizedRecord(2, "m", 0.05, Metric.FDR, 0.5));
        AggregatedRecord result = aggregator.aggregate(records).get(0);

        assertEquals(0.3, result.getMean(), EPS);
        assertEquals(0.2 / Math.sqrt(3), result.getStandardError(), EPS);
        assertEquals(3, result.getContributingReplicates());
    }

    @Test
    void testSingleReplicateHasNoStandardError() {
        AggregatedRecord result = aggregator.aggregate(List.of(
            new StandardizedRecord(0, "m", 0.05, Metric.TPR, 0.7))).get(0);
        assertEquals(0.7, result.getMean(), EPS);
        assertTrue(Double.isNaN(result.getStandardError()));
        assertTrue(Double.isNaN(result.confidenceHalfWidth(0.95)));
    }

    @Test
    void testMissingReplicateIsLeftOutNotZeroed() {
        Map<String, double[]> full = new LinkedHashMap<>();
        full.put("m", new double[] {0.01, 0.01, 0.9, 0.9});
        full.put("steady", new double[] {0.01, 0.9, 0.9, 0.9});
        Map<String, double[]> broken = new LinkedHashMap<>();
        broken.put("m", new double[] {Double.NaN, Double.NaN, Double.NaN, Double.NaN});
        broken.put("steady", new double[] {0.01, 0.9, 0.9, 0.9});
        boolean[] truth = {true, false, false, false};
        MethodFailure failure = new MethodFailure("m", 1, FailureType.EXCEPTION, "diverged", "java.lang.ArithmeticException");
        ReplicateEnsemble ensemble = new ReplicateEnsemble("three", List.of(
            new BenchResult(0, 4, full, truth, null, null),
            new BenchResult(1, 4, broken, truth, null, List.of(failure)),
            new BenchResult(2, 4, full, truth, null, null)));

        List<StandardizedRecord> records = new Standardizer().standardize(ensemble, new double[] {0.05});
        List<AggregatedRecord> aggregated = aggregator.aggregate(records);

        AggregatedRecord m = find(aggregated, "m", Metric.FDR);
        assertEquals(2, m.getContributingReplicates());
        assertEquals(0.5, m.getMean(), EPS);
        assertEquals(0.0, m.getStandardError(), EPS);
        assertEquals(3, find(aggregated, "steady", Metric.FDR).getContributingReplicates());
        assertEquals(0.0, find(aggregated, "steady", Metric.FDR).getMean(), EPS);

        List<MethodFailureSummary> failures = aggregator.summarizeFailures(ensemble);
        assertEquals(2, failures.size());
        assertEquals("m", failures.get(0).getMethodId());
        assertEquals(1, failures.get(0).getFailedReplicates());
        assertEquals(3, failures.get(0).getTotalReplicates());
        assertEquals(1.0 / 3.0, failures.get(0).getFailureFraction(), EPS);
        assertEquals(Integer.valueOf(1), failures.get(0).getFailuresByType().get(FailureType.EXCEPTION));
        assertEquals(0, failures.get(1).getFailedReplicates());
    }

    @Test
    void testMissingColumnWithoutFailureRecordCountsAsFailed() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("silent", new double[] {Double.NaN, Double.NaN});
        ReplicateEnsemble ensemble = new ReplicateEnsemble("e",
            List.of(new BenchResult(0, 2, q, null, null, null)));
        MethodFailureSummary summary = aggregator.summarizeFailures(ensemble).get(0);
        assertEquals(1, summary.getFailedReplicates());
        assertTrue(summary.getFailuresByType().isEmpty());
    }

    @Test
    void testExcludedMethodsAndNaNValues() {
        List<StandardizedRecord> records = List.of(
            new StandardizedRecord(0, "keep", 0.1, Metric.TPR, 0.4),
            new StandardizedRecord(1, "keep", 0.1, Metric.TPR, Double.NaN),
            new StandardizedRecord(0, "drop", 0.1, Metric.TPR, 0.9));
        List<AggregatedRecord> result = aggregator.aggregate(records, Set.of("drop"));
        assertEquals(1, result.size());
        assertEquals("keep", result.get(0).getMethodId());
        assertEquals(1, result.get(0).getContributingReplicates());
    }

    @Test
    void testGroupsByAlphaAndMetric() {
        List<StandardizedRecord> records = new ArrayList<>();
        for (int r = 0; r < 4; r++) {
            records.add(new StandardizedRecord(r, "m", 0.05, Metric.FDR, 0.1));
            records.add(new StandardizedRecord(r, "m", 0.05, Metric.TPR, 0.6));
            records.add(new StandardizedRecord(r, "m", 0.1, Metric.FDR, 0.2));
        }
        List<AggregatedRecord> result = aggregator.aggregate(records);
        assertEquals(3, result.size());
        assertEquals(0.05, result.get(0).getAlpha());
        assertEquals(Metric.FDR, result.get(0).getMetric());
        assertEquals(Metric.TPR, result.get(1).getMetric());
        assertEquals(0.1, result.get(2).getAlpha());
        assertEquals(0.2, result.get(2).getMean(), EPS);
    }

    @Test
    void testPairedDifferenceOfCovariateBlindMethodIsZero() {
        List<StandardizedRecord> a = new ArrayList<>();
        List<StandardizedRecord> b = new ArrayList<>();
        double[] values = {0.04, 0.07, 0.02, 0.05};
        for (int r = 0; r < values.length; r++) {
            a.add(new StandardizedRecord(r, "bh", 0.05, Metric.FDR, values[r]));
            b.add(new StandardizedRecord(r, "bh", 0.05, Metric.FDR, values[r]));
            a.add(new StandardizedRecord(r, "weighted", 0.05, Metric.FDR, values[r] + 0.01 * r));
            b.add(new StandardizedRecord(r, "weighted", 0.05, Metric.FDR, values[r]));
        }
        List<AggregatedRecord> result = aggregator.aggregatePairedDifference(a, b, Collections.emptySet());

        AggregatedRecord blind = find(result, "bh", Metric.FDR);
        assertEquals(0.0, blind.getMean(), 0.0);
        assertEquals(0.0, blind.getStandardError(), 0.0);
        assertEquals(4, blind.getContributingReplicates());
        assertEquals(0.015, find(result, "weighted", Metric.FDR).getMean(), EPS);
    }

    @Test
    void testPairedDifferenceDropsUnmatchedRows() {
        List<StandardizedRecord> a = List.of(
            new StandardizedRecord(0, "m", 0.05, Metric.TPR, 0.9),
            new StandardizedRecord(1, "m", 0.05, Metric.TPR, 0.8),
            new StandardizedRecord(2, "m", 0.05, Metric.TPR, 0.7));
        List<StandardizedRecord> b = List.of(
            new StandardizedRecord(0, "m", 0.05, Metric.TPR, 0.5),
            new StandardizedRecord(2, "m", 0.05, Metric.TPR, 0.5));
        AggregatedRecord result = aggregator.aggregate(AggregationMode.PAIRED_DIFFERENCE, a, b,
            Collections.emptySet()).get(0);
        assertEquals(2, result.getContributingReplicates());
        assertEquals(0.3, result.getMean(), EPS);
    }

    @Test
    void testModeDispatch() {
        List<StandardizedRecord> a = List.of(new StandardizedRecord(0, "m", 0.05, Metric.TPR, 0.9));
        assertEquals(0.9, aggregator.aggregate(AggregationMode.MEAN, a, null, Set.of()).get(0).getMean(), EPS);
        assertThrows(IllegalArgumentException.class,
            () -> aggregator.aggregate(AggregationMode.PAIRED_DIFFERENCE, a, null, Set.of()));
    }

    @Test
    void testConfidenceHalfWidth() {
        AggregatedRecord record = new AggregatedRecord("m", 0.05, Metric.FDR, 0.1, 0.02, 10);
        // t(9) 97.5% quantile
        assertEquals(2.262157163 * 0.02, record.confidenceHalfWidth(0.95), 1e-8);
        assertThrows(IllegalArgumentException.class, () -> record.confidenceHalfWidth(1.0));
    }
}
