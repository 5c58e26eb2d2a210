package org.puneet.fdrbench.statistical;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StandardizerTest {

    private static final double EPS = 1e-12;

    private final Standardizer standardizer = new Standardizer();

    private static double value(List<StandardizedRecord> records, int replicate, String method,
                                double alpha, Metric metric) {
        return records.stream()
            .filter(r -> r.getReplicate() == replicate && r.getMethodId().equals(method)
                && r.getAlpha() == alpha && r.getMetric() == metric)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No record for " + method + " " + alpha + " " + metric))
            .getValue();
    }

    private static ReplicateEnsemble ensembleOf(BenchResult... results) {
        return new ReplicateEnsemble("test", Arrays.asList(results));
    }

    @Test
    void testHandComputedMetrics() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("m", new double[] {0.01, 0.2, 0.03, 0.5, Double.NaN});
        boolean[] truth = {true, true, false, false, false};
        List<StandardizedRecord> records = standardizer.standardize(
            ensembleOf(new BenchResult(0, 5, q, truth, null, null)), new double[] {0.05, 0.25});

        assertEquals(12, records.size());
        assertEquals(0.5, value(records, 0, "m", 0.05, Metric.FDR), EPS);
        assertEquals(0.5, value(records, 0, "m", 0.05, Metric.TPR), EPS);
        assertEquals(1.0, value(records, 0, "m", 0.05, Metric.FWER), EPS);
        assertEquals(2.0 / 3.0, value(records, 0, "m", 0.05, Metric.TNR), EPS);
        assertEquals(2.0, value(records, 0, "m", 0.05, Metric.REJECTIONS), EPS);
        assertEquals(0.4, value(records, 0, "m", 0.05, Metric.REJECTPROP), EPS);

        assertEquals(1.0 / 3.0, value(records, 0, "m", 0.25, Metric.FDR), EPS);
        assertEquals(1.0, value(records, 0, "m", 0.25, Metric.TPR), EPS);
        assertEquals(3.0, value(records, 0, "m", 0.25, Metric.REJECTIONS), EPS);
    }

    @Test
    void testRecordOrder() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("b", new double[] {0.01, 0.5});
        q.put("a", new double[] {0.01, 0.5});
        BenchResult result = new BenchResult(0, 2, q, new boolean[] {true, false}, null, null);
        List<StandardizedRecord> records = standardizer.standardize(ensembleOf(result, result),
            new double[] {0.01, 0.1});

        assertEquals(2 * 2 * 2 * 6, records.size());
        assertEquals(0, records.get(0).getReplicate());
        assertEquals("b", records.get(0).getMethodId());
        assertEquals(0.01, records.get(0).getAlpha());
        assertEquals(Metric.FDR, records.get(0).getMetric());
        assertEquals(Metric.REJECTPROP, records.get(5).getMetric());
        assertEquals(0.1, records.get(6).getAlpha());
        assertEquals("a", records.get(12).getMethodId());
        assertEquals(1, records.get(24).getReplicate());
    }

    @Test
    void testRejectionsMonotoneInAlpha() {
        RandomGenerator rng = new Well19937c(3L);
        double[] p = new double[300];
        boolean[] truth = new boolean[300];
        for (int i = 0; i < p.length; i++) {
            truth[i] = i < 30;
            p[i] = truth[i] ? rng.nextDouble() * 0.01 : rng.nextDouble();
        }
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("identity", p);
        double[] alphas = {0.001, 0.01, 0.05, 0.1, 0.2, 0.5, 1.0};
        List<StandardizedRecord> records = standardizer.standardize(
            ensembleOf(new BenchResult(0, 300, q, truth, null, null)), alphas);

        double previous = -1;
        for (double alpha : alphas) {
            double rejections = value(records, 0, "identity", alpha, Metric.REJECTIONS);
            assertTrue(rejections >= previous);
            assertTrue(rejections >= 0 && rejections <= 300);
            double fdr = value(records, 0, "identity", alpha, Metric.FDR);
            assertTrue(fdr >= 0 && fdr <= 1);
            previous = rejections;
        }
        assertEquals(300.0, value(records, 0, "identity", 1.0, Metric.REJECTIONS), EPS);
    }

    @Test
    void testNoRejectionsMeansZeroFdr() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("ones", new double[] {1.0, 1.0, 1.0, 1.0});
        q.put("zeros", new double[] {0.0, 0.0, 0.0, 0.0});
        boolean[] truth = {true, false, false, false};
        List<StandardizedRecord> records = standardizer.standardize(
            ensembleOf(new BenchResult(0, 4, q, truth, null, null)), new double[] {0.05, 0.1});

        for (double alpha : new double[] {0.05, 0.1}) {
            assertEquals(0.0, value(records, 0, "ones", alpha, Metric.REJECTIONS), EPS);
            assertEquals(0.0, value(records, 0, "ones", alpha, Metric.FDR), EPS);
            assertEquals(0.0, value(records, 0, "ones", alpha, Metric.TPR), EPS);
            assertEquals(0.0, value(records, 0, "ones", alpha, Metric.FWER), EPS);
            assertEquals(1.0, value(records, 0, "ones", alpha, Metric.TNR), EPS);

            assertEquals(4.0, value(records, 0, "zeros", alpha, Metric.REJECTIONS), EPS);
            assertEquals(0.75, value(records, 0, "zeros", alpha, Metric.FDR), EPS);
            assertEquals(1.0, value(records, 0, "zeros", alpha, Metric.TPR), EPS);
            assertEquals(0.0, value(records, 0, "zeros", alpha, Metric.TNR), EPS);
            assertEquals(1.0, value(records, 0, "zeros", alpha, Metric.REJECTPROP), EPS);
        }
    }

    @Test
    void testUncorrectedPValuesInflateFdr() {
        RandomGenerator rng = new Well19937c(1000L);
        int m = 1000;
        double[] p = new double[m];
        boolean[] truth = new boolean[m];
        NormalDistribution noise = new NormalDistribution(rng, 0, 1);
        NormalDistribution reference = new NormalDistribution();
        for (int i = 0; i < m; i++) {
            truth[i] = rng.nextDouble() >= 0.9;
            double z = (truth[i] ? 3.0 : 0.0) + noise.sample();
            p[i] = 2 * reference.cumulativeProbability(-Math.abs(z));
        }
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("identity", p);
        List<StandardizedRecord> records = standardizer.standardize(
            ensembleOf(new BenchResult(0, m, q, truth, null, null)), new double[] {0.05});

        double fdr = value(records, 0, "identity", 0.05, Metric.FDR);
        assertTrue(fdr > 0.1 && fdr < 0.6, "uncorrected FDR was " + fdr);
        assertEquals(1.0, value(records, 0, "identity", 0.05, Metric.FWER), EPS);
    }

    @Test
    void testWithoutTruthOnlyRejectionMetrics() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("m", new double[] {0.01, 0.2});
        List<StandardizedRecord> records = standardizer.standardize(
            ensembleOf(new BenchResult(0, 2, q, null, null, null)), new double[] {0.05});

        assertEquals(List.of(Metric.REJECTIONS, Metric.REJECTPROP),
            records.stream().map(StandardizedRecord::getMetric).collect(Collectors.toList()));
        assertEquals(0.5, records.get(1).getValue(), EPS);
    }

    @Test
    void testMissingColumnsProduceNoRecords() {
        BenchResult missing = BenchResult.allMissing(0, 3, List.of("m"), new IllegalStateException("x"));
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("m", new double[] {0.01, 0.2, 0.9});
        BenchResult ok = new BenchResult(1, 3, q, new boolean[] {true, false, false}, null, null);

        List<StandardizedRecord> records = standardizer.standardize(ensembleOf(missing, ok),
            new double[] {0.05});
        assertEquals(6, records.size());
        assertTrue(records.stream().allMatch(r -> r.getReplicate() == 1));
    }

    @Test
    void testIdempotent() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("m", new double[] {0.01, 0.2, 0.04});
        ReplicateEnsemble ensemble = ensembleOf(new BenchResult(0, 3, q, new boolean[] {true, false, true}, null, null));
        double[] alphas = {0.05, 0.1};
        assertEquals(standardizer.standardize(ensemble, alphas), standardizer.standardize(ensemble, alphas));
        assertThrows(UnsupportedOperationException.class,
            () -> standardizer.standardize(ensemble, alphas).add(null));
    }

    @Test
    void testInvalidThresholds() {
        ReplicateEnsemble ensemble = ensembleOf();
        assertThrows(IllegalArgumentException.class, () -> standardizer.standardize(ensemble, new double[0]));
        assertThrows(IllegalArgumentException.class, () -> standardizer.standardize(ensemble, null));
        assertThrows(IllegalArgumentException.class,
            () -> standardizer.standardize(ensemble, new double[] {0.1, 0.05}));
        assertThrows(IllegalArgumentException.class,
            () -> standardizer.standardize(ensemble, new double[] {0.05, 0.05}));
        assertThrows(IllegalArgumentException.class, () -> standardizer.standardize(ensemble, new double[] {0.0}));
        assertThrows(IllegalArgumentException.class, () -> standardizer.standardize(ensemble, new double[] {1.5}));
        assertTrue(standardizer.standardize(ensemble, new double[] {1.0}).isEmpty());
    }

    @Test
    void testManyReplicatesStayInRange() {
        RandomGenerator rng = new Well19937c(8L);
        List<BenchResult> results = new ArrayList<>();
        for (int r = 0; r < 20; r++) {
            double[] p = new double[50];
            boolean[] truth = new boolean[50];
            for (int i = 0; i < 50; i++) {
                p[i] = rng.nextDouble();
                truth[i] = rng.nextBoolean();
            }
            Map<String, double[]> q = new LinkedHashMap<>();
            q.put("m", p);
            results.add(new BenchResult(r, 50, q, truth, null, null));
        }
        List<StandardizedRecord> records = standardizer.standardize(
            new ReplicateEnsemble("many", results), new double[] {0.1, 0.5});
        for (StandardizedRecord record : records) {
            if (record.getMetric() == Metric.REJECTIONS) {
                assertTrue(record.getValue() >= 0 && record.getValue() <= 50);
            } else {
                assertTrue(record.getValue() >= 0 && record.getValue() <= 1, record.toString());
            }
        }
    }
}
