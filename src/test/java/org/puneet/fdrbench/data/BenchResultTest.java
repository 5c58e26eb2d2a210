package org.puneet.fdrbench.data;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BenchResultTest {

    @Test
    void testColumnsAndMissingness() {
        Map<String, double[]> q = new LinkedHashMap<>();
        q.put("b", new double[] {0.1, 0.2});
        q.put("a", new double[] {Double.NaN, Double.NaN});
        q.put("c", new double[] {Double.NaN, 0.3});
        MethodFailure failure = new MethodFailure("a", 4, FailureType.EXCEPTION, "boom", "java.lang.RuntimeException");
        BenchResult result = new BenchResult(4, 2, q, new boolean[] {true, false}, null, List.of(failure));

        assertEquals(List.of("b", "a", "c"), result.getMethodIds());
        assertFalse(result.isMissing("b"));
        assertTrue(result.isMissing("a"));
        assertFalse(result.isMissing("c"));
        assertTrue(result.isMissing("not-run"));
        assertNull(result.getQValues("not-run"));
        assertTrue(result.hasFailed("a"));
        assertFalse(result.hasFailed("b"));
        assertEquals(FailureType.EXCEPTION, result.getFailure("a").get().getType());
        assertEquals(4, result.getReplicateId());
    }

    @Test
    void testFeatureColumnsCannotBeModified() {
        Map<String, double[]> q = Map.of("m", new double[] {0.1, 0.2});
        Map<String, double[]> features = new LinkedHashMap<>();
        features.put("ind_covariate", new double[] {0.3, 0.7});
        BenchResult result = new BenchResult(0, 2, q, null, features, null);

        features.get("ind_covariate")[0] = 5.0;
        result.getFeature("ind_covariate")[0] = 99.0;
        assertEquals(0.3, result.getFeature("ind_covariate")[0]);
        assertEquals(List.of("ind_covariate"), List.copyOf(result.getFeatureNames()));
        assertThrows(UnsupportedOperationException.class, () -> result.getFeatureNames().clear());
    }

    @Test
    void testRejectsMisalignedColumns() {
        Map<String, double[]> q = Map.of("x", new double[] {0.1});
        assertThrows(IllegalArgumentException.class, () -> new BenchResult(0, 2, q, null, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new BenchResult(0, 1, q, new boolean[] {true, false}, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> new BenchResult(0, 1, q, null, Map.of("f", new double[] {1, 2}), null));
    }

    @Test
    void testAllMissing() {
        BenchResult result = BenchResult.allMissing(2, 3, List.of("m1", "m2"),
            new IllegalStateException("no data"));
        assertEquals(List.of("m1", "m2"), result.getMethodIds());
        assertTrue(result.isMissing("m1"));
        assertTrue(result.isMissing("m2"));
        assertEquals(3, result.getQValues("m1").length);
        assertEquals(2, result.getFailures().size());
        MethodFailure failure = result.getFailure("m2").get();
        assertEquals(FailureType.REPLICATE_FAILURE, failure.getType());
        assertEquals("java.lang.IllegalStateException", failure.getCauseClass());
        assertEquals(2, failure.getReplicateId());
        assertFalse(result.hasTruth());
    }

    @Test
    void testEnsembleMethodIdsAreUnionInOrder() {
        BenchResult r0 = new BenchResult(0, 1, new LinkedHashMap<>(Map.of("a", new double[] {0.1})),
            null, null, null);
        Map<String, double[]> q1 = new LinkedHashMap<>();
        q1.put("a", new double[] {0.2});
        q1.put("b", new double[] {0.3});
        BenchResult r1 = new BenchResult(1, 1, q1, null, null, null);
        ReplicateEnsemble ensemble = new ReplicateEnsemble("test", List.of(r0, r1));
        assertEquals(List.of("a", "b"), ensemble.getMethodIds());
        assertEquals(2, ensemble.size());
        assertSame(r1, ensemble.get(1));
        assertEquals("test", ensemble.getLabel());
    }
}
