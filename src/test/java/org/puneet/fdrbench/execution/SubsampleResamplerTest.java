package org.puneet.fdrbench.execution;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import org.puneet.fdrbench.data.Dataset;
import org.puneet.fdrbench.exceptions.ResamplingException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SubsampleResamplerTest {

    private static Dataset source(int m, int nonNull) {
        double[] p = new double[m];
        double[] id = new double[m];
        boolean[] truth = new boolean[m];
        for (int i = 0; i < m; i++) {
            p[i] = (i + 1.0) / (m + 1.0);
            id[i] = i;
            truth[i] = i < nonNull;
        }
        return Dataset.builder(p).truth(truth).feature("row", id).build();
    }

    @Test
    void testDrawsDistinctRows() {
        Dataset sub = new SubsampleResampler(40).resample(source(100, 10), new Well19937c(1L));
        assertEquals(40, sub.size());
        Set<Double> rows = new HashSet<>();
        for (double r : sub.getFeature("row")) {
            rows.add(r);
        }
        assertEquals(40, rows.size());
    }

    @Test
    void testSameSeedSameSubsample() {
        SubsampleResampler resampler = new SubsampleResampler(25);
        Dataset a = resampler.resample(source(100, 10), new Well19937c(3L));
        Dataset b = resampler.resample(source(100, 10), new Well19937c(3L));
        assertEquals(a, b);
    }

    @Test
    void testBalanceConstraintHonoured() {
        SubsampleResampler resampler = new SubsampleResampler(20, 2, 1000);
        for (long seed = 0; seed < 20; seed++) {
            Dataset sub = resampler.resample(source(200, 20), new Well19937c(seed));
            int nonNull = sub.countNonNull();
            assertTrue(nonNull >= 2, "seed " + seed);
            assertTrue(sub.size() - nonNull >= 2, "seed " + seed);
        }
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        // only one non-null row exists, so two per class is impossible
        SubsampleResampler resampler = new SubsampleResampler(10, 2, 7);
        ResamplingException ex = assertThrows(ResamplingException.class,
            () -> resampler.resample(source(50, 1), new Well19937c(9L)));
        assertEquals(7, ex.getAttempts());
    }

    @Test
    void testSizeLargerThanSourceFails() {
        assertThrows(ResamplingException.class,
            () -> new SubsampleResampler(11).resample(source(10, 2), new Well19937c(1L)));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new SubsampleResampler(0));
        assertThrows(IllegalArgumentException.class, () -> new SubsampleResampler(5, -1, 3));
        assertThrows(IllegalArgumentException.class, () -> new SubsampleResampler(5, 1, 0));
    }

    @Test
    void testRowsAreSorted() {
        Dataset sub = new SubsampleResampler(15).resample(source(60, 5), new Well19937c(12L));
        double[] rows = sub.getFeature("row");
        double[] sorted = rows.clone();
        Arrays.sort(sorted);
        assertArrayEquals(sorted, rows);
        assertEquals(15, new SubsampleResampler(15).outputSize(source(60, 5)));
    }
}
