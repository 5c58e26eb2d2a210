package org.puneet.fdrbench.statistical;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricTest {

    @Test
    void testLabels() {
        assertEquals(Metric.REJECTPROP, Metric.fromLabel("rejectprop"));
        assertEquals(Metric.FDR, Metric.fromLabel("fdr"));
        assertEquals("rejections", Metric.REJECTIONS.getLabel());
        assertThrows(IllegalArgumentException.class, () -> Metric.fromLabel("power"));
    }

    @Test
    void testTruthRequirement() {
        assertTrue(Metric.FDR.requiresTruth());
        assertTrue(Metric.TNR.requiresTruth());
        assertFalse(Metric.REJECTIONS.requiresTruth());
        assertFalse(Metric.REJECTPROP.requiresTruth());
    }
}
