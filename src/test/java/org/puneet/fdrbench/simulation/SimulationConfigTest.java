package org.puneet.fdrbench.simulation;

import org.junit.jupiter.api.Test;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException.SimulationErrorType;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest {

    private static SimulationConfig.Builder valid() {
        return SimulationConfig.builder()
            .hypotheses(10)
            .pi0Function(Pi0Functions.constant(0.8))
            .effectSizes(EffectSizeDistributions.constant(2.0));
    }

    @Test
    void testDefaults() throws Exception {
        SimulationConfig config = valid().build();
        assertEquals(10, config.getHypotheses());
        assertFalse(config.getNonNullCount().isPresent());
        assertEquals(Pi0Policy.CLAMP, config.getPi0Policy());
        assertNotNull(config.getPerturber());
        assertNotNull(config.getPValueFunction());
        assertNotNull(config.getUninformativeSampler());
    }

    @Test
    void testNonNullCountExceedingMFails() {
        InvalidSimulationConfigException ex = assertThrows(InvalidSimulationConfigException.class,
            () -> valid().nonNullCount(11).build());
        assertEquals(SimulationErrorType.NON_NULL_COUNT_EXCEEDS_M, ex.getErrorType());
        assertThrows(InvalidSimulationConfigException.class, () -> valid().nonNullCount(-1).build());
    }

    @Test
    void testNonPositiveHypothesisCountFails() {
        InvalidSimulationConfigException ex = assertThrows(InvalidSimulationConfigException.class,
            () -> valid().hypotheses(0).build());
        assertEquals(SimulationErrorType.INVALID_HYPOTHESIS_COUNT, ex.getErrorType());
    }

    @Test
    void testMissingComponentFails() {
        InvalidSimulationConfigException ex = assertThrows(InvalidSimulationConfigException.class,
            () -> valid().effectSizes(null).build());
        assertEquals(SimulationErrorType.MISSING_COMPONENT, ex.getErrorType());
        assertThrows(InvalidSimulationConfigException.class, () -> valid().pi0Function(null).build());
        assertThrows(InvalidSimulationConfigException.class, () -> valid().pValueFunction(null).build());
    }
}
