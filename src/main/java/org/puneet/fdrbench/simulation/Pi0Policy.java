package org.puneet.fdrbench.simulation;

/**
 * What the generator does when a null proportion curve leaves [0, 1].
 */
public enum Pi0Policy {
    /** Clamp into [0, 1], log a warning and continue. */
    CLAMP,
    /** Abort the replicate with an {@code InvalidSimulationConfigException}. */
    FAIL
}
