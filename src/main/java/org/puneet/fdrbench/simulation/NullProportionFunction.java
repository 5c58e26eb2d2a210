package org.puneet.fdrbench.simulation;

/**
 * Null proportion curve: the probability that a hypothesis with the given covariate
 * value in [0, 1] is null.
 */
@FunctionalInterface
public interface NullProportionFunction {

    double pi0(double covariate);
}
