package org.puneet.fdrbench.method;

/**
 * A multiple-testing correction procedure. Implementations receive the dataset columns
 * they declared at registration plus their parameters, and return a raw result that the
 * registered {@link OutputExtractor} turns into adjusted p-values.
 *
 * <p>Implementations may throw any exception; the executor records it as a failure of
 * this method only.</p>
 */
@FunctionalInterface
public interface CorrectionMethod {

    Object apply(MethodInput input) throws Exception;
}
