package org.puneet.fdrbench.data;

/**
 * Reasons a method column can end up missing in a {@link BenchResult}.
 */
public enum FailureType {
    /** The method or its output extractor threw. */
    EXCEPTION,
    /** The extracted vector did not have one entry per hypothesis. */
    LENGTH_MISMATCH,
    /** The method declared the input unsupported. */
    UNSUPPORTED_INPUT,
    /** The dataset lacks a column the method binds. */
    MISSING_INPUT,
    /** The invocation exceeded the configured timeout. */
    TIMEOUT,
    /** The whole replicate failed before any method ran. */
    REPLICATE_FAILURE
}
