package org.puneet.fdrbench.execution;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.fdrbench.data.Dataset;

/**
 * Draws one resampled dataset (for example a random subsample) from a fixed source dataset.
 */
@FunctionalInterface
public interface ResamplingFunction {

    Dataset resample(Dataset source, RandomGenerator rng);

    /**
     * Number of hypotheses a resample of {@code source} holds. Used to size the
     * all-missing result of a replicate whose resampling failed.
     */
    default int outputSize(Dataset source) {
        return source.size();
    }
}
