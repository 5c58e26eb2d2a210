package org.puneet.fdrbench.execution;

import org.puneet.fdrbench.data.ReplicateEnsemble;

import java.util.Objects;

/**
 * Informative and uninformative ensembles of one simulation run. Replicate {@code i} of
 * both ensembles comes from the same draw, so they can be joined for paired differences.
 */
public final class PairedEnsembles {

    public static final String INFORMATIVE = "informative";
    public static final String UNINFORMATIVE = "uninformative";

    private final ReplicateEnsemble informative;
    private final ReplicateEnsemble uninformative;

    public PairedEnsembles(ReplicateEnsemble informative, ReplicateEnsemble uninformative) {
        this.informative = Objects.requireNonNull(informative, "Informative ensemble cannot be null");
        this.uninformative = Objects.requireNonNull(uninformative, "Uninformative ensemble cannot be null");
        if (informative.size() != uninformative.size()) {
            throw new IllegalArgumentException(String.format(
                "Paired ensembles differ in size: %d vs %d", informative.size(), uninformative.size()));
        }
    }

    public ReplicateEnsemble getInformative() {
        return informative;
    }

    public ReplicateEnsemble getUninformative() {
        return uninformative;
    }

    public int size() {
        return informative.size();
    }
}
