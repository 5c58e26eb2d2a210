package org.puneet.fdrbench.data;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered sequence of bench results, one per replicate. The position of a result is its
 * replicate index; two ensembles built from the same draws share indices, which is what
 * makes paired differencing possible.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ReplicateEnsemble {

    private final String label;
    private final List<BenchResult> results;

    public ReplicateEnsemble(String label, List<BenchResult> results) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
        this.results = List.copyOf(Objects.requireNonNull(results, "Results cannot be null"));
    }

    public String getLabel() {
        return label;
    }

    public int size() {
        return results.size();
    }

    public BenchResult get(int replicate) {
        return results.get(replicate);
    }

    public List<BenchResult> getResults() {
        return results;
    }

    /**
     * Method identifiers across all replicates, in order of first appearance.
     */
    public List<String> getMethodIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (BenchResult result : results) {
            ids.addAll(result.getMethodIds());
        }
        return List.copyOf(ids);
    }

    @Override
    public String toString() {
        return String.format("ReplicateEnsemble{label='%s', replicates=%d}", label, results.size());
    }
}
