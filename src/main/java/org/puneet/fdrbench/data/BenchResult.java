package org.puneet.fdrbench.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Output of one benchmark execution: a tests-by-methods table of adjusted p-values,
 * the carried-through truth labels, optional passthrough feature columns and the
 * per-method error log.
 *
 * <p>A method column that is entirely NaN means the method failed for this dataset.
 * That is an expected state and does not invalidate the rest of the result.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class BenchResult {

    private final int replicateId;
    private final int size;
    private final List<String> methodIds;
    private final Map<String, double[]> qValues;
    private final boolean[] truth;
    private final Map<String, double[]> features;
    private final List<MethodFailure> failures;

    /**
     * Creates a bench result.
     *
     * @param replicateId index of the replicate this result belongs to
     * @param size number of hypotheses
     * @param qValues adjusted p-values keyed by method id, in registry order
     * @param truth non-null indicators, or null when unknown
     * @param features passthrough feature columns, may be empty
     * @param failures per-method error log
     * @throws IllegalArgumentException if a column is not aligned with {@code size}
     */
    public BenchResult(int replicateId, int size, Map<String, double[]> qValues, boolean[] truth,
                       Map<String, double[]> features, List<MethodFailure> failures) {
        Objects.requireNonNull(qValues, "Q-value table cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Size cannot be negative");
        }
        this.replicateId = replicateId;
        this.size = size;
        this.methodIds = List.copyOf(qValues.keySet());

        Map<String, double[]> q = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : qValues.entrySet()) {
            double[] column = Objects.requireNonNull(e.getValue(), "Q-value column cannot be null");
            if (column.length != size) {
                throw new IllegalArgumentException(String.format(
                    "Q-value column %s has %d rows, expected %d", e.getKey(), column.length, size));
            }
            q.put(e.getKey(), column.clone());
        }
        this.qValues = Collections.unmodifiableMap(q);

        if (truth != null && truth.length != size) {
            throw new IllegalArgumentException("Truth column is not aligned with the q-value table");
        }
        this.truth = truth == null ? null : truth.clone();

        Map<String, double[]> f = new LinkedHashMap<>();
        if (features != null) {
            features.forEach((name, column) -> {
                if (column.length != size) {
                    throw new IllegalArgumentException("Feature column " + name + " is not aligned");
                }
                f.put(name, column.clone());
            });
        }
        this.features = Collections.unmodifiableMap(f);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    /**
     * Creates a result where every method column is missing, used when a replicate
     * failed as a whole. The replicate is kept so ensemble indices stay aligned.
     *
     * @param replicateId replicate index
     * @param size number of hypotheses, 0 when unknown
     * @param methodIds methods that would have run
     * @param cause the failure
     * @return the all-missing result
     */
    public static BenchResult allMissing(int replicateId, int size, List<String> methodIds, Throwable cause) {
        Map<String, double[]> q = new LinkedHashMap<>();
        List<MethodFailure> log = new ArrayList<>();
        for (String id : methodIds) {
            double[] column = new double[size];
            Arrays.fill(column, Double.NaN);
            q.put(id, column);
            log.add(MethodFailure.fromThrowable(id, replicateId, FailureType.REPLICATE_FAILURE, cause));
        }
        return new BenchResult(replicateId, size, q, null, null, log);
    }

    public int getReplicateId() {
        return replicateId;
    }

    public int size() {
        return size;
    }

    public List<String> getMethodIds() {
        return methodIds;
    }

    /**
     * Returns the adjusted p-values of one method.
     *
     * @param methodId the method
     * @return a copy of the column, or null if the method was not part of this run
     */
    public double[] getQValues(String methodId) {
        double[] column = qValues.get(methodId);
        return column == null ? null : column.clone();
    }

    /**
     * Whether the method has no usable q-value for this replicate, either because it was
     * not run or because its column is entirely missing.
     */
    public boolean isMissing(String methodId) {
        double[] column = qValues.get(methodId);
        if (column == null) {
            return true;
        }
        for (double v : column) {
            if (!Double.isNaN(v)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasTruth() {
        return truth != null;
    }

    public boolean[] getTruth() {
        return truth == null ? null : truth.clone();
    }

    /**
     * Names of the feature columns, in insertion order. Columns are read through {@link #getFeature(String)}.
     */
    public Set<String> getFeatureNames() {
        return features.keySet();
    }

    public double[] getFeature(String name) {
        double[] column = features.get(name);
        return column == null ? null : column.clone();
    }

    public List<MethodFailure> getFailures() {
        return failures;
    }

    public Optional<MethodFailure> getFailure(String methodId) {
        return failures.stream().filter(f -> f.getMethodId().equals(methodId)).findFirst();
    }

    public boolean hasFailed(String methodId) {
        return getFailure(methodId).isPresent();
    }

    @Override
    public String toString() {
        return String.format("BenchResult{replicate=%d, m=%d, methods=%s, truth=%s, failures=%d}",
            replicateId, size, methodIds, truth != null, failures.size());
    }
}
