package org.puneet.fdrbench.execution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Options for one {@link BenchExecutor} run.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class ExecutionOptions {

    /** Passthrough name of the independent covariate column. */
    public static final String COVARIATE_FEATURE = "ind_covariate";

    private final int replicateId;
    private final String groundTruthColumn;
    private final List<String> passthroughFeatures;
    private final Duration methodTimeout;

    private ExecutionOptions(Builder builder) {
        this.replicateId = builder.replicateId;
        this.groundTruthColumn = builder.groundTruthColumn;
        this.passthroughFeatures = Collections.unmodifiableList(new ArrayList<>(builder.passthroughFeatures));
        this.methodTimeout = builder.methodTimeout;
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy bound to another replicate index.
     */
    public ExecutionOptions forReplicate(int replicate) {
        Builder b = builder()
            .replicateId(replicate)
            .groundTruthColumn(groundTruthColumn)
            .methodTimeout(methodTimeout);
        passthroughFeatures.forEach(b::passthroughFeature);
        return b.build();
    }

    public int getReplicateId() {
        return replicateId;
    }

    /**
     * Feature column whose non-zero entries mark non-null hypotheses, or null to use the
     * dataset's own truth labels.
     */
    public String getGroundTruthColumn() {
        return groundTruthColumn;
    }

    public List<String> getPassthroughFeatures() {
        return passthroughFeatures;
    }

    public Duration getMethodTimeout() {
        return methodTimeout;
    }

    public boolean hasMethodTimeout() {
        return !methodTimeout.isZero() && !methodTimeout.isNegative();
    }

    public static final class Builder {
        private int replicateId = 0;
        private String groundTruthColumn;
        private final List<String> passthroughFeatures = new ArrayList<>();
        private Duration methodTimeout = Duration.ZERO;

        public Builder replicateId(int replicateId) {
            this.replicateId = replicateId;
            return this;
        }

        public Builder groundTruthColumn(String column) {
            this.groundTruthColumn = column;
            return this;
        }

        /**
         * Requests a dataset column to be copied into the result. {@value #COVARIATE_FEATURE}
         * refers to the independent covariate; other names refer to dataset features.
         */
        public Builder passthroughFeature(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Feature name cannot be null or blank");
            }
            if (!passthroughFeatures.contains(name)) {
                passthroughFeatures.add(name);
            }
            return this;
        }

        /**
         * Per-method time limit; zero disables it.
         */
        public Builder methodTimeout(Duration timeout) {
            this.methodTimeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
