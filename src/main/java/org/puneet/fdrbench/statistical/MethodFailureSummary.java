package org.puneet.fdrbench.statistical;

import org.puneet.fdrbench.data.FailureType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * How often one method failed across the replicates of an ensemble.
 */
public final class MethodFailureSummary {

    private final String methodId;
    private final int failedReplicates;
    private final int totalReplicates;
    private final Map<FailureType, Integer> failuresByType;

    public MethodFailureSummary(String methodId, int failedReplicates, int totalReplicates,
                                Map<FailureType, Integer> failuresByType) {
        this.methodId = methodId;
        this.failedReplicates = failedReplicates;
        this.totalReplicates = totalReplicates;
        Map<FailureType, Integer> copy = new EnumMap<>(FailureType.class);
        copy.putAll(failuresByType);
        this.failuresByType = Collections.unmodifiableMap(copy);
    }

    public String getMethodId() {
        return methodId;
    }

    public int getFailedReplicates() {
        return failedReplicates;
    }

    public int getTotalReplicates() {
        return totalReplicates;
    }

    public double getFailureFraction() {
        return totalReplicates == 0 ? 0.0 : (double) failedReplicates / totalReplicates;
    }

    public Map<FailureType, Integer> getFailuresByType() {
        return failuresByType;
    }

    @Override
    public String toString() {
        return String.format("%s: failed in %d/%d replicates (%.1f%%) %s", methodId, failedReplicates,
            totalReplicates, 100 * getFailureFraction(), failuresByType);
    }
}
