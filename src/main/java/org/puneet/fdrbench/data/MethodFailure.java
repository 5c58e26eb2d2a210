package org.puneet.fdrbench.data;

import java.util.Objects;

/**
 * One entry of the per-method error log attached to a {@link BenchResult}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class MethodFailure {

    private final String methodId;
    private final int replicateId;
    private final FailureType type;
    private final String message;
    private final String causeClass;

    public MethodFailure(String methodId, int replicateId, FailureType type,
                         String message, String causeClass) {
        this.methodId = Objects.requireNonNull(methodId, "Method id cannot be null");
        this.replicateId = replicateId;
        this.type = Objects.requireNonNull(type, "Failure type cannot be null");
        this.message = message == null ? "" : message;
        this.causeClass = causeClass;
    }

    /**
     * Creates a failure record from a caught throwable.
     */
    public static MethodFailure fromThrowable(String methodId, int replicateId,
                                              FailureType type, Throwable cause) {
        return new MethodFailure(methodId, replicateId, type,
            cause.getMessage(), cause.getClass().getName());
    }

    public String getMethodId() {
        return methodId;
    }

    public int getReplicateId() {
        return replicateId;
    }

    public FailureType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public String getCauseClass() {
        return causeClass;
    }

    @Override
    public String toString() {
        return String.format("MethodFailure{method='%s', replicate=%d, type=%s, cause=%s, message='%s'}",
            methodId, replicateId, type, causeClass, message);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        MethodFailure that = (MethodFailure) obj;
        return replicateId == that.replicateId
            && methodId.equals(that.methodId)
            && type == that.type
            && message.equals(that.message)
            && Objects.equals(causeClass, that.causeClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(methodId, replicateId, type, message, causeClass);
    }
}
