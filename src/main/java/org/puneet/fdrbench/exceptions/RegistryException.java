package org.puneet.fdrbench.exceptions;

import java.io.Serial;
import java.util.Objects;

/**
 * Base class for configuration-time failures of a method registry.
 * Registry errors are programmer or user mistakes and are never retried.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class RegistryException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Types of registry failures
     */
    public enum RegistryErrorType {
        DUPLICATE_METHOD("REG001", "Method identifier already registered"),
        UNKNOWN_METHOD("REG002", "Method identifier not registered");

        private final String code;
        private final String description;

        RegistryErrorType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final RegistryErrorType errorType;
    private final String methodId;

    /**
     * Constructs a new RegistryException.
     *
     * @param errorType the type of registry failure
     * @param methodId the method identifier involved, may be null
     * @param message the detailed error message
     * @throws NullPointerException if errorType is null
     */
    public RegistryException(RegistryErrorType errorType, String methodId, String message) {
        super(formatMessage(Objects.requireNonNull(errorType, "Error type cannot be null"), message));
        this.errorType = errorType;
        this.methodId = methodId;
    }

    private static String formatMessage(RegistryErrorType errorType, String message) {
        return String.format("[%s] %s: %s", errorType.getCode(), errorType.getDescription(), message);
    }

    public RegistryErrorType getErrorType() {
        return errorType;
    }

    public String getMethodId() {
        return methodId;
    }
}
