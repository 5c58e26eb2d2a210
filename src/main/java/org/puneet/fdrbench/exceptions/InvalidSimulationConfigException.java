package org.puneet.fdrbench.exceptions;

import java.io.Serial;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exception for invalid simulation settings. Raised when a simulation configuration
 * is built and, under the fail-fast null proportion policy, while a replicate is drawn.
 * Configuration errors are fatal and never retried.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class InvalidSimulationConfigException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Types of simulation configuration failures
     */
    public enum SimulationErrorType {
        INVALID_HYPOTHESIS_COUNT("SIM001", "Hypothesis count must be positive"),
        NON_NULL_COUNT_EXCEEDS_M("SIM002", "Requested non-null count exceeds hypothesis count"),
        MISSING_COMPONENT("SIM003", "Required simulation component missing"),
        PI0_OUT_OF_RANGE("SIM004", "Null proportion outside [0, 1]"),
        INVALID_PARAMETER("SIM005", "Invalid distribution parameter");

        private final String code;
        private final String description;

        SimulationErrorType(String code, String description) {
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

    private final SimulationErrorType errorType;
    private final Map<String, Object> context;

    /**
     * Constructs a new InvalidSimulationConfigException.
     *
     * @param errorType the type of configuration failure
     * @param message the detailed error message
     * @throws NullPointerException if errorType is null
     */
    public InvalidSimulationConfigException(SimulationErrorType errorType, String message) {
        this(errorType, message, new HashMap<>());
    }

    /**
     * Constructs a new InvalidSimulationConfigException with offending values attached.
     *
     * @param errorType the type of configuration failure
     * @param message the detailed error message
     * @param context offending parameter values keyed by name
     * @throws NullPointerException if errorType is null
     */
    public InvalidSimulationConfigException(SimulationErrorType errorType, String message,
                                            Map<String, Object> context) {
        super(String.format("[%s] %s: %s",
            Objects.requireNonNull(errorType, "Error type cannot be null").getCode(),
            errorType.getDescription(), message));
        this.errorType = errorType;
        this.context = context != null ? new HashMap<>(context) : new HashMap<>();
    }

    /**
     * Creates an exception for a non-null count larger than the number of hypotheses.
     *
     * @param nonNullCount requested non-null count
     * @param m hypothesis count
     * @return the exception
     */
    public static InvalidSimulationConfigException nonNullCountExceedsM(int nonNullCount, int m) {
        Map<String, Object> context = new HashMap<>();
        context.put("nonNullCount", nonNullCount);
        context.put("m", m);
        return new InvalidSimulationConfigException(SimulationErrorType.NON_NULL_COUNT_EXCEEDS_M,
            String.format("non-null count %d > m = %d", nonNullCount, m), context);
    }

    /**
     * Creates an exception for a null proportion curve that left [0, 1].
     *
     * @param covariate covariate value the curve was evaluated at
     * @param pi0 value returned by the curve
     * @return the exception
     */
    public static InvalidSimulationConfigException pi0OutOfRange(double covariate, double pi0) {
        Map<String, Object> context = new HashMap<>();
        context.put("covariate", covariate);
        context.put("pi0", pi0);
        return new InvalidSimulationConfigException(SimulationErrorType.PI0_OUT_OF_RANGE,
            String.format("pi0(%.4f) = %.4f", covariate, pi0), context);
    }

    public SimulationErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }
}
