package org.puneet.fdrbench.exceptions;

import java.io.Serial;

/**
 * Thrown when a resampling function cannot produce a replicate, typically because
 * its balance constraint was not met within the configured number of attempts.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ResamplingException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public ResamplingException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
