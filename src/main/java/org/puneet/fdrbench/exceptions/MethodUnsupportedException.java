package org.puneet.fdrbench.exceptions;

import java.io.Serial;

/**
 * Thrown by a correction method to declare that it cannot handle the supplied input,
 * for example a covariate with zero variance or too few tests per stratum.
 * The executor records it as an unsupported-input failure for that method only.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class MethodUnsupportedException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 1L;

    public MethodUnsupportedException(String message) {
        super(message);
    }
}
