package org.puneet.fdrbench.exceptions;

import java.io.Serial;

/**
 * Thrown when an operation names a method identifier the registry does not hold.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class UnknownMethodException extends RegistryException {

    @Serial
    private static final long serialVersionUID = 1L;

    public UnknownMethodException(String methodId) {
        super(RegistryErrorType.UNKNOWN_METHOD, methodId,
            String.format("method '%s' is not registered", methodId));
    }
}
