package org.puneet.fdrbench.exceptions;

import java.io.Serial;

/**
 * Thrown when a method identifier is registered twice.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class DuplicateMethodException extends RegistryException {

    @Serial
    private static final long serialVersionUID = 1L;

    public DuplicateMethodException(String methodId) {
        super(RegistryErrorType.DUPLICATE_METHOD, methodId,
            String.format("method '%s' is already present in the registry", methodId));
    }
}
