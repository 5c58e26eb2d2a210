package org.puneet.fdrbench.execution;

/**
 * Work unit of one replicate. Implementations must derive all randomness from the
 * replicate index so that results do not depend on which worker runs them.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ReplicateTask<T> {
    T run(int replicate) throws Exception;
}
