package org.puneet.fdrbench.util;

import java.util.function.Supplier;

/**
 * Keyed store for expensive intermediate results such as replicate ensembles.
 * Callers never see where values live.
 *
 * @param <V> value type
 */
public interface ResultCache<V> {

    /**
     * Returns the value stored under {@code key}, computing and storing it first if absent.
     * The supplier runs at most once per key.
     */
    V getOrCompute(String key, Supplier<? extends V> compute);

    boolean contains(String key);

    void invalidate(String key);
}
