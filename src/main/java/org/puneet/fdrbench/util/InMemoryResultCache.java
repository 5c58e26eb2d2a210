package org.puneet.fdrbench.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Thread-safe {@link ResultCache} backed by a {@link ConcurrentHashMap}.
 *
 * @param <V> value type
 */
public class InMemoryResultCache<V> implements ResultCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final ConcurrentMap<String, V> values = new ConcurrentHashMap<>();

    @Override
    public V getOrCompute(String key, Supplier<? extends V> compute) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(compute, "Supplier cannot be null");
        return values.computeIfAbsent(key, k -> {
            logger.debug("Cache miss for '{}', computing", k);
            return Objects.requireNonNull(compute.get(), "Computed value cannot be null");
        });
    }

    @Override
    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public void invalidate(String key) {
        values.remove(key);
    }

    public int size() {
        return values.size();
    }
}
