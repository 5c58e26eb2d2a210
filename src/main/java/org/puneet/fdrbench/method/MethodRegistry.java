package org.puneet.fdrbench.method;

import org.puneet.fdrbench.exceptions.DuplicateMethodException;
import org.puneet.fdrbench.exceptions.UnknownMethodException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered mapping from method identifier to {@link MethodSpec}. Insertion order is the
 * default comparison order.
 *
 * <p>Not thread-safe. Registries are built on one thread before any execution starts and
 * are only read afterwards. Use {@link #copy()} to derive variant registries.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class MethodRegistry {
    private static final Logger logger = LoggerFactory.getLogger(MethodRegistry.class);

    private final LinkedHashMap<String, MethodSpec> specs;

    public MethodRegistry() {
        this.specs = new LinkedHashMap<>();
    }

    private MethodRegistry(Map<String, MethodSpec> specs) {
        this.specs = new LinkedHashMap<>(specs);
    }

    /**
     * Adds a spec at the end of the registry.
     *
     * @param spec the method description
     * @throws DuplicateMethodException if the id is already registered
     */
    public MethodRegistry register(MethodSpec spec) throws DuplicateMethodException {
        Objects.requireNonNull(spec, "Method spec cannot be null");
        if (specs.containsKey(spec.getId())) {
            throw new DuplicateMethodException(spec.getId());
        }
        specs.put(spec.getId(), spec);
        logger.debug("Registered method {} binding {}", spec.getId(), spec.getRequiredInputs());
        return this;
    }

    /**
     * Convenience form of {@link #register(MethodSpec)}.
     *
     * @param id unique identifier
     * @param method the procedure
     * @param parameterDefaults fixed parameters
     * @param extractor output extraction rule
     * @throws DuplicateMethodException if the id is already registered
     */
    public MethodRegistry register(String id, CorrectionMethod method, Map<String, ?> parameterDefaults,
                                   OutputExtractor extractor) throws DuplicateMethodException {
        return register(MethodSpec.builder(id, method)
            .parameters(parameterDefaults == null ? Map.of() : parameterDefaults)
            .extractor(extractor)
            .build());
    }

    /**
     * Replaces the spec of {@code id} with one whose parameters are merged with
     * {@code parameters}, keeping its position. Specs held elsewhere, including
     * in copies of this registry, are unaffected.
     *
     * @param id method to override
     * @param parameters values that win over the registered defaults
     * @return the new spec
     * @throws UnknownMethodException if the id is not registered
     */
    public MethodSpec override(String id, Map<String, ?> parameters) throws UnknownMethodException {
        MethodSpec current = get(id);
        MethodSpec updated = current.withParameters(parameters);
        specs.put(id, updated);
        logger.debug("Overrode parameters of {}: {}", id, updated.getParameters());
        return updated;
    }

    /**
     * Removes a method.
     *
     * @throws UnknownMethodException if the id is not registered
     */
    public MethodSpec remove(String id) throws UnknownMethodException {
        MethodSpec removed = specs.remove(id);
        if (removed == null) {
            throw new UnknownMethodException(id);
        }
        return removed;
    }

    /**
     * Looks a method up.
     *
     * @throws UnknownMethodException if the id is not registered
     */
    public MethodSpec get(String id) throws UnknownMethodException {
        MethodSpec spec = specs.get(id);
        if (spec == null) {
            throw new UnknownMethodException(id);
        }
        return spec;
    }

    public boolean contains(String id) {
        return specs.containsKey(id);
    }

    public List<String> listIds() {
        return new ArrayList<>(specs.keySet());
    }

    public List<MethodSpec> specs() {
        return new ArrayList<>(specs.values());
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    /**
     * Creates an independent registry with the same specs in the same order.
     */
    public MethodRegistry copy() {
        return new MethodRegistry(specs);
    }

    @Override
    public String toString() {
        return "MethodRegistry" + specs.keySet();
    }
}
