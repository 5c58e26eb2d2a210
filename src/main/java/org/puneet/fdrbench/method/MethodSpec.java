package org.puneet.fdrbench.method;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of a correction method: the procedure to invoke, the dataset
 * columns it binds, its fixed parameters and the rule extracting adjusted p-values from
 * its output. Immutable; {@link #withParameters(Map)} returns a new spec.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class MethodSpec {

    private final String id;
    private final CorrectionMethod method;
    private final Set<InputField> requiredInputs;
    private final Map<String, Object> parameters;
    private final OutputExtractor extractor;
    private final String description;

    private MethodSpec(Builder builder) {
        this.id = builder.id;
        this.method = builder.method;
        this.requiredInputs = Collections.unmodifiableSet(EnumSet.copyOf(builder.requiredInputs));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.extractor = builder.extractor;
        this.description = builder.description;
    }

    /**
     * Starts a spec for the given identifier and procedure. Binds {@code p_value} by default
     * and uses the identity extractor.
     */
    public static Builder builder(String id, CorrectionMethod method) {
        return new Builder(id, method);
    }

    /**
     * Returns a copy with the given parameters merged over the current ones; the
     * supplied values win.
     *
     * @param overrides parameter values to set
     * @return the new spec
     */
    public MethodSpec withParameters(Map<String, ?> overrides) {
        Objects.requireNonNull(overrides, "Overrides cannot be null");
        Builder b = toBuilder();
        b.parameters.putAll(overrides);
        return b.build();
    }

    private Builder toBuilder() {
        Builder b = new Builder(id, method);
        b.requiredInputs.clear();
        b.requiredInputs.addAll(requiredInputs);
        b.parameters.putAll(parameters);
        b.extractor = extractor;
        b.description = description;
        return b;
    }

    public String getId() {
        return id;
    }

    public CorrectionMethod getMethod() {
        return method;
    }

    public Set<InputField> getRequiredInputs() {
        return requiredInputs;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public OutputExtractor getExtractor() {
        return extractor;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("MethodSpec{id='%s', inputs=%s, parameters=%s}", id, requiredInputs, parameters);
    }

    /**
     * Builder for {@link MethodSpec}. Binding errors surface in {@link #build()}, not at run time.
     */
    public static final class Builder {
        private final String id;
        private final CorrectionMethod method;
        private final Set<InputField> requiredInputs = EnumSet.of(InputField.P_VALUE);
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private OutputExtractor extractor = OutputExtractor.identity();
        private String description = "";

        private Builder(String id, CorrectionMethod method) {
            this.id = id;
            this.method = method;
        }

        /**
         * Replaces the bound columns.
         */
        public Builder inputs(InputField first, InputField... rest) {
            requiredInputs.clear();
            requiredInputs.add(first);
            Collections.addAll(requiredInputs, rest);
            return this;
        }

        public Builder parameter(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Parameter name cannot be null or blank");
            }
            parameters.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, ?> values) {
            values.forEach(this::parameter);
            return this;
        }

        public Builder extractor(OutputExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        /**
         * Builds the spec.
         *
         * @throws IllegalArgumentException if the id is blank or no input is bound
         * @throws NullPointerException if the method or extractor is null
         */
        public MethodSpec build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Method id cannot be null or blank");
            }
            Objects.requireNonNull(method, "Correction method cannot be null");
            Objects.requireNonNull(extractor, "Output extractor cannot be null");
            if (requiredInputs.isEmpty()) {
                throw new IllegalArgumentException("Method " + id + " binds no input column");
            }
            return new MethodSpec(this);
        }
    }
}
