package org.puneet.fdrbench.method;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments handed to a {@link CorrectionMethod}: the bound dataset columns plus the
 * method's parameters. Columns are private copies; a method may modify them freely.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class MethodInput {

    private final int size;
    private final Map<InputField, double[]> columns;
    private final Map<String, Object> parameters;

    public MethodInput(int size, Map<InputField, double[]> columns, Map<String, Object> parameters) {
        this.size = size;
        this.columns = new EnumMap<>(InputField.class);
        this.columns.putAll(Objects.requireNonNull(columns, "Columns cannot be null"));
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(
            parameters == null ? Map.of() : parameters));
    }

    public int size() {
        return size;
    }

    /**
     * Returns a bound column.
     *
     * @throws IllegalStateException if the column was not bound for this method
     */
    public double[] column(InputField field) {
        double[] column = columns.get(field);
        if (column == null) {
            throw new IllegalStateException("Input " + field.getColumnName() + " is not bound");
        }
        return column;
    }

    public boolean hasColumn(InputField field) {
        return columns.containsKey(field);
    }

    public double[] pValues() {
        return column(InputField.P_VALUE);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Object parameter(String name) {
        return parameters.get(name);
    }

    public double doubleParameter(String name, double defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public int intParameter(String name, int defaultValue) {
        Object value = parameters.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }
}
