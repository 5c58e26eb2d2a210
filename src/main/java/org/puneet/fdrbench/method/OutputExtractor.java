package org.puneet.fdrbench.method;

import java.util.List;
import java.util.Map;

/**
 * Maps the raw return value of a correction method to a vector of adjusted p-values
 * aligned with the input rows.
 */
@FunctionalInterface
public interface OutputExtractor {

    double[] extract(Object raw) throws Exception;

    /**
     * Extractor for methods that already return a {@code double[]}.
     */
    static OutputExtractor identity() {
        return raw -> (double[]) raw;
    }

    /**
     * Extractor for methods returning a map of named vectors, such as
     * {@code {"qvalues": ..., "pi0": ...}}.
     *
     * @param key entry holding the adjusted p-values
     */
    static OutputExtractor mapEntry(String key) {
        return raw -> {
            Object value = ((Map<?, ?>) raw).get(key);
            if (value == null) {
                throw new IllegalArgumentException("Method output has no entry '" + key + "'");
            }
            return toDoubleArray(value);
        };
    }

    /**
     * Converts {@code double[]} or a list of numbers to a {@code double[]}; null elements become NaN.
     */
    static double[] toDoubleArray(Object value) {
        if (value instanceof double[]) {
            return (double[]) value;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                Object v = list.get(i);
                out[i] = v == null ? Double.NaN : ((Number) v).doubleValue();
            }
            return out;
        }
        throw new IllegalArgumentException("Cannot convert " + value.getClass().getName() + " to double[]");
    }
}
