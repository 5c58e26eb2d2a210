package org.puneet.fdrbench.simulation;

/**
 * Null proportion curves over a covariate in [0, 1]. Every curve except
 * {@link #constant(double)} makes the covariate informative.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-08
 */
public final class Pi0Functions {

    private Pi0Functions() {
    }

    public static NullProportionFunction constant(double pi0) {
        return x -> pi0;
    }

    /**
     * Decreases linearly from {@code high} at x = 0 to {@code low} at x = 1.
     */
    public static NullProportionFunction linear(double low, double high) {
        return x -> high - (high - low) * x;
    }

    /**
     * One full sine period between {@code low} and {@code high}.
     */
    public static NullProportionFunction sine(double low, double high) {
        return x -> low + (high - low) * (1.0 + Math.sin(2.0 * Math.PI * x)) / 2.0;
    }

    /**
     * One full cosine period between {@code low} and {@code high}; starts at {@code high}.
     */
    public static NullProportionFunction cosine(double low, double high) {
        return x -> low + (high - low) * (1.0 + Math.cos(2.0 * Math.PI * x)) / 2.0;
    }

    /**
     * Flat near x = 0, dropping steeply to {@code low} as x approaches 1.
     */
    public static NullProportionFunction cubic(double low, double high) {
        return x -> high - (high - low) * x * x * x;
    }

    public static NullProportionFunction step(double cut, double before, double after) {
        return x -> x < cut ? before : after;
    }

    /**
     * Resolves a curve by name: {@code constant}, {@code linear}, {@code sine}, {@code cosine},
     * {@code cubic} or {@code step} (cut at 0.5).
     *
     * @param shape curve name
     * @param low lowest null proportion
     * @param high highest null proportion, used alone by {@code constant}
     * @throws IllegalArgumentException for an unknown name
     */
    public static NullProportionFunction byName(String shape, double low, double high) {
        switch (shape.trim().toLowerCase()) {
            case "constant":
                return constant(high);
            case "linear":
                return linear(low, high);
            case "sine":
                return sine(low, high);
            case "cosine":
                return cosine(low, high);
            case "cubic":
                return cubic(low, high);
            case "step":
                return step(0.5, high, low);
            default:
                throw new IllegalArgumentException("Unknown pi0 shape: " + shape);
        }
    }
}
