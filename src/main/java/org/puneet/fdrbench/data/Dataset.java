package org.puneet.fdrbench.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable table of hypotheses, one row per test. The p-value column is required;
 * test statistics, effect sizes, standard errors, the independent covariate and the
 * truth labels are optional. Additional numeric feature columns may be attached for
 * covariate diagnostics. All columns are aligned by row index.
 *
 * <p>Missing numeric values are represented as {@link Double#NaN}.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class Dataset {

    private final int size;
    private final double[] pValues;
    private final double[] testStatistics;
    private final double[] effectSizes;
    private final double[] standardErrors;
    private final double[] covariate;
    private final boolean[] truth;
    private final Map<String, double[]> features;

    private Dataset(Builder builder) {
        this.pValues = builder.pValues;
        this.size = builder.pValues.length;
        this.testStatistics = builder.testStatistics;
        this.effectSizes = builder.effectSizes;
        this.standardErrors = builder.standardErrors;
        this.covariate = builder.covariate;
        this.truth = builder.truth;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(builder.features));
    }

    /**
     * Starts a dataset from its p-value column.
     *
     * @param pValues p-values in [0, 1], NaN for missing
     * @return a new builder
     */
    public static Builder builder(double[] pValues) {
        return new Builder(pValues);
    }

    /**
     * Creates a copy of this dataset with the covariate column replaced.
     *
     * @param newCovariate replacement covariate, same length as the dataset
     * @return a new dataset sharing every other column
     */
    public Dataset withCovariate(double[] newCovariate) {
        return toBuilder().covariate(newCovariate).build();
    }

    /**
     * Creates a dataset holding the given rows, in the given order.
     *
     * @param rows row indices into this dataset
     * @return the subset
     * @throws IndexOutOfBoundsException if a row index is out of range
     */
    public Dataset subset(int[] rows) {
        Objects.requireNonNull(rows, "Rows cannot be null");
        Builder b = new Builder(select(pValues, rows))
            .testStatistics(select(testStatistics, rows))
            .effectSizes(select(effectSizes, rows))
            .standardErrors(select(standardErrors, rows))
            .covariate(select(covariate, rows));
        if (truth != null) {
            boolean[] t = new boolean[rows.length];
            for (int i = 0; i < rows.length; i++) {
                t[i] = truth[rows[i]];
            }
            b.truth(t);
        }
        for (Map.Entry<String, double[]> e : features.entrySet()) {
            b.feature(e.getKey(), select(e.getValue(), rows));
        }
        return b.build();
    }

    private static double[] select(double[] column, int[] rows) {
        if (column == null) {
            return null;
        }
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = column[rows[i]];
        }
        return out;
    }

    private Builder toBuilder() {
        Builder b = new Builder(pValues)
            .testStatistics(testStatistics)
            .effectSizes(effectSizes)
            .standardErrors(standardErrors)
            .covariate(covariate)
            .truth(truth);
        features.forEach(b::feature);
        return b;
    }

    public int size() {
        return size;
    }

    public double[] getPValues() {
        return pValues.clone();
    }

    public double[] getTestStatistics() {
        return testStatistics == null ? null : testStatistics.clone();
    }

    public double[] getEffectSizes() {
        return effectSizes == null ? null : effectSizes.clone();
    }

    public double[] getStandardErrors() {
        return standardErrors == null ? null : standardErrors.clone();
    }

    public double[] getCovariate() {
        return covariate == null ? null : covariate.clone();
    }

    public boolean hasTruth() {
        return truth != null;
    }

    public boolean[] getTruth() {
        return truth == null ? null : truth.clone();
    }

    public boolean hasFeature(String name) {
        return features.containsKey(name);
    }

    public double[] getFeature(String name) {
        double[] column = features.get(name);
        return column == null ? null : column.clone();
    }

    /**
     * Names of the feature columns, in insertion order. Columns are read through {@link #getFeature(String)}.
     */
    public Set<String> getFeatureNames() {
        return features.keySet();
    }

    /**
     * Counts non-null hypotheses. Returns -1 when truth is unknown.
     *
     * @return number of rows with truth {@code true}
     */
    public int countNonNull() {
        if (truth == null) {
            return -1;
        }
        int count = 0;
        for (boolean t : truth) {
            if (t) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("Dataset{m=%d, statistics=%s, covariate=%s, truth=%s, features=%s}",
            size, testStatistics != null, covariate != null, truth != null, features.keySet());
    }

    /**
     * Builder validating that every column is aligned with the p-value column.
     */
    public static final class Builder {
        private final double[] pValues;
        private double[] testStatistics;
        private double[] effectSizes;
        private double[] standardErrors;
        private double[] covariate;
        private boolean[] truth;
        private final Map<String, double[]> features = new LinkedHashMap<>();

        private Builder(double[] pValues) {
            this.pValues = Objects.requireNonNull(pValues, "P-values cannot be null").clone();
        }

        public Builder testStatistics(double[] values) {
            this.testStatistics = values == null ? null : values.clone();
            return this;
        }

        public Builder effectSizes(double[] values) {
            this.effectSizes = values == null ? null : values.clone();
            return this;
        }

        public Builder standardErrors(double[] values) {
            this.standardErrors = values == null ? null : values.clone();
            return this;
        }

        public Builder covariate(double[] values) {
            this.covariate = values == null ? null : values.clone();
            return this;
        }

        public Builder truth(boolean[] values) {
            this.truth = values == null ? null : values.clone();
            return this;
        }

        public Builder feature(String name, double[] values) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Feature name cannot be null or blank");
            }
            features.put(name, Objects.requireNonNull(values, "Feature column cannot be null").clone());
            return this;
        }

        /**
         * Validates and builds the dataset.
         *
         * @return the dataset
         * @throws IllegalArgumentException if a column is misaligned or a p-value leaves [0, 1]
         */
        public Dataset build() {
            int m = pValues.length;
            for (int i = 0; i < m; i++) {
                double p = pValues[i];
                if (!Double.isNaN(p) && (p < 0.0 || p > 1.0)) {
                    throw new IllegalArgumentException(
                        String.format("P-value at row %d outside [0, 1]: %f", i, p));
                }
            }
            checkLength("test_statistic", testStatistics, m);
            checkLength("effect_size", effectSizes, m);
            checkLength("standard_error", standardErrors, m);
            checkLength("ind_covariate", covariate, m);
            if (truth != null && truth.length != m) {
                throw new IllegalArgumentException(
                    String.format("Column truth has %d rows, expected %d", truth.length, m));
            }
            features.forEach((name, column) -> checkLength(name, column, m));
            return new Dataset(this);
        }

        private static void checkLength(String name, double[] column, int m) {
            if (column != null && column.length != m) {
                throw new IllegalArgumentException(
                    String.format("Column %s has %d rows, expected %d", name, column.length, m));
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Dataset that = (Dataset) obj;
        if (!features.keySet().equals(that.features.keySet())) return false;
        for (Map.Entry<String, double[]> e : features.entrySet()) {
            if (!Arrays.equals(e.getValue(), that.features.get(e.getKey()))) return false;
        }
        return Arrays.equals(pValues, that.pValues)
            && Arrays.equals(testStatistics, that.testStatistics)
            && Arrays.equals(effectSizes, that.effectSizes)
            && Arrays.equals(standardErrors, that.standardErrors)
            && Arrays.equals(covariate, that.covariate)
            && Arrays.equals(truth, that.truth);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(size, features.keySet());
        result = 31 * result + Arrays.hashCode(pValues);
        result = 31 * result + Arrays.hashCode(covariate);
        result = 31 * result + Arrays.hashCode(truth);
        return result;
    }
}
