package org.puneet.fdrbench.method;

import org.puneet.fdrbench.data.Dataset;

import java.util.function.Function;

/**
 * Dataset columns a correction method can bind as named inputs.
 */
public enum InputField {
    P_VALUE("p_value", Dataset::getPValues),
    TEST_STATISTIC("test_statistic", Dataset::getTestStatistics),
    EFFECT_SIZE("effect_size", Dataset::getEffectSizes),
    STANDARD_ERROR("standard_error", Dataset::getStandardErrors),
    IND_COVARIATE("ind_covariate", Dataset::getCovariate);

    private final String columnName;
    private final Function<Dataset, double[]> accessor;

    InputField(String columnName, Function<Dataset, double[]> accessor) {
        this.columnName = columnName;
        this.accessor = accessor;
    }

    public String getColumnName() {
        return columnName;
    }

    /**
     * Reads this column from a dataset.
     *
     * @return a copy of the column, or null if the dataset does not carry it
     */
    public double[] extract(Dataset dataset) {
        return accessor.apply(dataset);
    }
}
