package org.puneet.fdrbench.baseline;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.puneet.fdrbench.exceptions.DuplicateMethodException;
import org.puneet.fdrbench.exceptions.MethodUnsupportedException;
import org.puneet.fdrbench.method.InputField;
import org.puneet.fdrbench.method.MethodInput;
import org.puneet.fdrbench.method.MethodRegistry;
import org.puneet.fdrbench.method.MethodSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Reference correction methods shipped with the benchmark: the classical covariate-free
 * adjustments and a stratified Benjamini-Hochberg procedure that uses the independent
 * covariate. Missing p-values (NaN) produce NaN adjusted values and are excluded from
 * the number of tests.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class BaselineMethods {
    private static final Logger logger = LoggerFactory.getLogger(BaselineMethods.class);

    public static final String UNADJUSTED = "unadjusted";
    public static final String BONFERRONI = "bonferroni";
    public static final String HOLM = "holm";
    public static final String BENJAMINI_HOCHBERG = "bh";
    public static final String STOREY_Q = "storey-q";
    public static final String STRATIFIED_BH = "stratified-bh";

    /** Default tuning parameter for the Storey null proportion estimate */
    public static final double DEFAULT_LAMBDA = 0.5;

    /** Default number of covariate strata */
    public static final int DEFAULT_BINS = 5;

    /** Default minimum number of tests per stratum */
    public static final int DEFAULT_MIN_PER_BIN = 20;

    private BaselineMethods() {
    }

    /**
     * Builds a registry with every reference method, in the order unadjusted, Bonferroni,
     * Holm, BH, Storey q-value, stratified BH.
     */
    public static MethodRegistry defaultRegistry() {
        MethodRegistry registry = new MethodRegistry();
        try {
            registry.register(MethodSpec.builder(UNADJUSTED, in -> unadjusted(in.pValues()))
                    .description("Raw p-values").build())
                .register(MethodSpec.builder(BONFERRONI, in -> bonferroni(in.pValues()))
                    .description("Bonferroni FWER control").build())
                .register(MethodSpec.builder(HOLM, in -> holm(in.pValues()))
                    .description("Holm step-down FWER control").build())
                .register(MethodSpec.builder(BENJAMINI_HOCHBERG, in -> benjaminiHochberg(in.pValues()))
                    .description("Benjamini-Hochberg FDR control").build())
                .register(MethodSpec.builder(STOREY_Q, BaselineMethods::storeyQValues)
                    .parameter("lambda", DEFAULT_LAMBDA)
                    .description("Storey q-value").build())
                .register(MethodSpec.builder(STRATIFIED_BH, BaselineMethods::stratifiedBenjaminiHochberg)
                    .inputs(InputField.P_VALUE, InputField.IND_COVARIATE)
                    .parameter("bins", DEFAULT_BINS)
                    .parameter("minPerBin", DEFAULT_MIN_PER_BIN)
                    .description("BH within covariate quantile strata").build());
        } catch (DuplicateMethodException e) {
            throw new IllegalStateException("Reference method ids must be unique", e);
        }
        logger.info("Built default registry with methods {}", registry.listIds());
        return registry;
    }

    public static double[] unadjusted(double[] pValues) {
        return pValues.clone();
    }

    public static double[] bonferroni(double[] pValues) {
        int n = countPresent(pValues);
        double[] adjusted = new double[pValues.length];
        for (int i = 0; i < pValues.length; i++) {
            adjusted[i] = Double.isNaN(pValues[i]) ? Double.NaN : Math.min(1.0, pValues[i] * n);
        }
        return adjusted;
    }

    /**
     * Holm step-down adjusted p-values.
     */
    public static double[] holm(double[] pValues) {
        int[] order = ascendingPresent(pValues);
        int n = order.length;
        double[] adjusted = nanFilled(pValues.length);

        double runningMax = 0.0;
        for (int rank = 0; rank < n; rank++) {
            int idx = order[rank];
            double value = Math.min(1.0, pValues[idx] * (n - rank));
            runningMax = Math.max(runningMax, value);
            adjusted[idx] = runningMax;
        }
        return adjusted;
    }

    /**
     * Benjamini-Hochberg step-up adjusted p-values, monotone in the raw p-values.
     */
    public static double[] benjaminiHochberg(double[] pValues) {
        int[] order = ascendingPresent(pValues);
        int n = order.length;
        double[] adjusted = nanFilled(pValues.length);

        double runningMin = 1.0;
        for (int rank = n - 1; rank >= 0; rank--) {
            int idx = order[rank];
            double value = pValues[idx] * ((double) n / (rank + 1));
            runningMin = Math.min(runningMin, value);
            adjusted[idx] = runningMin;
        }
        return adjusted;
    }

    /**
     * Storey's null proportion estimate at tuning parameter {@code lambda}, capped at 1.
     */
    public static double estimatePi0(double[] pValues, double lambda) {
        if (lambda <= 0.0 || lambda >= 1.0) {
            throw new IllegalArgumentException("lambda must lie in (0, 1), got " + lambda);
        }
        int n = countPresent(pValues);
        if (n == 0) {
            return 1.0;
        }
        long above = Arrays.stream(pValues).filter(p -> !Double.isNaN(p) && p > lambda).count();
        return Math.min(1.0, above / ((1.0 - lambda) * n));
    }

    private static Object storeyQValues(MethodInput input) {
        double[] p = input.pValues();
        double pi0 = estimatePi0(p, input.doubleParameter("lambda", DEFAULT_LAMBDA));
        double[] q = benjaminiHochberg(p);
        for (int i = 0; i < q.length; i++) {
            q[i] = Double.isNaN(q[i]) ? Double.NaN : pi0 * q[i];
        }
        return q;
    }

    /**
     * Applies BH separately inside equal-count covariate strata.
     *
     * @throws MethodUnsupportedException if the covariate is constant or a stratum is too small
     */
    private static Object stratifiedBenjaminiHochberg(MethodInput input) {
        double[] p = input.pValues();
        double[] covariate = input.column(InputField.IND_COVARIATE);
        int bins = input.intParameter("bins", DEFAULT_BINS);
        int minPerBin = input.intParameter("minPerBin", DEFAULT_MIN_PER_BIN);
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be positive, got " + bins);
        }

        int[] rows = IntStream.range(0, p.length)
            .filter(i -> !Double.isNaN(p[i]) && !Double.isNaN(covariate[i]))
            .toArray();
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i : rows) {
            stats.addValue(covariate[i]);
        }
        if (rows.length == 0 || stats.getVariance() == 0.0) {
            throw new MethodUnsupportedException("Covariate has zero variance");
        }

        int[][] strata = equalCountStrata(rows, covariate, bins);
        double[] adjusted = nanFilled(p.length);
        for (int[] stratum : strata) {
            if (stratum.length < minPerBin) {
                throw new MethodUnsupportedException(String.format(
                    "Stratum has %d tests, fewer than the minimum %d", stratum.length, minPerBin));
            }
            double[] sub = new double[stratum.length];
            for (int k = 0; k < stratum.length; k++) {
                sub[k] = p[stratum[k]];
            }
            double[] subAdjusted = benjaminiHochberg(sub);
            for (int k = 0; k < stratum.length; k++) {
                adjusted[stratum[k]] = subAdjusted[k];
            }
        }
        return adjusted;
    }

    /**
     * Splits rows into {@code bins} groups of near-equal size by ascending covariate value.
     */
    static int[][] equalCountStrata(int[] rows, double[] covariate, int bins) {
        Integer[] sorted = Arrays.stream(rows).boxed().toArray(Integer[]::new);
        Arrays.sort(sorted, Comparator.comparingDouble(i -> covariate[i]));
        int[][] strata = new int[bins][];
        for (int b = 0; b < bins; b++) {
            int from = (int) ((long) b * sorted.length / bins);
            int to = (int) ((long) (b + 1) * sorted.length / bins);
            strata[b] = new int[to - from];
            for (int k = from; k < to; k++) {
                strata[b][k - from] = sorted[k];
            }
        }
        return strata;
    }

    private static int[] ascendingPresent(double[] pValues) {
        return IntStream.range(0, pValues.length)
            .filter(i -> !Double.isNaN(pValues[i]))
            .boxed()
            .sorted(Comparator.comparingDouble(i -> pValues[i]))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    private static int countPresent(double[] values) {
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                n++;
            }
        }
        return n;
    }

    private static double[] nanFilled(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
