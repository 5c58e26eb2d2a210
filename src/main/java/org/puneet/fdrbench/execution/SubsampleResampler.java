package org.puneet.fdrbench.execution;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import org.puneet.fdrbench.data.Dataset;
import org.puneet.fdrbench.exceptions.ResamplingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Random subsampling of a fixed dataset without replacement.
 *
 * <p>When the source carries truth labels and {@code minPerClass} is positive, a draw is
 * accepted only if it holds at least {@code minPerClass} null and {@code minPerClass}
 * non-null rows. Rejected draws are retried up to {@code maxAttempts} times, after which
 * a {@link ResamplingException} is thrown.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public class SubsampleResampler implements ResamplingFunction {
    private static final Logger logger = LoggerFactory.getLogger(SubsampleResampler.class);

    private final int size;
    private final int minPerClass;
    private final int maxAttempts;

    public SubsampleResampler(int size) {
        this(size, 0, 1);
    }

    /**
     * @param size rows per subsample
     * @param minPerClass minimum rows of each truth class, 0 for no constraint
     * @param maxAttempts draws tried before giving up, at least 1
     */
    public SubsampleResampler(int size, int minPerClass, int maxAttempts) {
        if (size <= 0) {
            throw new IllegalArgumentException("Subsample size must be positive: " + size);
        }
        if (minPerClass < 0) {
            throw new IllegalArgumentException("minPerClass cannot be negative: " + minPerClass);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.size = size;
        this.minPerClass = minPerClass;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Dataset resample(Dataset source, RandomGenerator rng) {
        Objects.requireNonNull(source, "Source dataset cannot be null");
        Objects.requireNonNull(rng, "Random generator cannot be null");
        if (size > source.size()) {
            throw new ResamplingException(String.format("Cannot draw %d rows from a dataset of %d",
                size, source.size()), 0);
        }
        boolean balanced = minPerClass > 0 && source.hasTruth();
        boolean[] truth = balanced ? source.getTruth() : null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int[] rows = drawRows(source.size(), rng);
            if (!balanced || meetsBalance(rows, truth)) {
                if (attempt > 1) {
                    logger.debug("Balanced subsample found after {} attempts", attempt);
                }
                return source.subset(rows);
            }
        }
        throw new ResamplingException(String.format(
            "No subsample of %d rows with at least %d rows per class after %d attempts",
            size, minPerClass, maxAttempts), maxAttempts);
    }

    @Override
    public int outputSize(Dataset source) {
        return size;
    }

    public int getSize() {
        return size;
    }

    public int getMinPerClass() {
        return minPerClass;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private int[] drawRows(int population, RandomGenerator rng) {
        int[] all = MathArrays.natural(population);
        // partial Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + rng.nextInt(population - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] rows = Arrays.copyOf(all, size);
        Arrays.sort(rows);
        return rows;
    }

    private boolean meetsBalance(int[] rows, boolean[] truth) {
        int nonNull = 0;
        for (int row : rows) {
            if (truth[row]) {
                nonNull++;
            }
        }
        return nonNull >= minPerClass && rows.length - nonNull >= minPerClass;
    }
}
