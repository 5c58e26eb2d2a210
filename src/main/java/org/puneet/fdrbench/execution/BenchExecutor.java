package org.puneet.fdrbench.execution;

import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.Dataset;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.data.MethodFailure;
import org.puneet.fdrbench.exceptions.MethodUnsupportedException;
import org.puneet.fdrbench.method.InputField;
import org.puneet.fdrbench.method.MethodInput;
import org.puneet.fdrbench.method.MethodRegistry;
import org.puneet.fdrbench.method.MethodSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every method of a registry against one dataset and assembles the q-value table.
 * Methods run sequentially in registry order. A failing method never aborts the run:
 * its column is recorded as entirely missing and the reason goes to the error log of
 * the returned {@link BenchResult}.
 *
 * <p>When a method timeout is configured, invocations run on a daemon worker owned by
 * this executor and are cancelled once the limit passes. Close the executor to release
 * those workers.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class BenchExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BenchExecutor.class);

    private static final AtomicInteger workerCounter = new AtomicInteger(0);

    private final ExecutorService timeoutExecutor;
    private volatile boolean closed = false;

    public BenchExecutor() {
        this.timeoutExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("BenchMethod-" + workerCounter.incrementAndGet());
            return t;
        });
    }

    /**
     * Executes the registry with default options.
     */
    public BenchResult execute(Dataset dataset, MethodRegistry registry) {
        return execute(dataset, registry, ExecutionOptions.defaults());
    }

    /**
     * Executes every registered method against the dataset.
     *
     * @param dataset the hypotheses
     * @param registry methods to run, read only
     * @param options replicate id, truth source, passthrough columns and timeout
     * @return one q-value column per method, in registry order
     * @throws IllegalArgumentException if a requested passthrough or truth column is absent
     */
    public BenchResult execute(Dataset dataset, MethodRegistry registry, ExecutionOptions options) {
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(registry, "Registry cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        ensureNotClosed();

        int m = dataset.size();
        int replicate = options.getReplicateId();
        boolean[] truth = resolveTruth(dataset, options);
        Map<String, double[]> features = resolveFeatures(dataset, options);

        Map<String, double[]> qValues = new LinkedHashMap<>();
        List<MethodFailure> failures = new ArrayList<>();

        for (MethodSpec spec : registry.specs()) {
            long start = System.nanoTime();
            MethodFailure failure = null;
            double[] column = null;
            try {
                column = runMethod(spec, dataset, options);
                if (column == null) {
                    failure = new MethodFailure(spec.getId(), replicate, FailureType.EXCEPTION,
                        "Extractor returned null", null);
                } else if (column.length != m) {
                    failure = new MethodFailure(spec.getId(), replicate, FailureType.LENGTH_MISMATCH,
                        String.format("Output has %d entries, expected %d", column.length, m), null);
                }
            } catch (MissingInputException e) {
                failure = MethodFailure.fromThrowable(spec.getId(), replicate, FailureType.MISSING_INPUT, e);
            } catch (MethodUnsupportedException e) {
                failure = MethodFailure.fromThrowable(spec.getId(), replicate, FailureType.UNSUPPORTED_INPUT, e);
            } catch (TimeoutException e) {
                failure = new MethodFailure(spec.getId(), replicate, FailureType.TIMEOUT,
                    "Exceeded " + options.getMethodTimeout().toMillis() + " ms", e.getClass().getName());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = MethodFailure.fromThrowable(spec.getId(), replicate, FailureType.EXCEPTION, e);
            } catch (Exception | LinkageError | AssertionError e) {
                failure = MethodFailure.fromThrowable(spec.getId(), replicate, FailureType.EXCEPTION, e);
            }

            if (failure != null) {
                logger.warn("Method {} failed on replicate {} ({}): {}",
                    spec.getId(), replicate, failure.getType(), failure.getMessage());
                failures.add(failure);
                column = new double[m];
                Arrays.fill(column, Double.NaN);
            } else {
                logger.debug("Method {} finished on replicate {} in {} ms",
                    spec.getId(), replicate, (System.nanoTime() - start) / 1_000_000);
            }
            qValues.put(spec.getId(), column);
        }

        return new BenchResult(replicate, m, qValues, truth, features, failures);
    }

    private double[] runMethod(MethodSpec spec, Dataset dataset, ExecutionOptions options) throws Exception {
        MethodInput input = bindInputs(spec, dataset);
        if (!options.hasMethodTimeout()) {
            return spec.getExtractor().extract(spec.getMethod().apply(input));
        }

        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<double[]> future = timeoutExecutor.submit(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return spec.getExtractor().extract(spec.getMethod().apply(input));
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(options.getMethodTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Binds the declared dataset columns to the method's named inputs.
     *
     * @throws MissingInputException if the dataset lacks a declared column
     */
    static MethodInput bindInputs(MethodSpec spec, Dataset dataset) {
        Map<InputField, double[]> columns = new EnumMap<>(InputField.class);
        for (InputField field : spec.getRequiredInputs()) {
            double[] column = field.extract(dataset);
            if (column == null) {
                throw new MissingInputException(String.format(
                    "Dataset has no %s column required by %s", field.getColumnName(), spec.getId()));
            }
            columns.put(field, column);
        }
        return new MethodInput(dataset.size(), columns, spec.getParameters());
    }

    private static boolean[] resolveTruth(Dataset dataset, ExecutionOptions options) {
        String column = options.getGroundTruthColumn();
        if (column == null) {
            return dataset.getTruth();
        }
        double[] values = dataset.getFeature(column);
        if (values == null) {
            throw new IllegalArgumentException("Ground truth column not found: " + column);
        }
        boolean[] truth = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            truth[i] = !Double.isNaN(values[i]) && values[i] != 0.0;
        }
        return truth;
    }

    private static Map<String, double[]> resolveFeatures(Dataset dataset, ExecutionOptions options) {
        Map<String, double[]> features = new LinkedHashMap<>();
        for (String name : options.getPassthroughFeatures()) {
            double[] column = ExecutionOptions.COVARIATE_FEATURE.equals(name)
                ? dataset.getCovariate()
                : dataset.getFeature(name);
            if (column == null) {
                throw new IllegalArgumentException("Passthrough column not found: " + name);
            }
            features.put(name, column);
        }
        return features;
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("BenchExecutor has been closed");
        }
    }

    @Override
    public void close() {
        closed = true;
        timeoutExecutor.shutdownNow();
    }

    /**
     * Signals that a method's declared input column is absent from the dataset.
     */
    static final class MissingInputException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        MissingInputException(String message) {
            super(message);
        }
    }
}
