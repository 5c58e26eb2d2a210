package org.puneet.fdrbench.execution;

import org.puneet.fdrbench.data.BenchResult;
import org.puneet.fdrbench.data.Dataset;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.method.MethodRegistry;
import org.puneet.fdrbench.simulation.SeedSequence;
import org.puneet.fdrbench.simulation.SimulatedReplicate;
import org.puneet.fdrbench.simulation.SimulationGenerator;
import org.puneet.fdrbench.util.ProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs many independent replicates on a fixed worker pool and collects their results in
 * replicate index order, whatever order the workers finish in.
 *
 * <p>A replicate that fails as a whole (its dataset could not be produced, or the executor
 * itself threw) is kept in the ensemble with every method column missing. Configuration
 * errors are the exception: an {@link InvalidSimulationConfigException} cancels the
 * remaining replicates and is re-thrown to the caller.</p>
 *
 * <p>Workers tag their log lines with the {@code replicate} MDC key.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-09
 */
public class ReplicationDriver implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReplicationDriver.class);

    public static final String MDC_REPLICATE = "replicate";

    private static final AtomicInteger poolCounter = new AtomicInteger(0);

    private final int threads;
    private final ExecutorService executorService;
    private final BenchExecutor benchExecutor;

    public ReplicationDriver() {
        this(Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param threads worker count, at least 1
     */
    public ReplicationDriver(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        this.threads = threads;
        int pool = poolCounter.incrementAndGet();
        AtomicInteger workerCounter = new AtomicInteger(0);
        this.executorService = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("Replicate-" + pool + "-" + workerCounter.incrementAndGet());
            return t;
        });
        this.benchExecutor = new BenchExecutor();
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Runs {@code replicates} simulated replicates. Each replicate is drawn once and both
     * its informative and uninformative variants are run through the registry.
     *
     * @param generator synthetic data source
     * @param registry methods to run, read only for the duration of the call
     * @param replicates number of replicates B
     * @param options execution options; the replicate id is set per replicate
     * @return the paired ensembles, both of size B
     * @throws InvalidSimulationConfigException if the generator rejects its configuration
     */
    public PairedEnsembles runSimulation(SimulationGenerator generator, MethodRegistry registry,
                                         int replicates, ExecutionOptions options)
            throws InvalidSimulationConfigException {
        Objects.requireNonNull(generator, "Generator cannot be null");
        validate(registry, replicates, options);

        List<String> methodIds = registry.listIds();
        int m = generator.getConfig().getHypotheses();
        ProgressTracker progress = new ProgressTracker("Simulation", replicates);

        List<BenchResult[]> pairs = fanOut(replicates, progress, replicate -> {
            ExecutionOptions replicateOptions = options.forReplicate(replicate);
            try {
                SimulatedReplicate draw = generator.generate(replicate);
                return new BenchResult[] {
                    benchExecutor.execute(draw.getInformative(), registry, replicateOptions),
                    benchExecutor.execute(draw.getUninformative(), registry, replicateOptions)
                };
            } catch (InvalidSimulationConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                logger.warn("Replicate {} failed as a whole: {}", replicate, e.getMessage());
                BenchResult missing = BenchResult.allMissing(replicate, m, methodIds, e);
                return new BenchResult[] {missing, missing};
            }
        }, pair -> isWholeReplicateFailure(pair[0]));

        List<BenchResult> informative = new ArrayList<>(replicates);
        List<BenchResult> uninformative = new ArrayList<>(replicates);
        for (BenchResult[] pair : pairs) {
            informative.add(pair[0]);
            uninformative.add(pair[1]);
        }
        progress.complete();
        return new PairedEnsembles(
            new ReplicateEnsemble(PairedEnsembles.INFORMATIVE, informative),
            new ReplicateEnsemble(PairedEnsembles.UNINFORMATIVE, uninformative));
    }

    /**
     * Runs {@code replicates} resamples of a fixed dataset. Replicate {@code i} draws from
     * a generator seeded with {@code SeedSequence.forReplicate(baseSeed, i)}.
     *
     * @param label ensemble label
     * @param source dataset to resample
     * @param resampler resampling function, called concurrently
     * @param registry methods to run
     * @param replicates number of replicates B
     * @param baseSeed base seed
     * @param options execution options
     * @return the ensemble, of size B
     */
    public ReplicateEnsemble runResampling(String label, Dataset source, ResamplingFunction resampler,
                                           MethodRegistry registry, int replicates, long baseSeed,
                                           ExecutionOptions options) {
        Objects.requireNonNull(source, "Source dataset cannot be null");
        Objects.requireNonNull(resampler, "Resampling function cannot be null");
        int size = resampler.outputSize(source);
        return runReplicates(label, registry, replicates, options, size,
            replicate -> resampler.resample(source, SeedSequence.generatorFor(baseSeed, replicate)));
    }

    /**
     * Runs {@code replicates} replicates whose datasets come from {@code datasetSource}.
     *
     * @param label ensemble label
     * @param registry methods to run
     * @param replicates number of replicates B
     * @param options execution options
     * @param fallbackSize hypothesis count recorded for a replicate whose dataset could not be built
     * @param datasetSource produces the dataset of a replicate
     * @return the ensemble, of size B
     */
    public ReplicateEnsemble runReplicates(String label, MethodRegistry registry, int replicates,
                                           ExecutionOptions options, int fallbackSize,
                                           ReplicateTask<Dataset> datasetSource) {
        Objects.requireNonNull(datasetSource, "Dataset source cannot be null");
        validate(registry, replicates, options);

        List<String> methodIds = registry.listIds();
        ProgressTracker progress = new ProgressTracker(label, replicates);
        List<BenchResult> results;
        try {
            results = fanOut(replicates, progress, replicate -> {
                try {
                    Dataset dataset = datasetSource.run(replicate);
                    return benchExecutor.execute(dataset, registry, options.forReplicate(replicate));
                } catch (InterruptedException e) {
                    throw e;
                } catch (Exception e) {
                    logger.warn("Replicate {} failed as a whole: {}", replicate, e.getMessage());
                    return BenchResult.allMissing(replicate, fallbackSize, methodIds, e);
                }
            }, ReplicationDriver::isWholeReplicateFailure);
        } catch (InvalidSimulationConfigException e) {
            // the task above absorbs every checked exception
            throw new IllegalStateException(e);
        }
        progress.complete();
        return new ReplicateEnsemble(label, results);
    }

    /**
     * Submits one task per replicate and waits for all of them, returning results in index order.
     * {@code isFailed} decides which returned results count as failed in the progress log.
     *
     * @throws InvalidSimulationConfigException if any task threw one; the others are cancelled
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    <T> List<T> fanOut(int replicates, ProgressTracker progress, ReplicateTask<T> task,
                       Predicate<T> isFailed) throws InvalidSimulationConfigException {
        ensureNotShutdown();
        List<Future<T>> futures = new ArrayList<>(replicates);
        for (int i = 0; i < replicates; i++) {
            final int replicate = i;
            futures.add(executorService.submit(() -> {
                MDC.put(MDC_REPLICATE, String.valueOf(replicate));
                boolean failed = true;
                try {
                    T result = task.run(replicate);
                    failed = isFailed.test(result);
                    return result;
                } finally {
                    progress.taskCompleted(failed);
                    MDC.remove(MDC_REPLICATE);
                }
            }));
        }

        List<T> results = new ArrayList<>(replicates);
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for replicates");
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof InvalidSimulationConfigException) {
                throw (InvalidSimulationConfigException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Replicate task failed", cause);
        }
        return results;
    }

    private static boolean isWholeReplicateFailure(BenchResult result) {
        return result.getFailures().stream()
            .anyMatch(f -> f.getType() == FailureType.REPLICATE_FAILURE);
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    private static void validate(MethodRegistry registry, int replicates, ExecutionOptions options) {
        Objects.requireNonNull(registry, "Registry cannot be null");
        Objects.requireNonNull(options, "Options cannot be null");
        if (replicates < 0) {
            throw new IllegalArgumentException("Replicate count cannot be negative: " + replicates);
        }
    }

    private void ensureNotShutdown() {
        if (executorService.isShutdown()) {
            throw new IllegalStateException("ReplicationDriver has been closed");
        }
    }

    /**
     * Shuts down the worker pool, waiting up to 60 seconds for running replicates.
     */
    @Override
    public void close() {
        logger.debug("Shutting down replication pool ({} threads)", threads);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            benchExecutor.close();
        }
    }
}
