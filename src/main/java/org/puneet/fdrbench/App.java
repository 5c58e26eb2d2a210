package org.puneet.fdrbench;

import org.puneet.fdrbench.baseline.BaselineMethods;
import org.puneet.fdrbench.data.ReplicateEnsemble;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.execution.ExecutionOptions;
import org.puneet.fdrbench.execution.PairedEnsembles;
import org.puneet.fdrbench.execution.ReplicationDriver;
import org.puneet.fdrbench.method.MethodRegistry;
import org.puneet.fdrbench.simulation.SimulationConfig;
import org.puneet.fdrbench.simulation.SimulationGenerator;
import org.puneet.fdrbench.statistical.AggregatedRecord;
import org.puneet.fdrbench.statistical.Aggregator;
import org.puneet.fdrbench.statistical.CovariateDiagnostics;
import org.puneet.fdrbench.statistical.MethodFailureSummary;
import org.puneet.fdrbench.statistical.StandardizedRecord;
import org.puneet.fdrbench.statistical.Standardizer;
import org.puneet.fdrbench.util.BenchmarkConfig;
import org.puneet.fdrbench.util.InMemoryResultCache;
import org.puneet.fdrbench.util.ResultCache;
import org.puneet.fdrbench.util.ResultsCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Command line entry point. Runs the paired informative/uninformative simulation
 * benchmark configured in {@code benchmark.properties} with the built-in baseline
 * methods and writes the standardized, aggregated and diagnostic tables as CSV.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-12
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final double DIAGNOSTIC_ALPHA = 0.05;
    private static final int DIAGNOSTIC_BINS = 10;

    public static void main(String[] args) {
        String runId = generateRunId();
        MDC.put("run.id", runId);
        logger.info("Starting FDR benchmark run {}", runId);

        try {
            BenchmarkConfig config = BenchmarkConfig.load();
            Path outputDir = Paths.get(args.length > 0 ? args[0] : config.getOutputDirectory(), runId);
            run(config, BaselineMethods.defaultRegistry(), outputDir);
            logger.info("FDR benchmark run {} finished, results in {}", runId, outputDir.toAbsolutePath());
        } catch (Exception e) {
            logger.error("Critical error in benchmark execution", e);
            System.exit(1);
        } finally {
            MDC.remove("run.id");
        }
    }

    /**
     * Runs the full pipeline for one configuration.
     *
     * @param config benchmark settings
     * @param registry methods to benchmark
     * @param outputDir directory receiving the CSV files
     * @throws Exception if the simulation configuration is invalid or a file cannot be written
     */
    static void run(BenchmarkConfig config, MethodRegistry registry, Path outputDir) throws Exception {
        SimulationConfig simulation = config.toSimulationConfig();
        double[] alphas = config.getAlphas();
        ExecutionOptions options = config.toExecutionOptions();
        logger.info("Benchmarking {} methods on {} replicates of {} with {} threads",
            registry.size(), config.getReplicates(), simulation, config.getThreads());

        PairedEnsembles ensembles = simulate(config, simulation, registry, options);

        Standardizer standardizer = new Standardizer();
        Aggregator aggregator = new Aggregator();
        ResultCache<List<StandardizedRecord>> cache = new InMemoryResultCache<>();
        List<StandardizedRecord> informative = cache.getOrCompute(PairedEnsembles.INFORMATIVE,
            () -> standardizer.standardize(ensembles.getInformative(), alphas));
        List<StandardizedRecord> uninformative = cache.getOrCompute(PairedEnsembles.UNINFORMATIVE,
            () -> standardizer.standardize(ensembles.getUninformative(), alphas));

        List<AggregatedRecord> informativeMeans = aggregator.aggregate(informative, Collections.emptySet());
        List<AggregatedRecord> uninformativeMeans = aggregator.aggregate(uninformative, Collections.emptySet());
        List<AggregatedRecord> differences =
            aggregator.aggregatePairedDifference(informative, uninformative, Collections.emptySet());

        ResultsCsvWriter writer = new ResultsCsvWriter();
        writer.writeStandardized(informative, outputDir.resolve("standardized_informative.csv"));
        writer.writeStandardized(uninformative, outputDir.resolve("standardized_uninformative.csv"));
        writer.writeAggregated(informativeMeans, "mean", outputDir.resolve("aggregated_informative.csv"));
        writer.writeAggregated(uninformativeMeans, "mean", outputDir.resolve("aggregated_uninformative.csv"));
        writer.writeAggregated(differences, "paired-difference", outputDir.resolve("aggregated_difference.csv"));
        writer.writeCovariateBins(new CovariateDiagnostics().rejectionsByBin(ensembles.getInformative(),
                DIAGNOSTIC_ALPHA, ExecutionOptions.COVARIATE_FEATURE, DIAGNOSTIC_BINS),
            outputDir.resolve("covariate_bins_informative.csv"));

        for (ReplicateEnsemble ensemble : List.of(ensembles.getInformative(), ensembles.getUninformative())) {
            List<MethodFailureSummary> failures = aggregator.summarizeFailures(ensemble);
            writer.writeFailureSummary(failures, outputDir.resolve("failures_" + ensemble.getLabel() + ".csv"));
        }
    }

    private static PairedEnsembles simulate(BenchmarkConfig config, SimulationConfig simulation,
                                            MethodRegistry registry, ExecutionOptions options)
            throws InvalidSimulationConfigException {
        try (ReplicationDriver driver = new ReplicationDriver(config.getThreads())) {
            return driver.runSimulation(new SimulationGenerator(simulation), registry,
                config.getReplicates(), options);
        }
    }

    private static String generateRunId() {
        String uuid = UUID.randomUUID().toString().substring(0, 8);
        return "fdrbench_" + uuid + "_" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
    }
}
