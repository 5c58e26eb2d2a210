package org.puneet.fdrbench.util;

import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException;
import org.puneet.fdrbench.exceptions.InvalidSimulationConfigException.SimulationErrorType;
import org.puneet.fdrbench.execution.ExecutionOptions;
import org.puneet.fdrbench.execution.SubsampleResampler;
import org.puneet.fdrbench.simulation.EffectSizeDistribution;
import org.puneet.fdrbench.simulation.EffectSizeDistributions;
import org.puneet.fdrbench.simulation.PValueFunctions;
import org.puneet.fdrbench.simulation.Pi0Functions;
import org.puneet.fdrbench.simulation.Pi0Policy;
import org.puneet.fdrbench.simulation.SimulationConfig;
import org.puneet.fdrbench.simulation.TestStatisticPerturbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Properties;

/**
 * Benchmark settings read from {@code benchmark.properties} on the classpath.
 * Missing keys fall back to the defaults below; malformed values are rejected.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-11
 */
public final class BenchmarkConfig {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkConfig.class);

    public static final String DEFAULT_RESOURCE = "benchmark.properties";

    // ===================================================================================
    // DEFAULTS
    // ===================================================================================

    public static final long DEFAULT_SEED = 20170518L;
    public static final int DEFAULT_REPLICATES = 100;
    public static final String DEFAULT_ALPHAS = "0.01,0.05,0.1";
    public static final int DEFAULT_HYPOTHESES = 20000;
    public static final double DEFAULT_PI0 = 0.9;
    public static final double DEFAULT_PI0_LOW = 0.5;
    public static final String DEFAULT_PI0_SHAPE = "constant";
    public static final double DEFAULT_EFFECT_MEAN = 3.0;
    public static final double DEFAULT_EFFECT_SD = 1.0;
    public static final String DEFAULT_NOISE = "gaussian";
    public static final int DEFAULT_NOISE_DF = 5;
    public static final int DEFAULT_RESAMPLING_ATTEMPTS = 100;
    public static final String DEFAULT_OUTPUT_DIRECTORY = "results";

    private final Properties properties;

    private BenchmarkConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath.
     *
     * @throws IllegalStateException if the resource is absent or unreadable
     */
    public static BenchmarkConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static BenchmarkConfig load(String resource) {
        Properties properties = new Properties();
        try (InputStream input = BenchmarkConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
        logger.info("Loaded {} ({} keys)", resource, properties.size());
        return new BenchmarkConfig(properties);
    }

    public static BenchmarkConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        Properties copy = new Properties();
        copy.putAll(properties);
        return new BenchmarkConfig(copy);
    }

    // ===================================================================================
    // BENCHMARK
    // ===================================================================================

    public long getSeed() {
        return getLongProperty("benchmark.seed", DEFAULT_SEED);
    }

    public int getReplicates() {
        int b = getIntProperty("benchmark.replicates", DEFAULT_REPLICATES);
        if (b < 1) {
            throw new IllegalArgumentException("benchmark.replicates must be at least 1: " + b);
        }
        return b;
    }

    public int getThreads() {
        int threads = getIntProperty("benchmark.threads", Runtime.getRuntime().availableProcessors());
        return Math.max(1, threads);
    }

    /**
     * Threshold grid, ascending.
     */
    public double[] getAlphas() {
        String raw = properties.getProperty("benchmark.alphas", DEFAULT_ALPHAS);
        try {
            return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .mapToDouble(Double::parseDouble)
                .sorted()
                .toArray();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for 'benchmark.alphas': " + raw, e);
        }
    }

    public Duration getMethodTimeout() {
        long ms = getLongProperty("benchmark.method.timeout.ms", 0L);
        if (ms < 0) {
            throw new IllegalArgumentException("benchmark.method.timeout.ms cannot be negative: " + ms);
        }
        return Duration.ofMillis(ms);
    }

    // ===================================================================================
    // SIMULATION
    // ===================================================================================

    public int getHypotheses() {
        return getIntProperty("simulation.hypotheses", DEFAULT_HYPOTHESES);
    }

    public double getPi0() {
        return getDoubleProperty("simulation.pi0", DEFAULT_PI0);
    }

    public double getPi0Low() {
        return getDoubleProperty("simulation.pi0.low", DEFAULT_PI0_LOW);
    }

    public String getPi0Shape() {
        return properties.getProperty("simulation.pi0.shape", DEFAULT_PI0_SHAPE).trim();
    }

    public String getEffectShape() {
        String shape = properties.getProperty("simulation.effect.shape");
        return shape == null || shape.isBlank() ? null : shape.trim();
    }

    public double getEffectMean() {
        return getDoubleProperty("simulation.effect.mean", DEFAULT_EFFECT_MEAN);
    }

    public double getEffectSd() {
        return getDoubleProperty("simulation.effect.sd", DEFAULT_EFFECT_SD);
    }

    public String getNoise() {
        return properties.getProperty("simulation.noise", DEFAULT_NOISE).trim().toLowerCase();
    }

    public int getNoiseDf() {
        return getIntProperty("simulation.noise.df", DEFAULT_NOISE_DF);
    }

    public Pi0Policy getPi0Policy() {
        String raw = properties.getProperty("simulation.pi0.policy", "clamp").trim();
        try {
            return Pi0Policy.valueOf(raw.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for 'simulation.pi0.policy': " + raw, e);
        }
    }

    /**
     * Fixed non-null count, or null when non-null status is drawn per hypothesis.
     */
    public Integer getNonNullCount() {
        String value = properties.getProperty("simulation.nonnull.count");
        if (value == null || value.isBlank()) {
            return null;
        }
        return getIntProperty("simulation.nonnull.count", 0);
    }

    public int getResamplingMaxAttempts() {
        return getIntProperty("resampling.max.attempts", DEFAULT_RESAMPLING_ATTEMPTS);
    }

    public String getOutputDirectory() {
        return properties.getProperty("output.directory", DEFAULT_OUTPUT_DIRECTORY).trim();
    }

    /**
     * Assembles the simulation components named by the {@code simulation.*} keys.
     *
     * @throws InvalidSimulationConfigException if a component name is unknown or the
     *         resulting configuration is invalid
     */
    public SimulationConfig toSimulationConfig() throws InvalidSimulationConfigException {
        SimulationConfig.Builder builder = SimulationConfig.builder()
            .hypotheses(getHypotheses())
            .nonNullCount(getNonNullCount())
            .pi0Policy(getPi0Policy())
            .seed(getSeed());
        try {
            builder.pi0Function(Pi0Functions.byName(getPi0Shape(), getPi0Low(), getPi0()));
            String shape = getEffectShape();
            EffectSizeDistribution effects = shape == null
                ? EffectSizeDistributions.normal(getEffectMean(), getEffectSd())
                : EffectSizeDistributions.byName(shape);
            builder.effectSizes(effects);
            switch (getNoise()) {
                case "gaussian":
                case "normal":
                    builder.perturber(TestStatisticPerturbers.gaussian(1.0))
                        .pValueFunction(PValueFunctions.twoSidedNormal());
                    break;
                case "t":
                    builder.perturber(TestStatisticPerturbers.studentT(getNoiseDf()))
                        .pValueFunction(PValueFunctions.twoSidedT(getNoiseDf()));
                    break;
                case "chisq":
                    builder.perturber(TestStatisticPerturbers.chiSquared(getNoiseDf()))
                        .pValueFunction(PValueFunctions.chiSquaredUpper(getNoiseDf()));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown noise family: " + getNoise());
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidSimulationConfigException(SimulationErrorType.INVALID_PARAMETER, e.getMessage());
        }
        return builder.build();
    }

    /**
     * Executor options carrying the configured method timeout and the covariate passthrough.
     */
    public ExecutionOptions toExecutionOptions() {
        return ExecutionOptions.builder()
            .methodTimeout(getMethodTimeout())
            .passthroughFeature(ExecutionOptions.COVARIATE_FEATURE)
            .build();
    }

    /**
     * Subsampling resampler capped at {@code resampling.max.attempts} draws per replicate.
     *
     * @param size rows per resample
     * @param minPerClass minimum null and non-null rows per resample, 0 for no balance check
     */
    public SubsampleResampler toSubsampleResampler(int size, int minPerClass) {
        return new SubsampleResampler(size, minPerClass, getResamplingMaxAttempts());
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value);
        }
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value);
        }
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value);
        }
    }
}
