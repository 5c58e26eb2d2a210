package org.puneet.fdrbench.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.statistical.AggregatedRecord;
import org.puneet.fdrbench.statistical.CovariateBinRecord;
import org.puneet.fdrbench.statistical.MethodFailureSummary;
import org.puneet.fdrbench.statistical.StandardizedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes benchmark records as long-format CSV.
 *
 * <p>Path-based writes go to a temporary file next to the target, which is then moved
 * into place, so readers never observe a half-written file.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-11
 */
public class ResultsCsvWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResultsCsvWriter.class);

    static final CSVFormat STANDARDIZED_FORMAT = CSVFormat.DEFAULT
        .withHeader("replicate", "method", "alpha", "metric", "value")
        .withRecordSeparator("\n");

    static final CSVFormat AGGREGATED_FORMAT = CSVFormat.DEFAULT
        .withHeader("method", "alpha", "metric", "mean", "se", "n", "mode")
        .withRecordSeparator("\n");

    static final CSVFormat COVARIATE_BIN_FORMAT = CSVFormat.DEFAULT
        .withHeader("replicate", "method", "bin", "lower", "upper", "hypotheses", "rejections", "TPR", "FDR")
        .withRecordSeparator("\n");

    static final CSVFormat FAILURE_FORMAT = buildFailureFormat();

    private static CSVFormat buildFailureFormat() {
        FailureType[] types = FailureType.values();
        String[] header = new String[4 + types.length];
        header[0] = "method";
        header[1] = "failed";
        header[2] = "total";
        header[3] = "fraction";
        for (int i = 0; i < types.length; i++) {
            header[4 + i] = types[i].name().toLowerCase();
        }
        return CSVFormat.DEFAULT.withHeader(header).withRecordSeparator("\n");
    }

    @FunctionalInterface
    private interface RecordSink {
        void write(CSVPrinter printer) throws IOException;
    }

    public void writeStandardized(List<StandardizedRecord> records, Writer out) throws IOException {
        print(out, STANDARDIZED_FORMAT, printer -> {
            for (StandardizedRecord r : records) {
                printer.printRecord(r.getReplicate(), r.getMethodId(), r.getAlpha(),
                    r.getMetric().getLabel(), r.getValue());
            }
        });
    }

    /**
     * @param mode label written to the {@code mode} column, e.g. "mean" or "paired-difference"
     */
    public void writeAggregated(List<AggregatedRecord> records, String mode, Writer out) throws IOException {
        print(out, AGGREGATED_FORMAT, printer -> {
            for (AggregatedRecord r : records) {
                printer.printRecord(r.getMethodId(), r.getAlpha(), r.getMetric().getLabel(), r.getMean(),
                    r.getStandardError(), r.getContributingReplicates(), mode);
            }
        });
    }

    public void writeCovariateBins(List<CovariateBinRecord> records, Writer out) throws IOException {
        print(out, COVARIATE_BIN_FORMAT, printer -> {
            for (CovariateBinRecord r : records) {
                printer.printRecord(r.getReplicate(), r.getMethodId(), r.getBin(), r.getLowerBound(),
                    r.getUpperBound(), r.getHypotheses(), r.getRejections(), r.getTpr(), r.getFdr());
            }
        });
    }

    public void writeFailureSummary(List<MethodFailureSummary> summaries, Writer out) throws IOException {
        print(out, FAILURE_FORMAT, printer -> {
            for (MethodFailureSummary s : summaries) {
                printer.print(s.getMethodId());
                printer.print(s.getFailedReplicates());
                printer.print(s.getTotalReplicates());
                printer.print(s.getFailureFraction());
                for (FailureType type : FailureType.values()) {
                    printer.print(s.getFailuresByType().getOrDefault(type, 0));
                }
                printer.println();
            }
        });
    }

    public void writeStandardized(List<StandardizedRecord> records, Path target) throws IOException {
        writeAtomically(target, w -> writeStandardized(records, w));
    }

    public void writeAggregated(List<AggregatedRecord> records, String mode, Path target) throws IOException {
        writeAtomically(target, w -> writeAggregated(records, mode, w));
    }

    public void writeCovariateBins(List<CovariateBinRecord> records, Path target) throws IOException {
        writeAtomically(target, w -> writeCovariateBins(records, w));
    }

    public void writeFailureSummary(List<MethodFailureSummary> summaries, Path target) throws IOException {
        writeAtomically(target, w -> writeFailureSummary(summaries, w));
    }

    @FunctionalInterface
    private interface WriterBody {
        void write(Writer writer) throws IOException;
    }

    private static void print(Writer out, CSVFormat format, RecordSink sink) throws IOException {
        Objects.requireNonNull(out, "Writer cannot be null");
        CSVPrinter printer = new CSVPrinter(out, format);
        sink.write(printer);
        printer.flush();
    }

    private static void writeAtomically(Path target, WriterBody body) throws IOException {
        Objects.requireNonNull(target, "Target path cannot be null");
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp)) {
                body.write(writer);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported in {}, falling back to replace", dir);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Wrote {}", target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
