package org.puneet.fdrbench.util;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.puneet.fdrbench.data.FailureType;
import org.puneet.fdrbench.statistical.AggregatedRecord;
import org.puneet.fdrbench.statistical.CovariateBinRecord;
import org.puneet.fdrbench.statistical.MethodFailureSummary;
import org.puneet.fdrbench.statistical.Metric;
import org.puneet.fdrbench.statistical.StandardizedRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ResultsCsvWriterTest {

    private final ResultsCsvWriter writer = new ResultsCsvWriter();

    private static List<CSVRecord> parse(Reader reader) throws IOException {
        return CSVFormat.DEFAULT.withFirstRecordAsHeader().parse(reader).getRecords();
    }

    @Test
    void testStandardizedColumns() throws IOException {
        StringWriter out = new StringWriter();
        writer.writeStandardized(List.of(
            new StandardizedRecord(0, "bh", 0.05, Metric.FDR, 0.04),
            new StandardizedRecord(1, "bh", 0.05, Metric.REJECTPROP, 0.2)), out);

        assertTrue(out.toString().startsWith("replicate,method,alpha,metric,value\n"));
        List<CSVRecord> rows = parse(new StringReader(out.toString()));
        assertEquals(2, rows.size());
        assertEquals("FDR", rows.get(0).get("metric"));
        assertEquals("rejectprop", rows.get(1).get("metric"));
        assertEquals(0.2, Double.parseDouble(rows.get(1).get("value")));
        assertEquals("1", rows.get(1).get("replicate"));
    }

    @Test
    void testAggregatedModeColumn() throws IOException {
        StringWriter out = new StringWriter();
        writer.writeAggregated(List.of(new AggregatedRecord("holm", 0.1, Metric.TPR, 0.5, Double.NaN, 1)),
            "paired-difference", out);
        CSVRecord row = parse(new StringReader(out.toString())).get(0);
        assertEquals("holm", row.get("method"));
        assertEquals("paired-difference", row.get("mode"));
        assertEquals("NaN", row.get("se"));
        assertEquals("1", row.get("n"));
    }

    @Test
    void testFailureSummaryHasColumnPerType() throws IOException {
        StringWriter out = new StringWriter();
        writer.writeFailureSummary(List.of(new MethodFailureSummary("m", 2, 4,
            Map.of(FailureType.TIMEOUT, 2))), out);
        CSVRecord row = parse(new StringReader(out.toString())).get(0);
        assertEquals("2", row.get("failed"));
        assertEquals(0.5, Double.parseDouble(row.get("fraction")));
        assertEquals("2", row.get("timeout"));
        assertEquals("0", row.get("exception"));
        assertEquals("0", row.get("replicate_failure"));
    }

    @Test
    void testCovariateBinsToPath(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("nested").resolve("bins.csv");
        writer.writeCovariateBins(List.of(
            new CovariateBinRecord(0, "m", 0, 0.0, 0.5, 10, 3, 0.75, 0.0)), target);

        assertTrue(Files.exists(target));
        try (Reader reader = Files.newBufferedReader(target)) {
            CSVRecord row = parse(reader).get(0);
            assertEquals("3", row.get("rejections"));
            assertEquals(0.75, Double.parseDouble(row.get("TPR")));
        }
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count(), "temporary file left behind");
        }
    }

    @Test
    void testOverwritesExistingFile(@TempDir Path dir) throws IOException {
        Path target = dir.resolve("standardized.csv");
        Files.writeString(target, "stale");
        writer.writeStandardized(List.of(new StandardizedRecord(0, "bh", 0.05, Metric.TPR, 1.0)), target);
        assertTrue(Files.readString(target).startsWith("replicate,method"));
    }
}
