package com.supplier.resolution.report;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.core.model.QualityFlag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RunReportWriterTest {

    @TempDir
    Path tempDir;

    private final RunReportWriter writer = new RunReportWriter();

    private static RunSummary summary() {
        return RunSummary.of(List.of(
                record(Decision.MATCHED, Set.of()),
                record(Decision.MATCHED, Set.of()),
                record(Decision.NEEDS_REVIEW, EnumSet.of(QualityFlag.STALE_DATA)),
                record(Decision.UNMATCHED, EnumSet.of(QualityFlag.MALFORMED_INPUT))));
    }

    private static DecisionRecord record(Decision decision, Set<QualityFlag> flags) {
        return new DecisionRecord("k", "n", null, null, FeatureVector.EMPTY, 0.0, decision, flags, "");
    }

    @Test
    void reportFile() throws IOException {
        Path file = writer.writeReport(summary(), tempDir.resolve("out"));

        assertEquals(List.of(
                "Total rows: 4",
                "Matched: 2",
                "Needs Review: 1",
                "Unmatched: 1",
                "Clean rows: 2",
                "Rows with flags: 2"), Files.readAllLines(file));
        assertEquals(RunReportWriter.REPORT_FILE, file.getFileName().toString());
    }

    @Test
    void table() {
        String table = writer.renderTable(summary());
        String[] lines = table.split("\n");

        assertEquals(11, lines.length);
        assertEquals("| Total Rows           |        4 |  100.00% |", lines[3]);
        assertEquals("| Matched              |        2 |   50.00% |", lines[4]);
        assertEquals("| Needs Review         |        1 |   25.00% |", lines[5]);
        assertEquals("| Has Flags            |        2 |   50.00% |", lines[9]);
        for (String line : lines) {
            assertEquals(lines[0].length(), line.length(), "table rows must align");
        }
    }

    @Test
    void share_ofEmptyRun() {
        assertEquals("0.00%", RunReportWriter.share(0, 0));
        assertEquals("33.33%", RunReportWriter.share(1, 3));
    }

    @Test
    void errorLog_containsStackTrace() throws IOException {
        Path file = writer.writeErrorLog(tempDir, new IllegalStateException("input file vanished"));

        String content = Files.readString(file);
        assertTrue(content.startsWith("java.lang.IllegalStateException: input file vanished"));
        assertTrue(content.contains("RunReportWriterTest"));
    }
}
