package com.supplier.resolution.report;

import com.supplier.resolution.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable run output: the {@code run_report.txt} file, the console summary table
 * and the {@code error.log} written when a run fails.
 */
public class RunReportWriter {
    private static final Logger log = LoggerFactory.getLogger(RunReportWriter.class);

    public static final String REPORT_FILE = "run_report.txt";
    public static final String ERROR_LOG_FILE = "error.log";

    private static final String RULE = "+----------------------+----------+----------+";

    public List<String> reportLines(RunSummary summary) {
        return List.of(
                "Total rows: " + summary.totalRows(),
                "Matched: " + summary.count(Decision.MATCHED),
                "Needs Review: " + summary.count(Decision.NEEDS_REVIEW),
                "Unmatched: " + summary.count(Decision.UNMATCHED),
                "Clean rows: " + summary.cleanRows(),
                "Rows with flags: " + summary.flaggedRows());
    }

    /**
     * Writes {@code run_report.txt} into the output directory.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path writeReport(RunSummary summary, Path outputDir) {
        Path file = outputDir.resolve(REPORT_FILE);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, String.join("\n", reportLines(summary)) + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        log.info("report.written path={}", file);
        return file;
    }

    /**
     * Monospace table of decision and quality counts with their share of all rows.
     */
    public String renderTable(RunSummary summary) {
        int total = summary.totalRows();
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("| Metric               |   Count  |    Share |");
        lines.add(RULE);
        lines.add(row("Total Rows", total, total));
        lines.add(row("Matched", summary.count(Decision.MATCHED), total));
        lines.add(row("Needs Review", summary.count(Decision.NEEDS_REVIEW), total));
        lines.add(row("Unmatched", summary.count(Decision.UNMATCHED), total));
        lines.add(RULE);
        lines.add(row("Clean", summary.cleanRows(), total));
        lines.add(row("Has Flags", summary.flaggedRows(), total));
        lines.add(RULE);
        return String.join("\n", lines);
    }

    /**
     * Writes the failure and its stack trace to {@code error.log}.
     *
     * @return the written file
     * @throws UncheckedIOException if the file cannot be written
     */
    public Path writeErrorLog(Path outputDir, Throwable failure) {
        Path file = outputDir.resolve(ERROR_LOG_FILE);
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, trace.toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        log.error("run.failed errorLog={}", file);
        return file;
    }

    private static String row(String label, int count, int total) {
        return String.format(Locale.ROOT, "| %-20s | %8d | %8s |", label, count, share(count, total));
    }

    static String share(int part, int total) {
        if (total == 0) {
            return "0.00%";
        }
        return String.format(Locale.ROOT, "%.2f%%", part * 100.0 / total);
    }
}
