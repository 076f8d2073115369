package com.supplier.resolution.bulk;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.report.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Writes decision records to CSV files in an output directory.
 *
 * <p>Files written:</p>
 * <ul>
 *   <li>{@code matches_decisions.csv}: every record, sorted by decision then score descending</li>
 *   <li>{@code matched_only.csv}, {@code needs_review.csv}, {@code unmatched.csv}: one file per decision</li>
 *   <li>{@code qc_summary.csv}: row counts per decision and clean/has_flags status</li>
 * </ul>
 */
public class CsvDecisionExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvDecisionExporter.class);

    public static final String ALL_DECISIONS_FILE = "matches_decisions.csv";
    public static final String MATCHED_FILE = "matched_only.csv";
    public static final String NEEDS_REVIEW_FILE = "needs_review.csv";
    public static final String UNMATCHED_FILE = "unmatched.csv";
    public static final String QC_SUMMARY_FILE = "qc_summary.csv";

    static final String HEADER = "input_row_key,input_company_name,candidate_id,candidate_company_name,"
            + "name_similarity,country_match,city_match,freshness,has_website,match_score,"
            + "decision,decision_notes,qc_flags";

    private static final Comparator<DecisionRecord> OUTPUT_ORDER =
            Comparator.comparing(DecisionRecord::decision)
                    .thenComparing(DecisionRecord::matchScore, Comparator.reverseOrder());

    /**
     * Writes all files, creating the output directory if needed.
     *
     * @throws UncheckedIOException if a file cannot be written
     */
    public ExportResult export(List<DecisionRecord> records, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }

        List<DecisionRecord> sorted = new ArrayList<>(records);
        sorted.sort(OUTPUT_ORDER);

        List<Path> files = new ArrayList<>();
        files.add(writeDecisions(outputDir.resolve(ALL_DECISIONS_FILE), sorted));
        files.add(writeDecisions(outputDir.resolve(MATCHED_FILE), filter(sorted, Decision.MATCHED)));
        files.add(writeDecisions(outputDir.resolve(NEEDS_REVIEW_FILE), filter(sorted, Decision.NEEDS_REVIEW)));
        files.add(writeDecisions(outputDir.resolve(UNMATCHED_FILE), filter(sorted, Decision.UNMATCHED)));
        files.add(writeQcSummary(outputDir.resolve(QC_SUMMARY_FILE), RunSummary.of(records)));

        ExportResult result = new ExportResult(records.size(), files);
        log.info("export.completed dir={} result={}", outputDir, result);
        return result;
    }

    private List<DecisionRecord> filter(List<DecisionRecord> records, Decision decision) {
        return records.stream().filter(r -> r.decision() == decision).toList();
    }

    private Path writeDecisions(Path file, List<DecisionRecord> records) {
        try (PrintWriter pw = new PrintWriter(new BufferedWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8)))) {
            pw.println(HEADER);
            for (DecisionRecord record : records) {
                pw.println(toRow(record));
            }
            if (pw.checkError()) {
                throw new IOException("write failed");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        log.debug("export.file path={} rows={}", file, records.size());
        return file;
    }

    private Path writeQcSummary(Path file, RunSummary summary) {
        try (PrintWriter pw = new PrintWriter(new BufferedWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8)))) {
            pw.println("decision,flag,rows");
            for (RunSummary.QcGroup group : summary.qcBreakdown()) {
                pw.println(CsvSupport.escape(group.decision().label()) + "," + group.status() + "," + group.rows());
            }
            if (pw.checkError()) {
                throw new IOException("write failed");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        return file;
    }

    static String toRow(DecisionRecord record) {
        FeatureVector f = record.features();
        return String.join(",",
                CsvSupport.escape(record.inputKey()),
                CsvSupport.escape(record.inputName()),
                CsvSupport.escape(record.candidateKey()),
                CsvSupport.escape(record.candidateName()),
                String.format(Locale.ROOT, "%.4f", f.nameSimilarity()),
                Integer.toString(f.countryMatch()),
                Integer.toString(f.cityMatch()),
                String.format(Locale.ROOT, "%.2f", f.freshness()),
                Integer.toString(f.websitePresent()),
                String.format(Locale.ROOT, "%.4f", record.matchScore()),
                CsvSupport.escape(record.decision().label()),
                CsvSupport.escape(record.notes()),
                CsvSupport.escape(record.flagCodes()));
    }
}
