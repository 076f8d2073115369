package com.supplier.resolution.cli;

import com.supplier.resolution.api.ResolutionOptions;
import com.supplier.resolution.api.ResolutionRun;
import com.supplier.resolution.api.SupplierResolver;
import com.supplier.resolution.bulk.ColumnMapping;
import com.supplier.resolution.bulk.CsvDecisionExporter;
import com.supplier.resolution.bulk.ImportResult;
import com.supplier.resolution.bulk.RecordImporter;
import com.supplier.resolution.config.InvalidConfigurationException;
import com.supplier.resolution.config.ResolutionConfig;
import com.supplier.resolution.config.ResolutionConfigLoader;
import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.ReferenceSet;
import com.supplier.resolution.logging.LogContext;
import com.supplier.resolution.metrics.MicrometerMetricsService;
import com.supplier.resolution.report.RunReportWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Command-line launcher: load configuration, import records, resolve, export, report.
 *
 * <p>Exit codes: 0 on success, 1 on a runtime failure (details in {@code error.log} in the
 * output directory), 2 on a usage or configuration error.</p>
 */
public final class ResolutionCommand {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCommand.class);
    private static final String COMMAND_NAME = "supplier-resolution";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ResolutionConfigLoader configLoader;
    private final PrintStream out;
    private final PrintStream err;
    private final RunReportWriter reportWriter = new RunReportWriter();

    public ResolutionCommand() {
        this(new ResolutionConfigLoader(), System.out, System.err);
    }

    public ResolutionCommand(ResolutionConfigLoader configLoader, PrintStream out, PrintStream err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader is required");
        this.out = Objects.requireNonNull(out, "out is required");
        this.err = Objects.requireNonNull(err, "err is required");
    }

    public static void main(String[] args) {
        int exit = new ResolutionCommand().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return EXIT_OK;
        }

        Instant start = Instant.now();
        ResolutionConfig config = null;
        try {
            String configArg = cmd.getOptionValue("config");
            config = applyOverrides(configLoader.load(configArg != null ? Path.of(configArg) : null), cmd);
            log.info("cli.config input={} reference={} output={}",
                    config.inputPath(), config.referencePath(), config.outputPath());

            execute(config);

            log.info("cli.completed elapsedMs={} output={}",
                    Duration.between(start, Instant.now()).toMillis(), config.outputPath());
            return EXIT_OK;
        } catch (InvalidConfigurationException e) {
            log.error("cli.invalidConfig error={}", e.getMessage());
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("cli.failed error={}", e.getMessage(), e);
            err.println("FATAL: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            writeErrorLog(config != null ? config.outputPath() : Path.of("").toAbsolutePath(), e);
            return EXIT_FAILURE;
        }
    }

    private void execute(ResolutionConfig config) {
        List<EntityRecord> inputs;
        List<EntityRecord> references;
        if (config.hasReferencePath()) {
            inputs = importRecords(config.inputPath(), ColumnMapping.input());
            references = importRecords(config.referencePath(), ColumnMapping.reference());
        } else {
            log.info("cli.pairsExport path={} reading input and reference columns from one file", config.inputPath());
            inputs = importRecords(config.inputPath(), ColumnMapping.input());
            references = importRecords(config.inputPath(), ColumnMapping.reference());
        }

        List<EntityRecord> usableReferences = references.stream().filter(r -> !r.isMalformed()).toList();
        if (usableReferences.size() < references.size()) {
            log.warn("cli.referenceRowsSkipped count={} reason=missing key or name",
                    references.size() - usableReferences.size());
        }

        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ResolutionRun run;
        try (SupplierResolver resolver = SupplierResolver.builder()
                .referenceSet(ReferenceSet.of(usableReferences))
                .options(config.options())
                .metricsService(new MicrometerMetricsService(registry))
                .build()) {
            run = resolver.run(inputs, (processed, total, message) ->
                    log.debug("cli.progress processed={} total={} message={}", processed, total, message));
        }
        if (log.isDebugEnabled()) {
            log.debug("cli.metrics\n{}", registry.getMetersAsString());
        }

        new CsvDecisionExporter().export(run.records(), config.outputPath());
        reportWriter.writeReport(run.summary(), config.outputPath());
        out.println(reportWriter.renderTable(run.summary()));
    }

    private List<EntityRecord> importRecords(Path path, ColumnMapping mapping) {
        RecordImporter importer = RecordImporter.forPath(path, mapping);
        try (LogContext ctx = LogContext.forImport(String.valueOf(path.getFileName()))
                .with("keyColumn", mapping.keyColumn())) {
            ImportResult result = importer.importRecords(path, null);
            for (ImportResult.ImportError error : result.errors()) {
                if (error.lineNumber() == 0) {
                    throw new IllegalStateException("Cannot import " + path + ": " + error.message());
                }
            }
            log.info("cli.imported path={} format={} records={} duplicates={} malformed={}",
                    path, importer.getFormat(), result.records().size(), result.skippedDuplicates(),
                    result.malformedCount());
            return result.records();
        }
    }

    private ResolutionConfig applyOverrides(ResolutionConfig config, CommandLine cmd) {
        ResolutionConfig withPaths = config.withPaths(
                pathOption(cmd, "input"), pathOption(cmd, "reference"), pathOption(cmd, "output"));

        ResolutionOptions.Builder builder = ResolutionOptions.builder(config.options());
        if (cmd.hasOption("strong")) {
            builder.strongThreshold(doubleOption(cmd, "strong"));
        }
        if (cmd.hasOption("review")) {
            builder.reviewThreshold(doubleOption(cmd, "review"));
        }
        if (cmd.hasOption("name-floor")) {
            builder.nameFloor(doubleOption(cmd, "name-floor"));
        }
        if (cmd.hasOption("now")) {
            builder.now(ResolutionConfigLoader.parseNow(cmd.getOptionValue("now")));
        }
        if (cmd.hasOption("parallelism")) {
            builder.parallelism(intOption(cmd, "parallelism"));
        }
        if (cmd.hasOption("blocking")) {
            builder.blockingEnabled(true);
        }
        return withPaths.withOptions(builder.build());
    }

    private static Path pathOption(CommandLine cmd, String name) {
        String value = cmd.getOptionValue(name);
        return value == null || value.isBlank() ? null : Path.of(value.strip()).toAbsolutePath().normalize();
    }

    private static double doubleOption(CommandLine cmd, String name) {
        String value = cmd.getOptionValue(name);
        try {
            return Double.parseDouble(value.strip());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("--" + name + " must be a number, got " + value, e);
        }
    }

    private static int intOption(CommandLine cmd, String name) {
        String value = cmd.getOptionValue(name);
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("--" + name + " must be an integer, got " + value, e);
        }
    }

    private void writeErrorLog(Path outputDir, Throwable failure) {
        try {
            Path file = reportWriter.writeErrorLog(outputDir, failure);
            err.println("Wrote error details to: " + file);
        } catch (UncheckedIOException e) {
            log.error("cli.errorLogFailed dir={} error={}", outputDir, e.getMessage());
            failure.printStackTrace(err);
        }
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, COMMAND_NAME, null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path").desc("configuration JSON file").build());
        options.addOption(Option.builder().longOpt("input").hasArg().argName("path").desc("input records (CSV, JSON or JSONL)").build());
        options.addOption(Option.builder().longOpt("reference").hasArg().argName("path").desc("reference records; omit to read a candidate-pairs export from --input").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("dir").desc("output directory").build());
        options.addOption(Option.builder().longOpt("strong").hasArg().argName("score").desc("score at or above which a row is Matched").build());
        options.addOption(Option.builder().longOpt("review").hasArg().argName("score").desc("score at or above which a row Needs Review").build());
        options.addOption(Option.builder().longOpt("name-floor").hasArg().argName("similarity").desc("name similarity below which a row is always Unmatched").build());
        options.addOption(Option.builder().longOpt("now").hasArg().argName("timestamp").desc("reference time for freshness and staleness, e.g. 2024-06-01T00:00:00Z").build());
        options.addOption(Option.builder().longOpt("parallelism").hasArg().argName("threads").desc("number of worker threads").build());
        options.addOption(Option.builder().longOpt("blocking").desc("scan same-country candidates first").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
