package com.supplier.resolution.bulk;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads entity records from a tabular source.
 * Row-level problems are reported in the {@link ImportResult}, never thrown.
 */
public interface RecordImporter {

    ImportResult importRecords(Reader reader, ProgressCallback callback);

    default ImportResult importRecords(InputStream input, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * @throws UncheckedIOException if the file cannot be opened
     */
    default ImportResult importRecords(Path path, ProgressCallback callback) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importRecords(reader, callback);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    /**
     * Returns the format name (e.g. "csv", "json").
     */
    String getFormat();

    /**
     * Picks an importer by file extension: {@code .json} and {@code .jsonl} use JSON, anything else CSV.
     */
    static RecordImporter forPath(Path path, ColumnMapping mapping) {
        String fileName = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        if (fileName.endsWith(".json") || fileName.endsWith(".jsonl")) {
            return new JsonRecordImporter(mapping);
        }
        return new CsvRecordImporter(mapping);
    }
}
