package com.supplier.resolution.bulk;

import com.supplier.resolution.core.model.EntityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CSV record importer.
 *
 * <p>The first line is the header; columns are located by name through a {@link ColumnMapping},
 * so extra columns and any column order are accepted:</p>
 * <pre>
 * veridion_id,company_name,main_country_code,main_city,main_street,main_postcode,website_url,last_updated_at
 * v-1,"Acme Corporation",RO,Cluj-Napoca,"Str. Mare 1",400001,https://acme.example,2024-01-31T00:00:00Z
 * </pre>
 *
 * <p>A row whose field count differs from the header, or whose quoting is broken, becomes a
 * record with a malformed reason instead of aborting the import. Missing mapped columns are
 * reported once as a schema warning.</p>
 */
public class CsvRecordImporter implements RecordImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvRecordImporter.class);
    private static final int PROGRESS_INTERVAL = 1000;

    private final ColumnMapping mapping;
    private final boolean deduplicateKeys;

    public CsvRecordImporter(ColumnMapping mapping) {
        this(mapping, true);
    }

    /**
     * @param mapping         column names to read
     * @param deduplicateKeys when true, only the first row of each key is kept
     */
    public CsvRecordImporter(ColumnMapping mapping, boolean deduplicateKeys) {
        this.mapping = Objects.requireNonNull(mapping, "mapping is required");
        this.deduplicateKeys = deduplicateKeys;
    }

    @Override
    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<EntityRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        long totalRows = 0;
        long duplicates = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = CsvSupport.readRecord(br);
            if (headerLine == null) {
                log.warn("import.empty format=csv");
                return new ImportResult(List.of(), 0, 0, List.of());
            }
            List<String> header;
            try {
                header = parseHeader(headerLine);
            } catch (IllegalArgumentException e) {
                log.error("import.badHeader error={}", e.getMessage());
                return new ImportResult(List.of(), 0, 0,
                        List.of(new ImportResult.ImportError(1, null, "Unreadable header: " + e.getMessage())));
            }
            Map<String, Integer> columnIndex = indexColumns(header);
            checkSchema(columnIndex);

            String line;
            long recordNumber = 1;
            while ((line = CsvSupport.readRecord(br)) != null) {
                recordNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRows++;

                EntityRecord record = parseRow(line, header.size(), columnIndex, recordNumber, errors);
                String key = record.getKey();
                if (deduplicateKeys && key != null && !seenKeys.add(key)) {
                    duplicates++;
                    log.trace("import.duplicate record={} key={}", recordNumber, key);
                    continue;
                }
                records.add(record);

                if (totalRows % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRows, -1, "Read " + totalRows + " rows");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, null, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(records, totalRows, duplicates, errors);
        cb.onProgress(totalRows, totalRows, "Import completed");
        log.info("import.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private EntityRecord parseRow(String line, int expectedFields, Map<String, Integer> columnIndex,
                                  long recordNumber, List<ImportResult.ImportError> errors) {
        List<String> fields;
        try {
            fields = CsvSupport.parseFields(line);
        } catch (IllegalArgumentException e) {
            return malformedRow(recordNumber, null, e.getMessage(), errors);
        }

        if (fields.size() != expectedFields) {
            Integer keyIdx = columnIndex.get(mapping.keyColumn());
            String key = keyIdx != null && keyIdx < fields.size() ? FieldParsers.text(fields.get(keyIdx)) : null;
            return malformedRow(recordNumber, key,
                    "expected " + expectedFields + " fields, found " + fields.size(), errors);
        }
        return mapping.toBuilder(column -> {
            Integer idx = columnIndex.get(column);
            return idx != null ? fields.get(idx) : null;
        }).build();
    }

    private EntityRecord malformedRow(long recordNumber, String key, String reason,
                                      List<ImportResult.ImportError> errors) {
        String rowKey = key != null ? key : "record-" + recordNumber;
        errors.add(new ImportResult.ImportError(recordNumber, rowKey, reason));
        log.warn("import.malformed record={} key={} reason={}", recordNumber, rowKey, reason);
        return EntityRecord.builder()
                .key(rowKey)
                .malformedReason(reason)
                .build();
    }

    private List<String> parseHeader(String headerLine) {
        List<String> header = new ArrayList<>();
        for (String column : CsvSupport.parseFields(CsvSupport.stripBom(headerLine))) {
            header.add(column.strip());
        }
        return header;
    }

    private Map<String, Integer> indexColumns(List<String> header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            index.putIfAbsent(header.get(i), i);
        }
        return index;
    }

    private void checkSchema(Map<String, Integer> columnIndex) {
        List<String> missing = mapping.allColumns().stream()
                .filter(column -> !columnIndex.containsKey(column))
                .toList();
        if (missing.isEmpty()) {
            return;
        }
        boolean requiredMissing = mapping.requiredColumns().stream().anyMatch(missing::contains);
        log.warn("import.schema missingColumns={} required={}; continuing, affected fields are treated as empty",
                missing, requiredMissing);
    }
}
