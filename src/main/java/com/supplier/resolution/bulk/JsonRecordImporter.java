package com.supplier.resolution.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplier.resolution.core.model.EntityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON record importer.
 *
 * <p>Accepts either a JSON array of objects or JSON Lines (one object per line). Field names
 * come from the same {@link ColumnMapping} as the CSV importer:</p>
 * <pre>
 * [
 *   {"veridion_id": "v-1", "company_name": "Acme Corporation", "main_country_code": "RO"},
 *   {"veridion_id": "v-2", "company_name": "Globex", "main_country_code": "DE"}
 * ]
 * </pre>
 *
 * <p>Elements that are not objects, and JSON Lines entries that do not parse, become records
 * with a malformed reason.</p>
 */
public class JsonRecordImporter implements RecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordImporter.class);

    private final ColumnMapping mapping;
    private final boolean deduplicateKeys;
    private final ObjectMapper objectMapper;

    public JsonRecordImporter(ColumnMapping mapping) {
        this(mapping, true, new ObjectMapper());
    }

    public JsonRecordImporter(ColumnMapping mapping, boolean deduplicateKeys, ObjectMapper objectMapper) {
        this.mapping = Objects.requireNonNull(mapping, "mapping is required");
        this.deduplicateKeys = deduplicateKeys;
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    @Override
    public ImportResult importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<EntityRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        long[] counters = new long[2]; // total rows, duplicates

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String content = br.lines().collect(Collectors.joining("\n"));
            String trimmed = content.strip();
            if (trimmed.startsWith("[")) {
                JsonNode root = objectMapper.readTree(trimmed);
                long position = 0;
                for (JsonNode element : root) {
                    position++;
                    accept(toRecord(element, position, errors), records, seenKeys, counters);
                }
            } else {
                String[] lines = content.split("\n", -1);
                for (int i = 0; i < lines.length; i++) {
                    String line = lines[i].strip();
                    if (line.isEmpty()) {
                        continue;
                    }
                    accept(parseLine(line, i + 1, errors), records, seenKeys, counters);
                }
            }
        } catch (JsonProcessingException e) {
            log.error("import.failed format=json error={}", e.getOriginalMessage());
            errors.add(new ImportResult.ImportError(0, null, "Invalid JSON: " + e.getOriginalMessage()));
        } catch (IOException | UncheckedIOException e) {
            log.error("import.failed format=json error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, null, "IO error: " + e.getMessage()));
        }

        ImportResult result = new ImportResult(records, counters[0], counters[1], errors);
        cb.onProgress(counters[0], counters[0], "Import completed");
        log.info("import.completed format=json result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }

    private void accept(EntityRecord record, List<EntityRecord> records, Set<String> seenKeys, long[] counters) {
        counters[0]++;
        if (deduplicateKeys && record.getKey() != null && !seenKeys.add(record.getKey())) {
            counters[1]++;
            return;
        }
        records.add(record);
    }

    private EntityRecord parseLine(String line, long lineNumber, List<ImportResult.ImportError> errors) {
        try {
            return toRecord(objectMapper.readTree(line), lineNumber, errors);
        } catch (JsonProcessingException e) {
            return malformed(lineNumber, "invalid JSON: " + e.getOriginalMessage(), errors);
        }
    }

    private EntityRecord toRecord(JsonNode node, long position, List<ImportResult.ImportError> errors) {
        if (node == null || !node.isObject()) {
            return malformed(position, "expected a JSON object", errors);
        }
        return mapping.toBuilder(field -> text(node.get(field))).build();
    }

    private EntityRecord malformed(long position, String reason, List<ImportResult.ImportError> errors) {
        String key = "record-" + position;
        errors.add(new ImportResult.ImportError(position, key, reason));
        log.warn("import.malformed record={} reason={}", position, reason);
        return EntityRecord.builder().key(key).malformedReason(reason).build();
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
