package com.supplier.resolution.bulk;

import com.supplier.resolution.core.model.EntityRecord;

import java.util.List;

/**
 * Result of loading records from a file.
 *
 * @param records           loaded records in file order, malformed rows included
 * @param totalRows         number of data rows read (blank lines excluded)
 * @param skippedDuplicates rows dropped because their key was already seen
 * @param errors            problems found while reading, one per affected row
 */
public record ImportResult(
        List<EntityRecord> records,
        long totalRows,
        long skippedDuplicates,
        List<ImportError> errors
) {
    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long malformedCount() {
        return records.stream().filter(r -> r.getMalformedReason() != null).count();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A problem with a specific row.
     *
     * @param lineNumber the line number in the input (1-based), or 0 for stream-level errors
     * @param key        the row key when known
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String key, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRows +
                ", records=" + records.size() +
                ", duplicates=" + skippedDuplicates +
                ", errors=" + errors.size() + '}';
    }
}
