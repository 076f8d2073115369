package com.supplier.resolution.bulk;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of exporting decision records.
 *
 * @param totalRecords number of decision records exported
 * @param files        files written, in write order
 */
public record ExportResult(long totalRecords, List<Path> files) {
    public ExportResult {
        files = files != null ? List.copyOf(files) : List.of();
    }

    @Override
    public String toString() {
        return "ExportResult{records=" + totalRecords + ", files=" + files.size() + '}';
    }
}
