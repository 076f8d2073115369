package com.supplier.resolution.bulk;

/**
 * Callback for tracking progress of imports and resolution runs.
 * May be invoked from worker threads when a run is parallel.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed the number of records processed so far
     * @param total     the total number of records (-1 if unknown)
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
