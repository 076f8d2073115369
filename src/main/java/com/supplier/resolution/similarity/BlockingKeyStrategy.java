package com.supplier.resolution.similarity;

import com.supplier.resolution.core.model.EntityRecord;

/**
 * Strategy interface for deriving a blocking key from a record.
 * Reference records sharing the input's key are visited first during candidate selection,
 * so a strong candidate is found early and the rest of the set can be pruned.
 *
 * <p>Blocking never changes which candidate is selected; it only changes how many
 * name comparisons are needed to prove it is the best one.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking key for a record.
     *
     * @param record the record to key
     * @return the key, or null/blank when the record cannot be blocked
     */
    String blockingKey(EntityRecord record);
}
