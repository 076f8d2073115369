package com.supplier.resolution.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ordered, read-only collection of known company records used as match candidates.
 * The position of each record is its tie-break rank during candidate selection.
 */
public final class ReferenceSet {

    private static final ReferenceSet EMPTY = new ReferenceSet(List.of());

    private final List<EntityRecord> records;

    private ReferenceSet(List<EntityRecord> records) {
        this.records = records;
    }

    public static ReferenceSet of(List<EntityRecord> records) {
        Objects.requireNonNull(records, "records is required");
        return records.isEmpty() ? EMPTY : new ReferenceSet(List.copyOf(records));
    }

    public static ReferenceSet empty() {
        return EMPTY;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public EntityRecord get(int position) {
        return records.get(position);
    }

    public List<EntityRecord> records() {
        return records;
    }

    /**
     * Groups record positions by a key, preserving reference order inside each group.
     * Records whose key is null or blank are left out of the index.
     *
     * @param keyFunction maps a record to its grouping key
     * @return unmodifiable map from key to ascending record positions
     */
    public Map<String, List<Integer>> indexBy(Function<EntityRecord, String> keyFunction) {
        Map<String, List<Integer>> index = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            String key = keyFunction.apply(records.get(i));
            if (key == null || key.isBlank()) {
                continue;
            }
            index.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(index);
    }

    @Override
    public String toString() {
        return "ReferenceSet{size=" + records.size() + '}';
    }
}
