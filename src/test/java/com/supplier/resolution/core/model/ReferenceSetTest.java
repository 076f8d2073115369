package com.supplier.resolution.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceSetTest {

    private static EntityRecord record(String key, String country) {
        return EntityRecord.builder().key(key).name("Name " + key).country(country).build();
    }

    @Test
    void of_copiesAndKeepsOrder() {
        List<EntityRecord> source = new ArrayList<>(List.of(record("a", "RO"), record("b", "DE")));
        ReferenceSet set = ReferenceSet.of(source);
        source.clear();

        assertEquals(2, set.size());
        assertEquals("a", set.get(0).getKey());
        assertEquals("b", set.get(1).getKey());
        assertThrows(UnsupportedOperationException.class, () -> set.records().add(record("c", "FR")));
    }

    @Test
    void empty() {
        assertTrue(ReferenceSet.empty().isEmpty());
        assertTrue(ReferenceSet.of(List.of()).isEmpty());
    }

    @Test
    void indexBy_groupsPositionsAndSkipsBlankKeys() {
        ReferenceSet set = ReferenceSet.of(List.of(
                record("a", "RO"), record("b", "DE"), record("c", null), record("d", "RO")));

        Map<String, List<Integer>> index = set.indexBy(EntityRecord::getCountry);

        assertEquals(List.of(0, 3), index.get("RO"));
        assertEquals(List.of(1), index.get("DE"));
        assertEquals(2, index.size());
    }
}
