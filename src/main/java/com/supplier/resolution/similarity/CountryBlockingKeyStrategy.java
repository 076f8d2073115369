package com.supplier.resolution.similarity;

import com.supplier.resolution.core.model.EntityRecord;

/**
 * Blocks records by normalized country code (e.g. {@code "ro"}).
 */
public class CountryBlockingKeyStrategy implements BlockingKeyStrategy {

    @Override
    public String blockingKey(EntityRecord record) {
        if (record == null) {
            return null;
        }
        String country = EntityRecord.normalize(record.getCountry());
        return country.isEmpty() ? null : country;
    }
}
