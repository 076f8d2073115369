package com.supplier.resolution.quality;

import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.QualityFlag;
import com.supplier.resolution.scoring.FreshnessCurve;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inspects a record for missing attributes and stale data.
 * Flags are independent; a record with no flags is clean.
 */
public class QualityFlagger {

    public static final int DEFAULT_STALENESS_DAYS = 730;

    private final Instant now;
    private final int stalenessDays;

    public QualityFlagger(Instant now) {
        this(now, DEFAULT_STALENESS_DAYS);
    }

    public QualityFlagger(Instant now, int stalenessDays) {
        if (stalenessDays < 0) {
            throw new IllegalArgumentException("stalenessDays must be non-negative");
        }
        this.now = Objects.requireNonNull(now, "now is required");
        this.stalenessDays = stalenessDays;
    }

    public Set<QualityFlag> flag(EntityRecord record) {
        Set<QualityFlag> flags = EnumSet.noneOf(QualityFlag.class);
        if (EntityRecord.isBlank(record.getPostcode())) {
            flags.add(QualityFlag.MISSING_POSTCODE);
        }
        if (EntityRecord.isBlank(record.getStreet())) {
            flags.add(QualityFlag.MISSING_STREET);
        }
        if (!record.hasWebsite() && !record.hasSocialPresence()) {
            flags.add(QualityFlag.NO_WEB_PRESENCE);
        }
        if (isStale(record.getLastUpdatedAt())) {
            flags.add(QualityFlag.STALE_DATA);
        }
        if (EntityRecord.isBlank(record.getCompanyType())) {
            flags.add(QualityFlag.MISSING_COMPANY_TYPE);
        }
        return flags;
    }

    /**
     * An unknown update date is not reported as stale.
     */
    boolean isStale(Instant lastUpdatedAt) {
        return lastUpdatedAt != null && FreshnessCurve.ageInDays(lastUpdatedAt, now) > stalenessDays;
    }

    public int getStalenessDays() {
        return stalenessDays;
    }
}
