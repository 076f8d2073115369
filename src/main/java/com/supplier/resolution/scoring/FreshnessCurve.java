package com.supplier.resolution.scoring;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Maps the age of a record's last update to a freshness score in [0, 1].
 *
 * <p>Every curve returns 1.0 for an age of zero days, never increases with age,
 * and never drops below {@link #floor()}. A missing date scores the floor.</p>
 */
public enum FreshnessCurve {

    /**
     * Step function: up to 1 year 1.0, up to 2 years 0.7, up to 3 years 0.5, older 0.3.
     */
    TIERED {
        @Override
        public double score(long ageDays) {
            long days = Math.max(0, ageDays);
            if (days <= 365) {
                return 1.0;
            }
            if (days <= 730) {
                return 0.7;
            }
            if (days <= 1095) {
                return 0.5;
            }
            return FLOOR;
        }
    },

    /**
     * Smooth decay: {@code max(floor, exp(-lambda * days))} with lambda 0.0015,
     * which is about 0.58 at one year and reaches the floor a little after 800 days.
     */
    EXPONENTIAL {
        @Override
        public double score(long ageDays) {
            long days = Math.max(0, ageDays);
            return Math.max(FLOOR, Math.exp(-LAMBDA * days));
        }
    };

    private static final double FLOOR = 0.3;
    private static final double LAMBDA = 0.0015;

    /**
     * Freshness for a record updated {@code ageDays} ago. Negative ages count as zero.
     */
    public abstract double score(long ageDays);

    /**
     * Freshness for a last-updated instant relative to {@code now}.
     *
     * @param lastUpdatedAt the record's last update, or null when unknown
     * @param now           reference time of the run
     */
    public double score(Instant lastUpdatedAt, Instant now) {
        if (lastUpdatedAt == null) {
            return floor();
        }
        return score(ageInDays(lastUpdatedAt, now));
    }

    public double floor() {
        return FLOOR;
    }

    /**
     * Whole days between {@code lastUpdatedAt} and {@code now}, zero for future dates.
     */
    public static long ageInDays(Instant lastUpdatedAt, Instant now) {
        return Math.max(0, Duration.between(lastUpdatedAt, now).toDays());
    }

    /**
     * Parses a curve name case-insensitively ({@code "tiered"}, {@code "exponential"}).
     */
    public static FreshnessCurve fromName(String name) {
        if (name == null || name.isBlank()) {
            return TIERED;
        }
        return valueOf(name.strip().toUpperCase(Locale.ROOT));
    }
}
