package com.supplier.resolution.bulk;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parsing of loosely formatted field values coming from exports.
 */
public final class FieldParsers {

    private static final Pattern ZONE_SUFFIX = Pattern.compile("(Z|z|[+-]\\d{2}(:?\\d{2})?)$");

    private FieldParsers() {
    }

    /**
     * Parses an ISO-8601-like timestamp. Accepts instants ({@code 2024-01-31T10:00:00Z}),
     * offset date-times, date-times without zone (read as UTC, {@code T} or space separated)
     * and plain dates (start of day UTC).
     *
     * @return the instant, or null when the value is blank or cannot be parsed
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.strip();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (ZONE_SUFFIX.matcher(text).find()) {
                return OffsetDateTime.parse(text.endsWith("z") ? text.substring(0, text.length() - 1) + "Z" : text)
                        .toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Returns null for blank values, the stripped value otherwise.
     */
    public static String text(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
