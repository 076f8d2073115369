package com.supplier.resolution.core.model;

/**
 * Outcome of classifying the best candidate for an input record.
 */
public enum Decision {
    /**
     * Score at or above the strong threshold.
     */
    MATCHED("Matched"),

    /**
     * Score in the review band; a person should confirm the link.
     */
    NEEDS_REVIEW("Needs Review"),

    /**
     * Name below the floor, score below the review band, no candidate, or malformed input.
     */
    UNMATCHED("Unmatched");

    private final String label;

    Decision(String label) {
        this.label = label;
    }

    /**
     * Human-readable label used in exported files and reports.
     */
    public String label() {
        return label;
    }
}
