package com.supplier.resolution.core.model;

/**
 * Per-candidate-pair signals used for scoring.
 *
 * @param nameSimilarity  normalized name similarity in [0, 1]
 * @param countryMatch    1 when both countries are present and equal, else 0
 * @param cityMatch       1 when both cities are present and equal, else 0
 * @param websitePresent  1 when the candidate has a website, else 0
 * @param freshness       recency of the candidate's last update in [0, 1]
 */
public record FeatureVector(
        double nameSimilarity,
        int countryMatch,
        int cityMatch,
        int websitePresent,
        double freshness
) {
    /**
     * Vector used when there is no candidate to compare against.
     */
    public static final FeatureVector EMPTY = new FeatureVector(0.0, 0, 0, 0, 0.0);

    public FeatureVector {
        requireUnit(nameSimilarity, "nameSimilarity");
        requireUnit(freshness, "freshness");
        requireFlag(countryMatch, "countryMatch");
        requireFlag(cityMatch, "cityMatch");
        requireFlag(websitePresent, "websitePresent");
    }

    private static void requireUnit(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }

    private static void requireFlag(int value, String name) {
        if (value != 0 && value != 1) {
            throw new IllegalArgumentException(name + " must be 0 or 1, got " + value);
        }
    }
}
