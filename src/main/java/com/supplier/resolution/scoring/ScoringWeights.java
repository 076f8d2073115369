package com.supplier.resolution.scoring;

import com.supplier.resolution.config.InvalidConfigurationException;

/**
 * Weights of each feature in the match score.
 * Weights are finite, non-negative and sum to 1.0 (within 0.001).
 */
public record ScoringWeights(
        double nameWeight,
        double countryWeight,
        double cityWeight,
        double freshnessWeight,
        double websiteWeight
) {
    private static final double SUM_TOLERANCE = 0.001;

    public ScoringWeights {
        requireUsable(nameWeight, countryWeight, cityWeight, freshnessWeight, websiteWeight);
        double sum = nameWeight + countryWeight + cityWeight + freshnessWeight + websiteWeight;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: name 0.60, country 0.15, city 0.10, freshness 0.10, website 0.05.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.60, 0.15, 0.10, 0.10, 0.05);
    }

    /**
     * Scales the given weights so they sum to 1.0.
     * Only used when renormalization is explicitly configured.
     *
     * @throws InvalidConfigurationException if a weight is negative or not finite, or all weights are zero
     */
    public static ScoringWeights renormalized(double nameWeight, double countryWeight, double cityWeight,
                                              double freshnessWeight, double websiteWeight) {
        requireUsable(nameWeight, countryWeight, cityWeight, freshnessWeight, websiteWeight);
        double sum = nameWeight + countryWeight + cityWeight + freshnessWeight + websiteWeight;
        if (sum <= 0.0) {
            throw new InvalidConfigurationException("Cannot renormalize weights that sum to " + sum);
        }
        return new ScoringWeights(nameWeight / sum, countryWeight / sum, cityWeight / sum,
                freshnessWeight / sum, websiteWeight / sum);
    }

    private static void requireUsable(double... weights) {
        for (double weight : weights) {
            if (!Double.isFinite(weight)) {
                throw new InvalidConfigurationException("Weights must be finite numbers, got " + weight);
            }
            if (weight < 0) {
                throw new InvalidConfigurationException("Weights must be non-negative");
            }
        }
    }
}
