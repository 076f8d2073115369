package com.supplier.resolution.scoring;

import com.supplier.resolution.config.InvalidConfigurationException;

/**
 * Thresholds of the decision table.
 *
 * @param strong    minimum score for {@code MATCHED} (inclusive)
 * @param review    minimum score for {@code NEEDS_REVIEW} (inclusive)
 * @param nameFloor minimum name similarity; anything below is {@code UNMATCHED}
 */
public record DecisionThresholds(double strong, double review, double nameFloor) {

    public static final double DEFAULT_STRONG = 0.75;
    public static final double DEFAULT_REVIEW = 0.60;
    public static final double DEFAULT_NAME_FLOOR = 0.70;

    public DecisionThresholds {
        validateThreshold(strong, "strong");
        validateThreshold(review, "review");
        validateThreshold(nameFloor, "nameFloor");
        if (review > strong) {
            throw new InvalidConfigurationException(
                    "review threshold (" + review + ") must be <= strong threshold (" + strong + ")");
        }
    }

    public static DecisionThresholds defaults() {
        return new DecisionThresholds(DEFAULT_STRONG, DEFAULT_REVIEW, DEFAULT_NAME_FLOOR);
    }

    private static void validateThreshold(double value, String name) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(name + " threshold must be between 0.0 and 1.0, got " + value);
        }
    }
}
