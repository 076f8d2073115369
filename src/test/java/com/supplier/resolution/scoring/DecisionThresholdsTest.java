package com.supplier.resolution.scoring;

import com.supplier.resolution.config.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionThresholdsTest {

    @Test
    void defaults() {
        DecisionThresholds thresholds = DecisionThresholds.defaults();

        assertEquals(0.75, thresholds.strong());
        assertEquals(0.60, thresholds.review());
        assertEquals(0.70, thresholds.nameFloor());
    }

    @Test
    void reviewAboveStrong_isRejected() {
        assertThrows(InvalidConfigurationException.class, () -> new DecisionThresholds(0.6, 0.7, 0.7));
    }

    @Test
    void equalReviewAndStrong_isAccepted() {
        assertDoesNotThrow(() -> new DecisionThresholds(0.7, 0.7, 0.5));
    }

    @Test
    void outOfRange_isRejected() {
        assertThrows(InvalidConfigurationException.class, () -> new DecisionThresholds(1.2, 0.6, 0.7));
        assertThrows(InvalidConfigurationException.class, () -> new DecisionThresholds(0.75, -0.1, 0.7));
        assertThrows(InvalidConfigurationException.class, () -> new DecisionThresholds(0.75, 0.6, Double.NaN));
    }
}
