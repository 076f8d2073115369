package com.supplier.resolution.metrics;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.QualityFlag;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDecision(Decision decision) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordQualityFlag(QualityFlag flag) {
    }

    @Override
    public void recordMalformedRow() {
    }

    @Override
    public void recordRunDuration(Duration duration, int rows) {
    }
}
