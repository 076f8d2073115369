package com.supplier.resolution.metrics;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.QualityFlag;

import java.time.Duration;

/**
 * Interface for recording resolution metrics.
 * The default {@link NoOpMetricsService} does nothing; {@link MicrometerMetricsService}
 * publishes to a Micrometer registry. Implementations must be thread-safe.
 */
public interface MetricsService {

    void recordDecision(Decision decision);

    void recordMatchScore(double score);

    void recordQualityFlag(QualityFlag flag);

    void recordMalformedRow();

    void recordRunDuration(Duration duration, int rows);
}
