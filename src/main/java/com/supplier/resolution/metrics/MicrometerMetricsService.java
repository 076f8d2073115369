package com.supplier.resolution.metrics;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.QualityFlag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code supplier.resolution.decision}: Counter (tag: decision)</li>
 *   <li>{@code supplier.quality.flag}: Counter (tag: flag)</li>
 *   <li>{@code supplier.resolution.malformed}: Counter</li>
 *   <li>{@code supplier.resolution.score}: DistributionSummary</li>
 *   <li>{@code supplier.resolution.run.duration}: Timer</li>
 *   <li>{@code supplier.resolution.run.rows}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Map<Decision, Counter> decisionCounters = new EnumMap<>(Decision.class);
    private final Map<QualityFlag, Counter> flagCounters = new EnumMap<>(QualityFlag.class);
    private final Counter malformedCounter;
    private final DistributionSummary scoreSummary;
    private final Timer runTimer;
    private final DistributionSummary runRowsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        // Meters are registered up front so the maps are read-only once shared.
        for (Decision decision : Decision.values()) {
            decisionCounters.put(decision, Counter.builder("supplier.resolution.decision")
                    .description("Number of input rows per decision")
                    .tag("decision", decision.name())
                    .register(registry));
        }
        for (QualityFlag flag : QualityFlag.values()) {
            flagCounters.put(flag, Counter.builder("supplier.quality.flag")
                    .description("Number of rows carrying each quality flag")
                    .tag("flag", flag.code())
                    .register(registry));
        }
        this.malformedCounter = Counter.builder("supplier.resolution.malformed")
                .description("Number of malformed input rows")
                .register(registry);
        this.scoreSummary = DistributionSummary.builder("supplier.resolution.score")
                .description("Distribution of match scores")
                .register(registry);
        this.runTimer = Timer.builder("supplier.resolution.run.duration")
                .description("Duration of resolution runs")
                .register(registry);
        this.runRowsSummary = DistributionSummary.builder("supplier.resolution.run.rows")
                .description("Number of input rows per run")
                .register(registry);
    }

    @Override
    public void recordDecision(Decision decision) {
        decisionCounters.get(decision).increment();
    }

    @Override
    public void recordMatchScore(double score) {
        scoreSummary.record(score);
    }

    @Override
    public void recordQualityFlag(QualityFlag flag) {
        flagCounters.get(flag).increment();
    }

    @Override
    public void recordMalformedRow() {
        malformedCounter.increment();
    }

    @Override
    public void recordRunDuration(Duration duration, int rows) {
        runTimer.record(duration);
        runRowsSummary.record(rows);
    }
}
