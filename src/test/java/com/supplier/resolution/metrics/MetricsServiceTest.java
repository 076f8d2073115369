package com.supplier.resolution.metrics;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.QualityFlag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("MicrometerMetricsService")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        void decisionCounters_taggedByDecision() {
            metrics.recordDecision(Decision.MATCHED);
            metrics.recordDecision(Decision.MATCHED);
            metrics.recordDecision(Decision.UNMATCHED);

            assertEquals(2.0, registry.get("supplier.resolution.decision").tag("decision", "MATCHED").counter().count());
            assertEquals(0.0, registry.get("supplier.resolution.decision").tag("decision", "NEEDS_REVIEW").counter().count());
            assertEquals(1.0, registry.get("supplier.resolution.decision").tag("decision", "UNMATCHED").counter().count());
        }

        @Test
        void qualityFlagCounters_taggedByCode() {
            metrics.recordQualityFlag(QualityFlag.STALE_DATA);

            assertEquals(1.0, registry.get("supplier.quality.flag").tag("flag", "stale_data").counter().count());
        }

        @Test
        void malformedCounter() {
            metrics.recordMalformedRow();

            assertEquals(1.0, registry.get("supplier.resolution.malformed").counter().count());
        }

        @Test
        void scoreSummary() {
            metrics.recordMatchScore(0.5);
            metrics.recordMatchScore(1.0);

            assertEquals(2, registry.get("supplier.resolution.score").summary().count());
            assertEquals(1.5, registry.get("supplier.resolution.score").summary().totalAmount(), 0.0001);
        }

        @Test
        void runDurationAndRows() {
            metrics.recordRunDuration(Duration.ofMillis(250), 40);

            assertEquals(1, registry.get("supplier.resolution.run.duration").timer().count());
            assertEquals(250.0, registry.get("supplier.resolution.run.duration").timer().totalTime(TimeUnit.MILLISECONDS), 0.0001);
            assertEquals(40.0, registry.get("supplier.resolution.run.rows").summary().totalAmount(), 0.0001);
        }
    }

    @Test
    @DisplayName("NoOpMetricsService accepts every call")
    void noOp() {
        NoOpMetricsService metrics = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            metrics.recordDecision(Decision.MATCHED);
            metrics.recordMatchScore(0.9);
            metrics.recordQualityFlag(QualityFlag.MISSING_STREET);
            metrics.recordMalformedRow();
            metrics.recordRunDuration(Duration.ZERO, 0);
        });
    }
}
