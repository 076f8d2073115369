package com.supplier.resolution.api;

import com.supplier.resolution.core.model.Decision;
import com.supplier.resolution.core.model.DecisionRecord;
import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.core.model.QualityFlag;
import com.supplier.resolution.core.model.ReferenceSet;
import com.supplier.resolution.metrics.MetricsService;
import com.supplier.resolution.similarity.SimilarityAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SupplierResolverTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    @Mock
    private MetricsService metricsService;

    private static ResolutionOptions options() {
        return ResolutionOptions.builder().now(NOW).build();
    }

    private static EntityRecord acmeReference() {
        return EntityRecord.builder()
                .key("v-1")
                .name("ACME Corporation")
                .country("RO")
                .city("Cluj-Napoca")
                .street("Str. Mare 1")
                .postcode("400001")
                .companyType("SRL")
                .websiteUrl("https://acme.example")
                .lastUpdatedAt(NOW.minus(Duration.ofDays(1)))
                .build();
    }

    private static EntityRecord input(String key, String name) {
        return EntityRecord.builder().key(key).name(name).country("RO").city("Cluj-Napoca").build();
    }

    @Nested
    @DisplayName("Single row resolution")
    class SingleRow {

        @Test
        void strongMatch_linksCandidateAndJudgesItsQuality() {
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(acmeReference()))
                    .options(options())
                    .build()) {

                DecisionRecord record = resolver.resolve(input("in-1", "Acme Corp"));

                assertEquals(Decision.MATCHED, record.decision());
                assertEquals("v-1", record.candidateKey());
                assertEquals("ACME Corporation", record.candidateName());
                assertEquals(0.832, record.matchScore(), 0.0001);
                // the input has no postcode or street, the linked company does
                assertTrue(record.isClean());
                assertEquals("name_sim=0.72; country=match; city=match; website=present; fresh=1.00; score=0.83",
                        record.notes());
            }
        }

        @Test
        void belowNameFloor_keepsBestCandidateAndSaysWhy() {
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(acmeReference()))
                    .options(options())
                    .build()) {

                DecisionRecord record = resolver.resolve(input("in-2", "Globex"));

                assertEquals(Decision.UNMATCHED, record.decision());
                assertEquals("v-1", record.candidateKey());
                assertTrue(record.notes().endsWith("; below name floor"));
                // the selected candidate is judged even when the row is Unmatched
                assertTrue(record.isClean());
            }
        }

        @Test
        @DisplayName("Quality flags of a pair do not change when only the thresholds change")
        void qualityFlags_independentOfDecision() {
            EntityRecord candidate = EntityRecord.builder()
                    .key("v-9").name("ACME Corporation").country("RO").city("Cluj-Napoca")
                    .street("Str. Mare 1").companyType("SRL")
                    .lastUpdatedAt(NOW.minus(Duration.ofDays(1)))
                    .build();
            EntityRecord row = input("in-9", "Acme Corp");

            DecisionRecord lenient;
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(candidate))
                    .options(options())
                    .build()) {
                lenient = resolver.resolve(row);
            }
            DecisionRecord strict;
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(candidate))
                    .options(ResolutionOptions.builder(options()).nameFloor(0.9).build())
                    .build()) {
                strict = resolver.resolve(row);
            }

            assertNotEquals(Decision.UNMATCHED, lenient.decision());
            assertEquals(Decision.UNMATCHED, strict.decision());
            assertEquals(EnumSet.of(QualityFlag.MISSING_POSTCODE, QualityFlag.NO_WEB_PRESENCE), lenient.flags());
            assertEquals(lenient.flags(), strict.flags());
        }

        @Test
        void malformedRow_isUnmatchedWithMalformedFlagOnly() {
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(acmeReference()))
                    .options(options())
                    .metricsService(metricsService)
                    .build()) {

                DecisionRecord record = resolver.resolve(EntityRecord.builder().key("in-3").build());

                assertEquals(Decision.UNMATCHED, record.decision());
                assertNull(record.candidateKey());
                assertEquals(FeatureVector.EMPTY, record.features());
                assertEquals(0.0, record.matchScore());
                assertEquals(EnumSet.of(QualityFlag.MALFORMED_INPUT), record.flags());
                assertEquals("malformed input: missing company name", record.notes());
                verify(metricsService).recordMalformedRow();
                verify(metricsService).recordQualityFlag(QualityFlag.MALFORMED_INPUT);
                verify(metricsService).recordDecision(Decision.UNMATCHED);
            }
        }

        @Test
        void loaderMalformedReason_isCarriedIntoNotes() {
            try (SupplierResolver resolver = SupplierResolver.builder().options(options()).build()) {
                DecisionRecord record = resolver.resolve(EntityRecord.builder()
                        .key("record-7").malformedReason("expected 5 fields, found 3").build());

                assertEquals("malformed input: expected 5 fields, found 3", record.notes());
            }
        }

        @Test
        void emptyReferenceSet_everyRowUnmatchedWithInputQuality() {
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceSet(ReferenceSet.empty())
                    .options(options())
                    .build()) {

                DecisionRecord record = resolver.resolve(input("in-4", "Acme Corp"));

                assertEquals(Decision.UNMATCHED, record.decision());
                assertNull(record.candidateKey());
                assertFalse(record.hasCandidate());
                assertEquals("no reference candidates", record.notes());
                // no candidate to judge, so the input row itself is flagged
                assertEquals(EnumSet.of(QualityFlag.MISSING_POSTCODE, QualityFlag.MISSING_STREET,
                        QualityFlag.MISSING_COMPANY_TYPE, QualityFlag.NO_WEB_PRESENCE), record.flags());
            }
        }

        @Test
        void failureDuringResolution_becomesMalformedRow() {
            SimilarityAlgorithm failing = new SimilarityAlgorithm() {
                @Override
                public double compute(String s1, String s2) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public String getName() {
                    return "Failing";
                }
            };
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(acmeReference()))
                    .similarityAlgorithm(failing)
                    .options(options())
                    .build()) {

                DecisionRecord record = resolver.resolve(input("in-5", "Acme"));

                assertEquals(Decision.UNMATCHED, record.decision());
                assertEquals("malformed input: resolution failed: boom", record.notes());
            }
        }
    }

    @Nested
    @DisplayName("Runs")
    class Runs {

        private List<EntityRecord> inputs() {
            String[] names = {"Acme Corp", "ACME Corporation", "Acme", "Globex", "Acme Corporation SRL",
                    "Acme Corpp", "Initech", null, "ACME CORP"};
            List<EntityRecord> inputs = new ArrayList<>();
            for (int i = 0; i < 45; i++) {
                inputs.add(input("in-" + i, names[i % names.length]));
            }
            return inputs;
        }

        private List<EntityRecord> references() {
            return List.of(
                    acmeReference(),
                    EntityRecord.builder().key("v-2").name("Globex GmbH").country("DE").build(),
                    EntityRecord.builder().key("v-3").name("Acme Corp").country("HU")
                            .lastUpdatedAt(NOW.minus(Duration.ofDays(900))).build());
        }

        @Test
        void run_preservesInputOrderAndSummarizes() {
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(references())
                    .options(options())
                    .build()) {

                List<EntityRecord> inputs = inputs();
                ResolutionRun run = resolver.run(inputs);

                assertEquals(inputs.size(), run.records().size());
                for (int i = 0; i < inputs.size(); i++) {
                    assertEquals(inputs.get(i).getKey(), run.records().get(i).inputKey());
                }
                assertEquals(inputs.size(), run.summary().totalRows());
                assertEquals(5, run.summary().flagCounts().get(QualityFlag.MALFORMED_INPUT));
                assertNotNull(run.runId());
            }
        }

        @Test
        @DisplayName("Parallel and blocked runs give the same records as a sequential exhaustive run")
        void parallelAndBlocked_matchSequential() {
            List<DecisionRecord> sequential;
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(references())
                    .options(options())
                    .build()) {
                sequential = resolver.resolveAll(inputs());
            }

            ResolutionOptions parallelOptions = ResolutionOptions.builder(options())
                    .parallelism(4)
                    .blockingEnabled(true)
                    .build();
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(references())
                    .options(parallelOptions)
                    .build()) {
                assertEquals(sequential, resolver.resolveAll(inputs()));
            }
        }

        @Test
        @DisplayName("Shuffling the input rows yields the same multiset of records")
        void shuffledInput_sameRecords() {
            List<EntityRecord> shuffled = new ArrayList<>(inputs());
            Collections.shuffle(shuffled, new Random(7));

            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(references())
                    .options(options())
                    .build()) {
                List<DecisionRecord> inOrder = new ArrayList<>(resolver.resolveAll(inputs()));
                List<DecisionRecord> reordered = new ArrayList<>(resolver.resolveAll(shuffled));

                Comparator<DecisionRecord> byContent = Comparator.comparing(DecisionRecord::toString);
                inOrder.sort(byContent);
                reordered.sort(byContent);
                assertEquals(inOrder, reordered);
            }
        }

        @Test
        void run_nullElement_isRejectedBeforeAnyRowIsResolved() {
            List<EntityRecord> withNull = new ArrayList<>(inputs());
            withNull.set(3, null);

            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(references())
                    .options(options())
                    .metricsService(metricsService)
                    .build()) {
                IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                        () -> resolver.run(withNull));
                assertTrue(ex.getMessage().contains("index 3"));
            }
            verify(metricsService, never()).recordDecision(any());
        }

        @Test
        void run_recordsMetricsAndReportsProgress() {
            AtomicLong lastProcessed = new AtomicLong();
            try (SupplierResolver resolver = SupplierResolver.builder()
                    .referenceRecords(List.of(acmeReference()))
                    .options(options())
                    .metricsService(metricsService)
                    .build()) {

                resolver.run(List.of(input("in-1", "Acme Corp"), input("in-2", "Globex")),
                        (processed, total, message) -> lastProcessed.set(processed));
            }

            verify(metricsService).recordDecision(Decision.MATCHED);
            verify(metricsService).recordDecision(Decision.UNMATCHED);
            verify(metricsService, times(2)).recordMatchScore(anyDouble());
            verify(metricsService).recordRunDuration(any(Duration.class), eq(2));
            verify(metricsService, never()).recordMalformedRow();
            assertEquals(2, lastProcessed.get());
        }
    }

    @Test
    void decisionNotes_format() {
        String notes = SupplierResolver.decisionNotes(new FeatureVector(0.5, 0, 0, 0, 0.3), 0.33);
        assertEquals("name_sim=0.50; country=mismatch; fresh=0.30; score=0.33", notes);
    }

    @Test
    void build_withoutOptions_usesDefaults() {
        try (SupplierResolver resolver = SupplierResolver.builder().build()) {
            assertEquals(1, resolver.getOptions().getParallelism());
            assertTrue(resolver.getReferenceSet().isEmpty());
        }
    }
}
