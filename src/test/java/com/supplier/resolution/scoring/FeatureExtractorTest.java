package com.supplier.resolution.scoring;

import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.similarity.SimilarityAlgorithm;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final FeatureExtractor extractor = new FeatureExtractor(NOW);

    @Test
    void extract_allFeatures() {
        EntityRecord input = EntityRecord.builder()
                .key("in-1").name("Acme Corp").country("RO").city("Cluj-Napoca").build();
        EntityRecord candidate = EntityRecord.builder()
                .key("v-1").name("ACME Corporation").country("ro").city(" cluj-napoca ")
                .websiteUrl("https://acme.example")
                .lastUpdatedAt(NOW.minus(Duration.ofDays(1)))
                .build();

        FeatureVector features = extractor.extract(input, candidate);

        assertEquals(0.72, features.nameSimilarity(), 0.0001);
        assertEquals(1, features.countryMatch());
        assertEquals(1, features.cityMatch());
        assertEquals(1, features.websitePresent());
        assertEquals(1.0, features.freshness(), 0.0001);
    }

    @Test
    void extract_candidateWithoutWebsiteOrDate() {
        EntityRecord input = EntityRecord.builder().key("in-1").name("Globex").country("DE").build();
        EntityRecord candidate = EntityRecord.builder().key("v-2").name("Globex").country("AT").build();

        FeatureVector features = extractor.extract(input, candidate);

        assertEquals(1.0, features.nameSimilarity(), 0.0001);
        assertEquals(0, features.countryMatch());
        assertEquals(0, features.cityMatch());
        assertEquals(0, features.websitePresent());
        assertEquals(0.3, features.freshness(), 0.0001);
    }

    @Test
    void fieldMatch_missingOnBothSides_isNotAMatch() {
        assertEquals(0, FeatureExtractor.fieldMatch(null, null));
        assertEquals(0, FeatureExtractor.fieldMatch("", "  "));
        assertEquals(1, FeatureExtractor.fieldMatch("Berlin", "BERLIN "));
    }

    @Test
    void fieldMatch_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(1, FeatureExtractor.fieldMatch("IZMIR", "izmir"));
            assertEquals(1, FeatureExtractor.fieldMatch("IT", "it"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void usesConfiguredCurveAndSimilarity() {
        SimilarityAlgorithm constant = new SimilarityAlgorithm() {
            @Override
            public double compute(String s1, String s2) {
                return 0.5;
            }

            @Override
            public String getName() {
                return "Constant";
            }
        };
        FeatureExtractor custom = new FeatureExtractor(constant, FreshnessCurve.EXPONENTIAL, NOW);
        EntityRecord input = EntityRecord.builder().key("a").name("x").build();
        EntityRecord candidate = EntityRecord.builder().key("b").name("y")
                .lastUpdatedAt(NOW.minus(Duration.ofDays(365))).build();

        FeatureVector features = custom.extract(input, candidate);

        assertEquals(0.5, features.nameSimilarity(), 0.0001);
        assertEquals(Math.exp(-0.0015 * 365), features.freshness(), 0.0001);
        assertSame(constant, custom.getSimilarityAlgorithm());
    }
}
