package com.supplier.resolution.scoring;

import com.supplier.resolution.core.model.FeatureVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchScorerTest {

    private final MatchScorer scorer = new MatchScorer();

    @Test
    void perfectFeatures_scoreOne() {
        assertEquals(1.0, scorer.score(new FeatureVector(1.0, 1, 1, 1, 1.0)), 0.0001);
    }

    @Test
    void emptyFeatures_scoreZero() {
        assertEquals(0.0, scorer.score(FeatureVector.EMPTY), 0.0001);
    }

    @Test
    void weightedSum() {
        // 0.6*0.72 + 0.15 + 0.10 + 0.10*1.0 + 0.05
        assertEquals(0.832, scorer.score(new FeatureVector(0.72, 1, 1, 1, 1.0)), 0.0001);
        // 0.6*0.9 + 0.10*0.3
        assertEquals(0.57, scorer.score(new FeatureVector(0.9, 0, 0, 0, 0.3)), 0.0001);
    }

    @Test
    @DisplayName("Raising any single feature never lowers the score")
    void monotoneInEachFeature() {
        FeatureVector base = new FeatureVector(0.5, 0, 0, 0, 0.5);
        double baseScore = scorer.score(base);

        assertTrue(scorer.score(new FeatureVector(0.6, 0, 0, 0, 0.5)) > baseScore);
        assertTrue(scorer.score(new FeatureVector(0.5, 1, 0, 0, 0.5)) > baseScore);
        assertTrue(scorer.score(new FeatureVector(0.5, 0, 1, 0, 0.5)) > baseScore);
        assertTrue(scorer.score(new FeatureVector(0.5, 0, 0, 1, 0.5)) > baseScore);
        assertTrue(scorer.score(new FeatureVector(0.5, 0, 0, 0, 0.7)) > baseScore);
    }

    @Test
    void customWeights() {
        MatchScorer nameOnly = new MatchScorer(new ScoringWeights(1.0, 0, 0, 0, 0));

        assertEquals(0.42, nameOnly.score(new FeatureVector(0.42, 1, 1, 1, 1.0)), 0.0001);
        assertEquals(1.0, nameOnly.getWeights().nameWeight());
    }
}
