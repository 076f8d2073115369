package com.supplier.resolution.scoring;

import com.supplier.resolution.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Combines a feature vector into a single match score.
 * Formula: score = wName*name + wCountry*country + wCity*city + wFresh*freshness + wWeb*website,
 * clamped to [0, 1].
 */
public class MatchScorer {
    private static final Logger log = LoggerFactory.getLogger(MatchScorer.class);

    private final ScoringWeights weights;

    public MatchScorer() {
        this(ScoringWeights.defaultWeights());
    }

    public MatchScorer(ScoringWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public double score(FeatureVector features) {
        double raw = weights.nameWeight() * features.nameSimilarity()
                + weights.countryWeight() * features.countryMatch()
                + weights.cityWeight() * features.cityMatch()
                + weights.freshnessWeight() * features.freshness()
                + weights.websiteWeight() * features.websitePresent();

        double score = Math.max(0.0, Math.min(1.0, raw));
        log.trace("Match score: features={} raw={} score={}", features, raw, score);
        return score;
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
