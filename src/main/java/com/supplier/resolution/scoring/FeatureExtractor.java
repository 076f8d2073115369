package com.supplier.resolution.scoring;

import com.supplier.resolution.core.model.EntityRecord;
import com.supplier.resolution.core.model.FeatureVector;
import com.supplier.resolution.similarity.SequenceSimilarity;
import com.supplier.resolution.similarity.SimilarityAlgorithm;

import java.time.Instant;
import java.util.Objects;

/**
 * Computes the feature vector of an input record paired with a reference candidate.
 * Stateless apart from its configuration; safe to share between threads.
 */
public class FeatureExtractor {

    private final SimilarityAlgorithm nameSimilarity;
    private final FreshnessCurve freshnessCurve;
    private final Instant now;

    public FeatureExtractor(Instant now) {
        this(new SequenceSimilarity(), FreshnessCurve.TIERED, now);
    }

    public FeatureExtractor(SimilarityAlgorithm nameSimilarity, FreshnessCurve freshnessCurve, Instant now) {
        this.nameSimilarity = Objects.requireNonNull(nameSimilarity, "nameSimilarity is required");
        this.freshnessCurve = Objects.requireNonNull(freshnessCurve, "freshnessCurve is required");
        this.now = Objects.requireNonNull(now, "now is required");
    }

    /**
     * Builds the full feature vector for the pair.
     */
    public FeatureVector extract(EntityRecord input, EntityRecord candidate) {
        return new FeatureVector(
                nameSimilarity(input.getName(), candidate.getName()),
                fieldMatch(input.getCountry(), candidate.getCountry()),
                fieldMatch(input.getCity(), candidate.getCity()),
                candidate.hasWebsite() ? 1 : 0,
                freshnessCurve.score(candidate.getLastUpdatedAt(), now)
        );
    }

    /**
     * Name similarity routine shared with candidate selection.
     */
    public double nameSimilarity(String inputName, String candidateName) {
        return nameSimilarity.compute(inputName, candidateName);
    }

    public SimilarityAlgorithm getSimilarityAlgorithm() {
        return nameSimilarity;
    }

    /**
     * 1 when both values are present and equal after trimming and case folding.
     */
    static int fieldMatch(String left, String right) {
        String a = EntityRecord.normalize(left);
        String b = EntityRecord.normalize(right);
        return !a.isEmpty() && a.equals(b) ? 1 : 0;
    }
}
