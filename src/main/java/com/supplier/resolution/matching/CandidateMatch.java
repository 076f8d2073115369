package com.supplier.resolution.matching;

import com.supplier.resolution.core.model.EntityRecord;

import java.util.Objects;

/**
 * Best reference candidate selected for an input record.
 *
 * @param candidate      the selected reference record
 * @param position       the candidate's position in the reference set
 * @param nameSimilarity name similarity between the input and the candidate
 */
public record CandidateMatch(EntityRecord candidate, int position, double nameSimilarity) {
    public CandidateMatch {
        Objects.requireNonNull(candidate, "candidate is required");
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative");
        }
    }
}
