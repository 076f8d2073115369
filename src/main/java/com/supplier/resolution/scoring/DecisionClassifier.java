package com.supplier.resolution.scoring;

import com.supplier.resolution.core.model.Decision;

import java.util.Objects;

/**
 * Maps a (name similarity, match score) pair to a {@link Decision}.
 *
 * <ol>
 *   <li>name similarity below the floor: {@code UNMATCHED}, whatever the score</li>
 *   <li>score &gt;= strong: {@code MATCHED}</li>
 *   <li>score &gt;= review: {@code NEEDS_REVIEW}</li>
 *   <li>otherwise: {@code UNMATCHED}</li>
 * </ol>
 */
public class DecisionClassifier {

    private final DecisionThresholds thresholds;

    public DecisionClassifier() {
        this(DecisionThresholds.defaults());
    }

    public DecisionClassifier(DecisionThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
    }

    public Decision classify(double nameSimilarity, double matchScore) {
        if (nameSimilarity < thresholds.nameFloor()) {
            return Decision.UNMATCHED;
        }
        if (matchScore >= thresholds.strong()) {
            return Decision.MATCHED;
        }
        if (matchScore >= thresholds.review()) {
            return Decision.NEEDS_REVIEW;
        }
        return Decision.UNMATCHED;
    }

    /**
     * True when the name similarity alone rules out a match.
     */
    public boolean belowNameFloor(double nameSimilarity) {
        return nameSimilarity < thresholds.nameFloor();
    }

    public DecisionThresholds getThresholds() {
        return thresholds;
    }
}
