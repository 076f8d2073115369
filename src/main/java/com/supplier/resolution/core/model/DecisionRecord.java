package com.supplier.resolution.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-input-row result: match outcome, score, features and quality flags.
 *
 * @param inputKey      row key of the input record (may be null for malformed rows)
 * @param inputName     name of the input record as given
 * @param candidateKey  key of the best reference candidate, or null when none was selected
 * @param candidateName name of the best reference candidate, or null
 * @param features      feature vector of the input/candidate pair
 * @param matchScore    weighted score in [0, 1]
 * @param decision      classification of the pair
 * @param flags         quality flags, possibly empty
 * @param notes         short audit trail explaining the decision
 */
public record DecisionRecord(
        String inputKey,
        String inputName,
        String candidateKey,
        String candidateName,
        FeatureVector features,
        double matchScore,
        Decision decision,
        Set<QualityFlag> flags,
        String notes
) {
    public DecisionRecord {
        Objects.requireNonNull(features, "features is required");
        Objects.requireNonNull(decision, "decision is required");
        if (matchScore < 0.0 || matchScore > 1.0) {
            throw new IllegalArgumentException("matchScore must be between 0.0 and 1.0");
        }
        flags = copyFlags(flags);
        notes = notes != null ? notes : "";
    }

    /**
     * Returns true when no quality flag was raised.
     */
    public boolean isClean() {
        return flags.isEmpty();
    }

    public boolean hasCandidate() {
        return candidateKey != null;
    }

    /**
     * Flag codes joined with ", ", or the empty string for a clean record.
     */
    public String flagCodes() {
        return flags.stream().map(QualityFlag::code).collect(Collectors.joining(", "));
    }

    private static Set<QualityFlag> copyFlags(Collection<QualityFlag> flags) {
        if (flags == null || flags.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(QualityFlag.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }
}
