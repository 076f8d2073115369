package com.supplier.resolution.similarity;

/**
 * Interface for name similarity computation.
 * All implementations should return a score between 0.0 (no similarity) and 1.0 (identical),
 * and must be symmetric: {@code compute(a, b) == compute(b, a)}.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns an upper bound on {@link #compute} that only depends on the input lengths
     * after normalization. Used to skip candidates that cannot beat the current best.
     * The default bound is 1.0, which never skips anything.
     */
    default double upperBound(String s1, String s2) {
        return 1.0;
    }

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
