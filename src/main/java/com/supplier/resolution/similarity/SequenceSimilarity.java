package com.supplier.resolution.similarity;

import com.supplier.resolution.core.model.EntityRecord;

/**
 * Longest-common-subsequence similarity over trimmed, lower-cased strings.
 * Computes similarity as 2 * lcs / (len1 + len2).
 *
 * <p>Identical non-empty strings score 1.0. An empty side scores 0.0.</p>
 */
public class SequenceSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = EntityRecord.normalize(s1);
        String b = EntityRecord.normalize(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }

        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / (a.length() + b.length());
    }

    @Override
    public double upperBound(String s1, String s2) {
        int len1 = EntityRecord.normalize(s1).length();
        int len2 = EntityRecord.normalize(s2).length();
        if (len1 == 0 || len2 == 0) {
            return 0.0;
        }
        return (2.0 * Math.min(len1, len2)) / (len1 + len2);
    }

    @Override
    public String getName() {
        return "LongestCommonSubsequence";
    }

    /**
     * Classic dynamic programme with two rolling rows, O(min(m,n)) space.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        // Ensure s1 is the shorter string for space optimization
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            char c = s2.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == c) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
