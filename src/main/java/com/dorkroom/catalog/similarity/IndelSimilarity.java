package com.dorkroom.catalog.similarity;

/**
 * Normalized indel similarity, the "raw ratio" signal.
 * Computes {@code 100 * (1 - indelDistance / (len1 + len2))}, where the indel distance
 * counts insertions and deletions only (a substitution costs 2).
 */
class IndelSimilarity {

    double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 100.0;
        }
        if (s1.equals(s2)) {
            return 100.0;
        }

        int distance = indelDistance(s1, s2);
        return 100.0 * (1.0 - (double) distance / total);
    }

    /**
     * Computes the insert/delete edit distance between two strings.
     * Uses Wagner-Fischer with O(min(m,n)) space.
     */
    int indelDistance(String s1, String s2) {
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

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;

            for (int i = 1; i <= m; i++) {
                int substitution = s1.charAt(i - 1) == s2.charAt(j - 1)
                        ? previousRow[i - 1]
                        : previousRow[i - 1] + 2;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        substitution
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
