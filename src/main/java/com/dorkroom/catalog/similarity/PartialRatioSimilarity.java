package com.dorkroom.catalog.similarity;

/**
 * Best-substring similarity, the "substring ratio" signal.
 * Slides the shorter string across the longer one and returns the best
 * {@link IndelSimilarity} score of any equally long window. Windows hanging over
 * either end are clipped, so a short query that matches the start or end of the
 * longer text still scores well.
 */
class PartialRatioSimilarity {

    private final IndelSimilarity indel;

    PartialRatioSimilarity(IndelSimilarity indel) {
        this.indel = indel;
    }

    double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.isEmpty() && s2.isEmpty()) {
            return 100.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        String shorter = s1.length() <= s2.length() ? s1 : s2;
        String longer = shorter == s1 ? s2 : s1;
        if (longer.contains(shorter)) {
            return 100.0;
        }

        int window = shorter.length();
        double best = 0.0;
        for (int start = 1 - window; start < longer.length(); start++) {
            int from = Math.max(0, start);
            int to = Math.min(longer.length(), start + window);
            double score = indel.compute(shorter, longer.substring(from, to));
            if (score > best) {
                best = score;
                if (best >= 100.0) {
                    break;
                }
            }
        }
        return best;
    }
}
