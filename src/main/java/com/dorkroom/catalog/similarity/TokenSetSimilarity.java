package com.dorkroom.catalog.similarity;

import java.util.TreeSet;

/**
 * Set-based similarity, the "set ratio" signal, tolerant of extra words.
 *
 * <p>Tokens are deduplicated and split into the shared intersection and the two
 * differences. If one string's tokens are a subset of the other's the score is 100;
 * otherwise it is the best {@link IndelSimilarity} score among
 * (intersection vs intersection+diff1), (intersection vs intersection+diff2) and
 * (intersection+diff1 vs intersection+diff2), each side sorted.</p>
 */
class TokenSetSimilarity {

    private final IndelSimilarity indel;

    TokenSetSimilarity(IndelSimilarity indel) {
        this.indel = indel;
    }

    double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }

        TreeSet<String> tokens1 = new TreeSet<>(Tokenizer.tokenize(s1));
        TreeSet<String> tokens2 = new TreeSet<>(Tokenizer.tokenize(s2));

        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        TreeSet<String> diff1 = new TreeSet<>(tokens1);
        diff1.removeAll(tokens2);
        TreeSet<String> diff2 = new TreeSet<>(tokens2);
        diff2.removeAll(tokens1);

        if (!intersection.isEmpty() && (diff1.isEmpty() || diff2.isEmpty())) {
            return 100.0;
        }

        String sect = String.join(" ", intersection);
        String combined1 = join(sect, String.join(" ", diff1));
        String combined2 = join(sect, String.join(" ", diff2));

        double best = indel.compute(combined1, combined2);
        if (!sect.isEmpty()) {
            best = Math.max(best, indel.compute(sect, combined1));
            best = Math.max(best, indel.compute(sect, combined2));
        }
        return best;
    }

    private static String join(String sect, String diff) {
        if (sect.isEmpty()) {
            return diff;
        }
        return diff.isEmpty() ? sect : sect + " " + diff;
    }
}
