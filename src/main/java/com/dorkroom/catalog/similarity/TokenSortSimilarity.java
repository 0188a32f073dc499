package com.dorkroom.catalog.similarity;

import java.util.Collections;
import java.util.List;

/**
 * Word-order-insensitive similarity, the "order-insensitive ratio" signal.
 * Both strings are tokenized, the tokens sorted and re-joined, and the results
 * compared with {@link IndelSimilarity}.
 */
class TokenSortSimilarity {

    private final IndelSimilarity indel;

    TokenSortSimilarity(IndelSimilarity indel) {
        this.indel = indel;
    }

    double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return indel.compute(sortedTokens(s1), sortedTokens(s2));
    }

    private String sortedTokens(String s) {
        List<String> tokens = Tokenizer.tokenize(s);
        Collections.sort(tokens);
        return String.join(" ", tokens);
    }
}
