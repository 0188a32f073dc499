package com.dorkroom.catalog.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits text into lower-cased word tokens for the token-based signals.
 * Everything that is not a letter or digit separates tokens.
 */
final class Tokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private Tokenizer() {
        // utility class
    }

    static List<String> tokenize(String s) {
        List<String> tokens = new ArrayList<>();
        if (s == null) {
            return tokens;
        }
        for (String token : SEPARATOR.split(s.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
