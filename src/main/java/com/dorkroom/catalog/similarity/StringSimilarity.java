package com.dorkroom.catalog.similarity;

/**
 * The string-similarity capability used by fuzzy search.
 * Every ratio is on a 0-100 scale.
 *
 * <p>{@link RatioStringSimilarity} is the standard implementation. When no capability is
 * configured the catalog uses {@link UnavailableStringSimilarity}, and fuzzy search falls
 * back to returning records unscored.</p>
 */
public interface StringSimilarity {

    /**
     * Word-order-insensitive ratio: tokens sorted before comparing.
     */
    double orderInsensitiveRatio(String s1, String s2);

    /**
     * Best alignment of the shorter string inside the longer.
     */
    double substringRatio(String s1, String s2);

    /**
     * Plain edit-distance ratio of the whole strings.
     */
    double rawRatio(String s1, String s2);

    /**
     * Token-set ratio: deduplicated tokens, tolerant of extra words.
     */
    double setRatio(String s1, String s2);

    /**
     * Returns false when this capability cannot score, in which case callers degrade
     * to unscored results.
     */
    default boolean isAvailable() {
        return true;
    }
}
