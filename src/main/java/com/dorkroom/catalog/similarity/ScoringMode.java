package com.dorkroom.catalog.similarity;

/**
 * How many similarity signals a {@link ScoringPolicy} combines.
 */
public enum ScoringMode {
    /**
     * Weighted sum of four primary-text signals and one secondary-text signal, plus bonuses.
     */
    FIVE_SIGNAL,
    /**
     * Order-insensitive ratio, replaced by a discounted substring ratio on strong substring hits.
     */
    TWO_SIGNAL
}
