package com.dorkroom.catalog.core.model;

import java.util.Objects;

/**
 * A ranked search hit. Scores are on the 0-100 similarity scale plus any bonuses,
 * so they can exceed 100; unscored results (degraded mode) carry 0.
 *
 * @param record the matched record
 * @param score  composite score
 * @param kind   which collection the record belongs to
 */
public record SearchResult<T>(T record, double score, RecordKind kind) {

    public SearchResult {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(kind, "kind is required");
        if (score < 0.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be non-negative, got " + score);
        }
    }

    /**
     * Returns the score truncated to a whole percentage, as shown to users.
     */
    public int percent() {
        return (int) score;
    }
}
