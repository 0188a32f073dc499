package com.dorkroom.catalog.metrics;

import com.dorkroom.catalog.core.model.RecordKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSearchDuration(RecordKind kind, SearchType type, Duration duration) {
    }

    @Override
    public void recordResultCount(RecordKind kind, SearchType type, int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCatalogLoad(int films, int developers, int combinations) {
    }

    @Override
    public void incrementRecordCreated(RecordKind kind) {
    }

    @Override
    public void incrementDuplicateRejected(RecordKind kind) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
