package com.dorkroom.catalog.metrics;

import com.dorkroom.catalog.core.model.RecordKind;

import java.time.Duration;

/**
 * Interface for recording catalog metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without any
 * metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordSearchDuration(RecordKind kind, SearchType type, Duration duration);

    void recordResultCount(RecordKind kind, SearchType type, int count);

    void recordSimilarityScore(double score);

    void recordCatalogLoad(int films, int developers, int combinations);

    void incrementRecordCreated(RecordKind kind);

    void incrementDuplicateRejected(RecordKind kind);

    void recordCacheHit();

    void recordCacheMiss();
}
