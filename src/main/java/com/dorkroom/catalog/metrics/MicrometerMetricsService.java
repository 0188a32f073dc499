package com.dorkroom.catalog.metrics;

import com.dorkroom.catalog.core.model.RecordKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.search.duration}: Timer (tags: kind, type)</li>
 *   <li>{@code catalog.search.results}: DistributionSummary (tags: kind, type)</li>
 *   <li>{@code catalog.similarity.score}: DistributionSummary of retained fuzzy scores</li>
 *   <li>{@code catalog.load}: Counter of completed loads</li>
 *   <li>{@code catalog.records}: DistributionSummary of loaded collection sizes (tag: kind)</li>
 *   <li>{@code catalog.record.created}: Counter (tag: kind)</li>
 *   <li>{@code catalog.record.duplicate}: Counter of rejected duplicates (tag: kind)</li>
 *   <li>{@code catalog.cache.hit} and {@code catalog.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final Counter loadCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("catalog.similarity.score")
                .description("Distribution of retained fuzzy search scores")
                .register(registry);
        this.loadCounter = Counter.builder("catalog.load")
                .description("Number of completed catalog loads")
                .register(registry);
        this.cacheHitCounter = Counter.builder("catalog.cache.hit")
                .description("Number of search-text cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.cache.miss")
                .description("Number of search-text cache misses")
                .register(registry);
    }

    @Override
    public void recordSearchDuration(RecordKind kind, SearchType type, Duration duration) {
        String key = kind.name() + ":" + type.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("catalog.search.duration")
                        .description("Duration of catalog searches")
                        .tag("kind", kind.name())
                        .tag("type", type.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordResultCount(RecordKind kind, SearchType type, int count) {
        String key = "results:" + kind.name() + ":" + type.name();
        DistributionSummary summary = summaryCache.computeIfAbsent(key, k ->
                DistributionSummary.builder("catalog.search.results")
                        .description("Number of records returned by a search")
                        .tag("kind", kind.name())
                        .tag("type", type.name())
                        .register(registry));
        summary.record(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordCatalogLoad(int films, int developers, int combinations) {
        loadCounter.increment();
        recordsSummary(RecordKind.FILM).record(films);
        recordsSummary(RecordKind.DEVELOPER).record(developers);
        recordsSummary(RecordKind.COMBINATION).record(combinations);
    }

    @Override
    public void incrementRecordCreated(RecordKind kind) {
        counter("catalog.record.created", "Number of records added after load", kind).increment();
    }

    @Override
    public void incrementDuplicateRejected(RecordKind kind) {
        counter("catalog.record.duplicate", "Number of records rejected as duplicates", kind).increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String description, RecordKind kind) {
        String key = name + ":" + kind.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("kind", kind.name())
                        .register(registry));
    }

    private DistributionSummary recordsSummary(RecordKind kind) {
        String key = "records:" + kind.name();
        return summaryCache.computeIfAbsent(key, k ->
                DistributionSummary.builder("catalog.records")
                        .description("Number of records per collection at load")
                        .tag("kind", kind.name())
                        .register(registry));
    }
}
