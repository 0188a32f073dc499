package com.dorkroom.catalog.cache;

import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.index.ReloadListener;
import com.dorkroom.catalog.metrics.MetricsService;
import com.dorkroom.catalog.metrics.NoOpMetricsService;
import com.dorkroom.catalog.similarity.SearchText;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Caffeine-backed, size-bounded search-text cache.
 * Implements {@link ReloadListener} so every new snapshot clears it.
 */
public class CaffeineSearchTextCache implements SearchTextCache, ReloadListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSearchTextCache.class);

    private final Cache<CacheKey, SearchText> cache;
    private final MetricsService metricsService;

    public CaffeineSearchTextCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineSearchTextCache(CacheConfig config, MetricsService metricsService) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .build();
        this.metricsService = metricsService;
        log.info("CaffeineSearchTextCache initialized: maxSize={}", config.maxSize());
    }

    @Override
    public SearchText get(long generation, RecordKind kind, String recordId, Supplier<SearchText> loader) {
        CacheKey key = new CacheKey(generation, kind, recordId);
        SearchText cached = cache.getIfPresent(key);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        SearchText text = loader.get();
        cache.put(key, text);
        return text;
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all search-text cache entries");
    }

    @Override
    public void onReload(long generation) {
        invalidateAll();
        log.debug("Search-text cache cleared for generation {}", generation);
    }

    /**
     * Cache key combining snapshot generation, record kind and id.
     */
    record CacheKey(long generation, RecordKind kind, String recordId) {}
}
