package com.dorkroom.catalog.cache;

/**
 * Configuration for the search-text cache.
 *
 * @param maxSize maximum number of entries
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
