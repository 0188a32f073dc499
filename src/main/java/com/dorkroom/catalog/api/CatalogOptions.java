package com.dorkroom.catalog.api;

import com.dorkroom.catalog.cache.CacheConfig;
import com.dorkroom.catalog.similarity.ScoringPolicy;

import java.util.Objects;

/**
 * Options for a {@link DarkroomCatalog}: the scoring policy used for each fuzzy search,
 * the default result limit and the search-text cache configuration.
 */
public class CatalogOptions {

    private static final int DEFAULT_LIMIT = 10;

    private final ScoringPolicy filmPolicy;
    private final ScoringPolicy developerPolicy;
    private final ScoringPolicy combinationPolicy;
    private final ScoringPolicy genericPolicy;
    private final int defaultLimit;
    private final CacheConfig cacheConfig;

    private CatalogOptions(Builder builder) {
        this.filmPolicy = builder.filmPolicy;
        this.developerPolicy = builder.developerPolicy;
        this.combinationPolicy = builder.combinationPolicy;
        this.genericPolicy = builder.genericPolicy;
        this.defaultLimit = builder.defaultLimit;
        this.cacheConfig = builder.cacheConfig;
    }

    public ScoringPolicy getFilmPolicy() {
        return filmPolicy;
    }

    public ScoringPolicy getDeveloperPolicy() {
        return developerPolicy;
    }

    public ScoringPolicy getCombinationPolicy() {
        return combinationPolicy;
    }

    /**
     * Policy for {@link DarkroomCatalog#fuzzySearch}, the pluggable search over caller-supplied items.
     */
    public ScoringPolicy getGenericPolicy() {
        return genericPolicy;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Creates default options.
     */
    public static CatalogOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that score every search with the two-signal policy.
     */
    public static CatalogOptions twoSignal(double threshold) {
        ScoringPolicy policy = ScoringPolicy.twoSignal(threshold);
        return builder()
                .filmPolicy(policy)
                .developerPolicy(policy)
                .combinationPolicy(policy)
                .genericPolicy(policy)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringPolicy filmPolicy = ScoringPolicy.filmsAndDevelopers();
        private ScoringPolicy developerPolicy = ScoringPolicy.filmsAndDevelopers();
        private ScoringPolicy combinationPolicy = ScoringPolicy.combinations();
        private ScoringPolicy genericPolicy = ScoringPolicy.twoSignal();
        private int defaultLimit = DEFAULT_LIMIT;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder filmPolicy(ScoringPolicy filmPolicy) {
            this.filmPolicy = Objects.requireNonNull(filmPolicy, "filmPolicy");
            return this;
        }

        public Builder developerPolicy(ScoringPolicy developerPolicy) {
            this.developerPolicy = Objects.requireNonNull(developerPolicy, "developerPolicy");
            return this;
        }

        public Builder combinationPolicy(ScoringPolicy combinationPolicy) {
            this.combinationPolicy = Objects.requireNonNull(combinationPolicy, "combinationPolicy");
            return this;
        }

        public Builder genericPolicy(ScoringPolicy genericPolicy) {
            this.genericPolicy = Objects.requireNonNull(genericPolicy, "genericPolicy");
            return this;
        }

        public Builder defaultLimit(int defaultLimit) {
            if (defaultLimit < 0) {
                throw new IllegalArgumentException("defaultLimit must be non-negative");
            }
            this.defaultLimit = defaultLimit;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
            return this;
        }

        public CatalogOptions build() {
            return new CatalogOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CatalogOptions{" +
                "filmPolicy=" + filmPolicy +
                ", developerPolicy=" + developerPolicy +
                ", combinationPolicy=" + combinationPolicy +
                ", genericPolicy=" + genericPolicy +
                ", defaultLimit=" + defaultLimit +
                ", cacheConfig=" + cacheConfig +
                '}';
    }
}
