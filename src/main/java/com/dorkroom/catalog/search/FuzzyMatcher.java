package com.dorkroom.catalog.search;

import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.core.model.SearchResult;
import com.dorkroom.catalog.metrics.MetricsService;
import com.dorkroom.catalog.metrics.NoOpMetricsService;
import com.dorkroom.catalog.similarity.CompositeSimilarityScorer;
import com.dorkroom.catalog.similarity.ScoringPolicy;
import com.dorkroom.catalog.similarity.SearchText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Ranks records by composite fuzzy score.
 *
 * <p>Every record is scored under the given {@link ScoringPolicy}; records the policy rejects
 * are dropped, the rest are sorted by descending score (ties keep catalog order) and cut to
 * {@code limit}. If the similarity capability is unavailable the first {@code limit} records
 * are returned unscored.</p>
 */
public class FuzzyMatcher {
    private static final Logger log = LoggerFactory.getLogger(FuzzyMatcher.class);

    private final CompositeSimilarityScorer scorer;
    private final MetricsService metricsService;
    private final AtomicBoolean degradedWarningLogged = new AtomicBoolean(false);

    public FuzzyMatcher(CompositeSimilarityScorer scorer) {
        this(scorer, new NoOpMetricsService());
    }

    public FuzzyMatcher(CompositeSimilarityScorer scorer, MetricsService metricsService) {
        this.scorer = scorer;
        this.metricsService = metricsService;
    }

    /**
     * Scores and ranks the items.
     *
     * @param items         candidates in catalog order
     * @param textExtractor builds the text each item is matched on
     * @param kind          collection the items belong to
     * @param query         free-text query
     * @param limit         maximum number of results; zero or less yields none
     * @param policy        scoring policy
     */
    public <T> List<SearchResult<T>> search(List<T> items, Function<T, SearchText> textExtractor,
                                            RecordKind kind, String query, int limit,
                                            ScoringPolicy policy) {
        if (limit <= 0 || items.isEmpty()) {
            return List.of();
        }

        if (!scorer.isAvailable()) {
            if (degradedWarningLogged.compareAndSet(false, true)) {
                log.warn("fuzzy.degraded similarity capability unavailable; returning unscored results");
            }
            List<SearchResult<T>> unscored = new ArrayList<>();
            for (T item : items.subList(0, Math.min(limit, items.size()))) {
                unscored.add(new SearchResult<>(item, 0.0, kind));
            }
            return unscored;
        }

        List<SearchResult<T>> scored = new ArrayList<>();
        for (T item : items) {
            double score = scorer.score(query, textExtractor.apply(item), policy);
            if (policy.accepts(score)) {
                scored.add(new SearchResult<>(item, score, kind));
            }
        }

        // ranked on the whole percentage shown to users; List.sort is stable, so records
        // with the same percentage keep catalog order
        scored.sort(Comparator.comparingInt((SearchResult<T> r) -> r.percent()).reversed());
        List<SearchResult<T>> results = scored.size() > limit
                ? List.copyOf(scored.subList(0, limit))
                : List.copyOf(scored);

        for (SearchResult<T> result : results) {
            metricsService.recordSimilarityScore(result.score());
        }
        log.debug("fuzzy.search kind={} query='{}' matched={} returned={}",
                kind, query, scored.size(), results.size());
        return results;
    }
}
