package com.dorkroom.catalog.api;

import com.dorkroom.catalog.cache.CaffeineSearchTextCache;
import com.dorkroom.catalog.cache.NoOpSearchTextCache;
import com.dorkroom.catalog.cache.SearchTextCache;
import com.dorkroom.catalog.core.exception.DuplicateRecordException;
import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.core.model.SearchResult;
import com.dorkroom.catalog.exposure.ExposureCalculator;
import com.dorkroom.catalog.index.CatalogIndex;
import com.dorkroom.catalog.index.CatalogSnapshot;
import com.dorkroom.catalog.index.ReloadListener;
import com.dorkroom.catalog.io.CatalogData;
import com.dorkroom.catalog.io.CatalogJsonReader;
import com.dorkroom.catalog.logging.LogContext;
import com.dorkroom.catalog.metrics.MetricsService;
import com.dorkroom.catalog.metrics.NoOpMetricsService;
import com.dorkroom.catalog.metrics.SearchType;
import com.dorkroom.catalog.resolve.CombinationNamer;
import com.dorkroom.catalog.resolve.DeveloperResolution;
import com.dorkroom.catalog.resolve.DuplicateDetector;
import com.dorkroom.catalog.resolve.EntityResolver;
import com.dorkroom.catalog.resolve.FreeTextParser;
import com.dorkroom.catalog.search.CatalogSearchResults;
import com.dorkroom.catalog.search.ExactMatcher;
import com.dorkroom.catalog.search.FuzzyMatcher;
import com.dorkroom.catalog.search.SearchTextFactory;
import com.dorkroom.catalog.similarity.CompositeSimilarityScorer;
import com.dorkroom.catalog.similarity.RatioStringSimilarity;
import com.dorkroom.catalog.similarity.ScoringPolicy;
import com.dorkroom.catalog.similarity.SearchText;
import com.dorkroom.catalog.similarity.StringSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Main entry point for the darkroom catalog library.
 * Holds the film, developer and combination collections and answers lookups,
 * exact and fuzzy searches, reference resolution and push/pull questions over them.
 *
 * <h2>Key Design Principles</h2>
 * <ul>
 *   <li>Every query works on one immutable snapshot, so a concurrent {@link #load} is never
 *       half-visible</li>
 *   <li>New records go through {@link #addCombination} and friends, which validate references
 *       and uniqueness before anything changes</li>
 *   <li>Resolution of typed identifiers is exact; fuzzy search is for offering candidates</li>
 * </ul>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * DarkroomCatalog catalog = DarkroomCatalog.builder().build();
 * catalog.load(films, developers, combinations);
 *
 * List&lt;SearchResult&lt;Film&gt;&gt; hits = catalog.fuzzySearchFilms("trix 400", 5);
 *
 * Optional&lt;String&gt; filmId = catalog.resolveFilm("Kodak", "Tri-X 400");
 * DeveloperResolution dev = catalog.resolveDeveloperAndDilution("Kodak", "D-76", "1+1");
 * int stops = catalog.computeStops(400, 1600); // 2
 * </pre>
 */
public class DarkroomCatalog {
    private static final Logger log = LoggerFactory.getLogger(DarkroomCatalog.class);

    private final CatalogOptions options;
    private final CatalogIndex index;
    private final MetricsService metricsService;
    private final SearchTextCache cache;
    private final SearchTextFactory searchTextFactory;
    private final ExactMatcher exactMatcher;
    private final FuzzyMatcher fuzzyMatcher;
    private final EntityResolver entityResolver;
    private final DuplicateDetector duplicateDetector;
    private final CatalogJsonReader jsonReader;

    private DarkroomCatalog(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.getCacheConfig().enabled()) {
            this.cache = new CaffeineSearchTextCache(options.getCacheConfig(), metricsService);
        } else {
            this.cache = new NoOpSearchTextCache();
        }

        this.index = new CatalogIndex();
        if (cache instanceof ReloadListener listener) {
            index.addReloadListener(listener);
        }

        StringSimilarity similarity = builder.stringSimilarity != null
                ? builder.stringSimilarity : new RatioStringSimilarity();
        this.searchTextFactory = new SearchTextFactory(cache);
        this.exactMatcher = new ExactMatcher();
        this.fuzzyMatcher = new FuzzyMatcher(new CompositeSimilarityScorer(similarity), metricsService);
        this.entityResolver = new EntityResolver();
        this.duplicateDetector = new DuplicateDetector();
        this.jsonReader = builder.jsonReader != null ? builder.jsonReader : new CatalogJsonReader();

        log.info("DarkroomCatalog initialized: similarityAvailable={} cache={}",
                similarity.isAvailable(), cache.getClass().getSimpleName());
    }

    // ========== Loading ==========

    /**
     * Replaces the whole catalog. On a uniqueness violation the previous catalog stays in place.
     *
     * @throws DuplicateRecordException if ids or natural keys repeat
     */
    public void load(List<Film> films, List<Developer> developers, List<Combination> combinations) {
        try (LogContext ignored = LogContext.forLoad(LogContext.generateCorrelationId())) {
            CatalogSnapshot snapshot = index.load(films, developers, combinations);
            metricsService.recordCatalogLoad(snapshot.films().size(), snapshot.developers().size(),
                    snapshot.combinations().size());
        }
    }

    public void loadFrom(CatalogData data) {
        load(data.films(), data.developers(), data.combinations());
    }

    /**
     * Reads the three JSON documents and loads them.
     *
     * @throws com.dorkroom.catalog.core.exception.CatalogParseException if a document is malformed
     */
    public void loadFrom(InputStream films, InputStream developers, InputStream combinations) {
        loadFrom(jsonReader.read(films, developers, combinations));
    }

    public boolean isLoaded() {
        return index.isLoaded();
    }

    /**
     * Generation of the current snapshot; grows with every load and append.
     */
    public long generation() {
        return index.snapshot().generation();
    }

    // ========== Lookups ==========

    public Optional<Film> getFilm(String id) {
        return index.getFilm(id);
    }

    public Optional<Developer> getDeveloper(String id) {
        return index.getDeveloper(id);
    }

    public Optional<Combination> getCombination(String id) {
        return index.getCombination(id);
    }

    // ========== Exact search ==========

    public List<Film> searchFilms(String query) {
        return searchFilms(query, null);
    }

    /**
     * Films whose name or brand contains the query, ignoring case.
     *
     * @param colorType restricts results to one color type, or null for all
     */
    public List<Film> searchFilms(String query, ColorType colorType) {
        CatalogSnapshot snapshot = index.snapshot();
        long start = System.nanoTime();
        List<Film> results = exactMatcher.searchFilms(snapshot, query, colorType);
        recordSearch(RecordKind.FILM, SearchType.EXACT, start, results.size());
        return results;
    }

    public List<Developer> searchDevelopers(String query) {
        CatalogSnapshot snapshot = index.snapshot();
        long start = System.nanoTime();
        List<Developer> results = exactMatcher.searchDevelopers(snapshot, query);
        recordSearch(RecordKind.DEVELOPER, SearchType.EXACT, start, results.size());
        return results;
    }

    public List<Combination> listCombinationsForFilm(String filmId) {
        return exactMatcher.listCombinationsForFilm(index.snapshot(), filmId);
    }

    public List<Combination> listCombinationsForDeveloper(String developerId) {
        return exactMatcher.listCombinationsForDeveloper(index.snapshot(), developerId);
    }

    // ========== Fuzzy search ==========

    public List<SearchResult<Film>> fuzzySearchFilms(String query) {
        return fuzzySearchFilms(query, options.getDefaultLimit());
    }

    public List<SearchResult<Film>> fuzzySearchFilms(String query, int limit) {
        return fuzzySearchFilms(query, limit, null);
    }

    /**
     * Fuzzy film search restricted to one color type before scoring.
     *
     * @param colorType required color type, or null for all films
     */
    public List<SearchResult<Film>> fuzzySearchFilms(String query, int limit, ColorType colorType) {
        CatalogSnapshot snapshot = index.snapshot();
        List<Film> candidates = colorType == null
                ? snapshot.films()
                : snapshot.films().stream().filter(f -> f.getColorType() == colorType).toList();
        return fuzzy(RecordKind.FILM, candidates, f -> searchTextFactory.forFilm(snapshot, f),
                query, limit, options.getFilmPolicy());
    }

    public List<SearchResult<Developer>> fuzzySearchDevelopers(String query) {
        return fuzzySearchDevelopers(query, options.getDefaultLimit());
    }

    public List<SearchResult<Developer>> fuzzySearchDevelopers(String query, int limit) {
        CatalogSnapshot snapshot = index.snapshot();
        return fuzzy(RecordKind.DEVELOPER, snapshot.developers(),
                d -> searchTextFactory.forDeveloper(snapshot, d),
                query, limit, options.getDeveloperPolicy());
    }

    public List<SearchResult<Combination>> fuzzySearchCombinations(String query) {
        return fuzzySearchCombinations(query, options.getDefaultLimit());
    }

    public List<SearchResult<Combination>> fuzzySearchCombinations(String query, int limit) {
        CatalogSnapshot snapshot = index.snapshot();
        return fuzzy(RecordKind.COMBINATION, snapshot.combinations(),
                c -> searchTextFactory.forCombination(snapshot, c),
                query, limit, options.getCombinationPolicy());
    }

    /**
     * Runs the three fuzzy searches against the same snapshot.
     */
    public CatalogSearchResults searchAll(String query, int limit) {
        CatalogSnapshot snapshot = index.snapshot();
        return new CatalogSearchResults(
                fuzzy(RecordKind.FILM, snapshot.films(),
                        f -> searchTextFactory.forFilm(snapshot, f), query, limit, options.getFilmPolicy()),
                fuzzy(RecordKind.DEVELOPER, snapshot.developers(),
                        d -> searchTextFactory.forDeveloper(snapshot, d), query, limit,
                        options.getDeveloperPolicy()),
                fuzzy(RecordKind.COMBINATION, snapshot.combinations(),
                        c -> searchTextFactory.forCombination(snapshot, c), query, limit,
                        options.getCombinationPolicy()));
    }

    /**
     * Fuzzy search over caller-supplied items with the generic policy from the options.
     * Does not need a loaded catalog.
     */
    public <T> List<SearchResult<T>> fuzzySearch(List<T> items, Function<T, SearchText> textExtractor,
                                                 RecordKind kind, String query, int limit) {
        return fuzzySearch(items, textExtractor, kind, query, limit, options.getGenericPolicy());
    }

    public <T> List<SearchResult<T>> fuzzySearch(List<T> items, Function<T, SearchText> textExtractor,
                                                 RecordKind kind, String query, int limit,
                                                 ScoringPolicy policy) {
        return fuzzy(kind, items, textExtractor, query, limit, policy);
    }

    // ========== Resolution ==========

    public Optional<String> resolveFilm(String brand, String name) {
        return entityResolver.resolveFilm(index.snapshot(), brand, name);
    }

    public DeveloperResolution resolveDeveloperAndDilution(String manufacturer, String name,
                                                           String dilutionLabel) {
        return entityResolver.resolveDeveloperAndDilution(index.snapshot(), manufacturer, name, dilutionLabel);
    }

    public int parsePushPull(String text) {
        return FreeTextParser.parsePushPull(text);
    }

    public int computeStops(double boxIso, double shootingIso) {
        return ExposureCalculator.computeStops(boxIso, shootingIso);
    }

    /**
     * Whether an equivalent record already exists.
     *
     * @param candidate a {@link Film}, {@link Developer} or {@link Combination} matching {@code kind}
     */
    public boolean isDuplicate(Object candidate, RecordKind kind) {
        return duplicateDetector.isDuplicate(candidate, kind, index.snapshot());
    }

    // ========== Creation ==========

    /**
     * Adds a film.
     *
     * @throws DuplicateRecordException if a film with the same brand and name, or the same id, exists
     */
    public Film addFilm(Film film) {
        Objects.requireNonNull(film, "film");
        try (LogContext ignored = LogContext.forCreate(LogContext.generateCorrelationId(),
                RecordKind.FILM.name(), film.getId())) {
            index.appendFilm(snapshot -> {
                if (duplicateDetector.isDuplicate(film, snapshot)) {
                    throw duplicate(RecordKind.FILM, "Film already exists: " + film.getDisplayName());
                }
                return film;
            });
            created(RecordKind.FILM, film.getId());
            return film;
        } catch (DuplicateRecordException e) {
            rejected(RecordKind.FILM, e);
            throw e;
        }
    }

    /**
     * Adds a developer.
     *
     * @throws DuplicateRecordException if a developer with the same manufacturer and name, or the same id, exists
     */
    public Developer addDeveloper(Developer developer) {
        Objects.requireNonNull(developer, "developer");
        try (LogContext ignored = LogContext.forCreate(LogContext.generateCorrelationId(),
                RecordKind.DEVELOPER.name(), developer.getId())) {
            index.appendDeveloper(snapshot -> {
                if (duplicateDetector.isDuplicate(developer, snapshot)) {
                    throw duplicate(RecordKind.DEVELOPER, "Developer already exists: "
                            + developer.getManufacturer() + " " + developer.getName());
                }
                return developer;
            });
            created(RecordKind.DEVELOPER, developer.getId());
            return developer;
        } catch (DuplicateRecordException e) {
            rejected(RecordKind.DEVELOPER, e);
            throw e;
        }
    }

    /**
     * Adds a combination after checking that its film, developer and dilution exist and that
     * no equivalent combination is present. A blank name is replaced by the generated one.
     *
     * @return the combination as stored
     * @throws com.dorkroom.catalog.core.exception.RecordNotFoundException if a reference does not resolve
     * @throws DuplicateRecordException if an equivalent combination, or the same id, exists
     */
    public Combination addCombination(Combination combination) {
        Objects.requireNonNull(combination, "combination");
        try (LogContext ignored = LogContext.forCreate(LogContext.generateCorrelationId(),
                RecordKind.COMBINATION.name(), combination.getId())) {
            CatalogSnapshot next = index.appendCombination(snapshot -> {
                entityResolver.requireResolvableReferences(combination, snapshot);
                if (duplicateDetector.isDuplicate(combination, snapshot)) {
                    throw duplicate(RecordKind.COMBINATION,
                            "Combination already exists for film " + combination.getFilmStockId()
                                    + " and developer " + combination.getDeveloperId());
                }
                if (combination.getName().isBlank()) {
                    return Combination.builder(combination)
                            .name(CombinationNamer.generateName(combination, snapshot))
                            .build();
                }
                return combination;
            });
            created(RecordKind.COMBINATION, combination.getId());
            return next.getCombination(combination.getId()).orElse(combination);
        } catch (DuplicateRecordException e) {
            rejected(RecordKind.COMBINATION, e);
            throw e;
        }
    }

    public CatalogOptions getOptions() {
        return options;
    }

    public SearchTextCache getCache() {
        return cache;
    }

    // ========== Internals ==========

    private <T> List<SearchResult<T>> fuzzy(RecordKind kind, List<T> items, Function<T, SearchText> text,
                                            String query, int limit, ScoringPolicy policy) {
        try (LogContext ignored = LogContext.forSearch(kind.name(), SearchType.FUZZY.name())) {
            long start = System.nanoTime();
            List<SearchResult<T>> results = fuzzyMatcher.search(items, text, kind, query, limit, policy);
            recordSearch(kind, SearchType.FUZZY, start, results.size());
            return results;
        }
    }

    private void recordSearch(RecordKind kind, SearchType type, long startNanos, int resultCount) {
        metricsService.recordSearchDuration(kind, type, Duration.ofNanos(System.nanoTime() - startNanos));
        metricsService.recordResultCount(kind, type, resultCount);
    }

    private void created(RecordKind kind, String id) {
        metricsService.incrementRecordCreated(kind);
        log.info("catalog.record.created kind={} id={}", kind, id);
    }

    private void rejected(RecordKind kind, DuplicateRecordException e) {
        metricsService.incrementDuplicateRejected(kind);
        log.info("catalog.record.duplicate kind={} reason='{}'", kind, e.getMessage());
    }

    private static DuplicateRecordException duplicate(RecordKind kind, String message) {
        return new DuplicateRecordException(kind, message);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogOptions options = CatalogOptions.defaults();
        private MetricsService metricsService;
        private StringSimilarity stringSimilarity;
        private SearchTextCache cache;
        private CatalogJsonReader jsonReader;

        public Builder options(CatalogOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Replaces the similarity capability used by fuzzy search.
         */
        public Builder stringSimilarity(StringSimilarity stringSimilarity) {
            this.stringSimilarity = stringSimilarity;
            return this;
        }

        /**
         * Uses the given search-text cache instead of one built from the options' cache config.
         */
        public Builder cache(SearchTextCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder jsonReader(CatalogJsonReader jsonReader) {
            this.jsonReader = jsonReader;
            return this;
        }

        public DarkroomCatalog build() {
            return new DarkroomCatalog(this);
        }
    }
}
