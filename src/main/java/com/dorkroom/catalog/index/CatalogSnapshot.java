package com.dorkroom.catalog.index;

import com.dorkroom.catalog.core.exception.DuplicateRecordException;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One immutable, fully indexed version of the catalog.
 *
 * <p>The three lists own the records in catalog order; the id maps point into them.
 * Every load or append produces a new snapshot with a higher generation, so a reader holding
 * a snapshot always sees one consistent version.</p>
 */
public final class CatalogSnapshot {

    private final long generation;
    private final List<Film> films;
    private final List<Developer> developers;
    private final List<Combination> combinations;
    private final Map<String, Film> filmIndex;
    private final Map<String, Developer> developerIndex;
    private final Map<String, Combination> combinationIndex;

    private CatalogSnapshot(long generation, List<Film> films, List<Developer> developers,
                            List<Combination> combinations) {
        this.generation = generation;
        this.films = List.copyOf(films);
        this.developers = List.copyOf(developers);
        this.combinations = List.copyOf(combinations);
        this.filmIndex = indexFilms(this.films);
        this.developerIndex = indexDevelopers(this.developers);
        this.combinationIndex = indexCombinations(this.combinations);
    }

    /**
     * Builds a snapshot, rejecting duplicate ids and duplicate (brand, name) or
     * (manufacturer, name) pairs.
     *
     * @throws DuplicateRecordException if a uniqueness rule is violated
     */
    static CatalogSnapshot of(long generation, List<Film> films, List<Developer> developers,
                              List<Combination> combinations) {
        return new CatalogSnapshot(generation, films, developers, combinations);
    }

    public long generation() {
        return generation;
    }

    public List<Film> films() {
        return films;
    }

    public List<Developer> developers() {
        return developers;
    }

    public List<Combination> combinations() {
        return combinations;
    }

    public Optional<Film> getFilm(String id) {
        return Optional.ofNullable(id == null ? null : filmIndex.get(id));
    }

    public Optional<Developer> getDeveloper(String id) {
        return Optional.ofNullable(id == null ? null : developerIndex.get(id));
    }

    public Optional<Combination> getCombination(String id) {
        return Optional.ofNullable(id == null ? null : combinationIndex.get(id));
    }

    /**
     * Returns a new snapshot with the film appended.
     */
    CatalogSnapshot withFilm(Film film) {
        List<Film> next = new ArrayList<>(films);
        next.add(film);
        return new CatalogSnapshot(generation + 1, next, developers, combinations);
    }

    /**
     * Returns a new snapshot with the developer appended.
     */
    CatalogSnapshot withDeveloper(Developer developer) {
        List<Developer> next = new ArrayList<>(developers);
        next.add(developer);
        return new CatalogSnapshot(generation + 1, films, next, combinations);
    }

    /**
     * Returns a new snapshot with the combination appended.
     */
    CatalogSnapshot withCombination(Combination combination) {
        List<Combination> next = new ArrayList<>(combinations);
        next.add(combination);
        return new CatalogSnapshot(generation + 1, films, developers, next);
    }

    /**
     * Counts combinations whose film or developer id does not resolve.
     */
    int countDanglingReferences() {
        int dangling = 0;
        for (Combination combination : combinations) {
            if (!filmIndex.containsKey(combination.getFilmStockId())
                    || !developerIndex.containsKey(combination.getDeveloperId())) {
                dangling++;
            }
        }
        return dangling;
    }

    private static Map<String, Film> indexFilms(List<Film> films) {
        Map<String, Film> index = new LinkedHashMap<>();
        Set<String> naturalKeys = new HashSet<>();
        for (Film film : films) {
            if (index.putIfAbsent(film.getId(), film) != null) {
                throw new DuplicateRecordException(RecordKind.FILM, "Duplicate film id: " + film.getId());
            }
            if (!naturalKeys.add(naturalKey(film.getBrand(), film.getName()))) {
                throw new DuplicateRecordException(RecordKind.FILM,
                        "Duplicate film brand/name: " + film.getDisplayName());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, Developer> indexDevelopers(List<Developer> developers) {
        Map<String, Developer> index = new LinkedHashMap<>();
        Set<String> naturalKeys = new HashSet<>();
        for (Developer developer : developers) {
            if (index.putIfAbsent(developer.getId(), developer) != null) {
                throw new DuplicateRecordException(RecordKind.DEVELOPER,
                        "Duplicate developer id: " + developer.getId());
            }
            if (!naturalKeys.add(naturalKey(developer.getManufacturer(), developer.getName()))) {
                throw new DuplicateRecordException(RecordKind.DEVELOPER,
                        "Duplicate developer manufacturer/name: " + developer.getManufacturer()
                                + " " + developer.getName());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, Combination> indexCombinations(List<Combination> combinations) {
        Map<String, Combination> index = new HashMap<>();
        for (Combination combination : combinations) {
            if (index.putIfAbsent(combination.getId(), combination) != null) {
                throw new DuplicateRecordException(RecordKind.COMBINATION,
                        "Duplicate combination id: " + combination.getId());
            }
        }
        return Collections.unmodifiableMap(index);
    }

    /**
     * Case-insensitive (owner, name) key used for the natural-key uniqueness rules.
     */
    static String naturalKey(String owner, String name) {
        return owner.toLowerCase(Locale.ROOT) + '\u0000' + name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CatalogSnapshot{" +
                "generation=" + generation +
                ", films=" + films.size() +
                ", developers=" + developers.size() +
                ", combinations=" + combinations.size() +
                '}';
    }
}
