package com.dorkroom.catalog.search;

import com.dorkroom.catalog.cache.NoOpSearchTextCache;
import com.dorkroom.catalog.cache.SearchTextCache;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.index.CatalogSnapshot;
import com.dorkroom.catalog.similarity.SearchText;

import java.util.Optional;
import java.util.StringJoiner;

/**
 * Builds the primary/secondary text each record kind is fuzzy-matched on.
 *
 * <ul>
 *   <li>Film: primary {@code brand name}; secondary {@code iso colorType description}</li>
 *   <li>Developer: primary {@code name manufacturer}; secondary {@code type filmOrPaper notes}</li>
 *   <li>Combination: primary {@code name}; secondary the referenced film's {@code brand name}
 *       and the developer's {@code name}, where they resolve</li>
 * </ul>
 */
public class SearchTextFactory {

    private final SearchTextCache cache;

    public SearchTextFactory() {
        this(new NoOpSearchTextCache());
    }

    public SearchTextFactory(SearchTextCache cache) {
        this.cache = cache;
    }

    public SearchText forFilm(CatalogSnapshot snapshot, Film film) {
        return cache.get(snapshot.generation(), RecordKind.FILM, film.getId(), () -> {
            StringJoiner secondary = new StringJoiner(" ");
            secondary.add(formatNumber(film.getIsoSpeed()));
            secondary.add(film.getColorType().getValue());
            film.getDescription().ifPresent(secondary::add);
            return new SearchText(film.getBrand() + " " + film.getName(), secondary.toString());
        });
    }

    public SearchText forDeveloper(CatalogSnapshot snapshot, Developer developer) {
        return cache.get(snapshot.generation(), RecordKind.DEVELOPER, developer.getId(), () -> {
            StringJoiner secondary = new StringJoiner(" ");
            secondary.add(developer.getType());
            secondary.add(developer.getFilmOrPaper().getValue());
            developer.getNotes().ifPresent(secondary::add);
            return new SearchText(developer.getName() + " " + developer.getManufacturer(), secondary.toString());
        });
    }

    public SearchText forCombination(CatalogSnapshot snapshot, Combination combination) {
        return cache.get(snapshot.generation(), RecordKind.COMBINATION, combination.getId(), () -> {
            StringJoiner secondary = new StringJoiner(" ");
            Optional<Film> film = snapshot.getFilm(combination.getFilmStockId());
            film.ifPresent(f -> secondary.add(f.getBrand() + " " + f.getName()));
            Optional<Developer> developer = snapshot.getDeveloper(combination.getDeveloperId());
            developer.ifPresent(d -> secondary.add(d.getName()));
            return new SearchText(combination.getName(), secondary.toString());
        });
    }

    /**
     * Formats whole numbers without a fractional part (400 rather than 400.0).
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
