package com.dorkroom.catalog.search;

import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.index.CatalogSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring search. Results keep catalog order.
 */
public class ExactMatcher {

    /**
     * Films whose name or brand contains the query, optionally limited to one color type.
     *
     * @param colorType required color type, or null for any
     */
    public List<Film> searchFilms(CatalogSnapshot snapshot, String query, ColorType colorType) {
        String q = normalize(query);
        List<Film> results = new ArrayList<>();
        for (Film film : snapshot.films()) {
            boolean textMatch = contains(film.getName(), q) || contains(film.getBrand(), q);
            if (textMatch && (colorType == null || film.getColorType() == colorType)) {
                results.add(film);
            }
        }
        return results;
    }

    /**
     * Developers whose name or manufacturer contains the query.
     */
    public List<Developer> searchDevelopers(CatalogSnapshot snapshot, String query) {
        String q = normalize(query);
        List<Developer> results = new ArrayList<>();
        for (Developer developer : snapshot.developers()) {
            if (contains(developer.getName(), q) || contains(developer.getManufacturer(), q)) {
                results.add(developer);
            }
        }
        return results;
    }

    public List<Combination> listCombinationsForFilm(CatalogSnapshot snapshot, String filmId) {
        List<Combination> results = new ArrayList<>();
        for (Combination combination : snapshot.combinations()) {
            if (combination.getFilmStockId().equals(filmId)) {
                results.add(combination);
            }
        }
        return results;
    }

    public List<Combination> listCombinationsForDeveloper(CatalogSnapshot snapshot, String developerId) {
        List<Combination> results = new ArrayList<>();
        for (Combination combination : snapshot.combinations()) {
            if (combination.getDeveloperId().equals(developerId)) {
                results.add(combination);
            }
        }
        return results;
    }

    private static String normalize(String query) {
        return query == null ? "" : query.toLowerCase(Locale.ROOT);
    }

    private static boolean contains(String field, String q) {
        return field.toLowerCase(Locale.ROOT).contains(q);
    }
}
