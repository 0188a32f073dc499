package com.dorkroom.catalog.search;

import com.dorkroom.catalog.CatalogFixtures;
import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.index.CatalogIndex;
import com.dorkroom.catalog.index.CatalogSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dorkroom.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ExactMatcherTest {

    private ExactMatcher matcher;
    private CatalogSnapshot snapshot;

    @BeforeEach
    void setUp() {
        matcher = new ExactMatcher();
        snapshot = new CatalogIndex().load(CatalogFixtures.films(), CatalogFixtures.developers(),
                CatalogFixtures.combinations());
    }

    private static List<String> filmIds(List<Film> films) {
        return films.stream().map(Film::getId).toList();
    }

    @Test
    @DisplayName("A name fragment should match case-insensitively")
    void nameFragment() {
        assertEquals(List.of(TRI_X), filmIds(matcher.searchFilms(snapshot, "tri", null)));
        assertEquals(List.of(TRI_X), filmIds(matcher.searchFilms(snapshot, "TRI-X", null)));
    }

    @Test
    @DisplayName("A brand should match every film of that brand in catalog order")
    void brand() {
        assertEquals(List.of(TRI_X, PORTRA), filmIds(matcher.searchFilms(snapshot, "kodak", null)));
    }

    @Test
    @DisplayName("The color type filter should apply after the text match")
    void colorTypeFilter() {
        assertEquals(List.of(PORTRA), filmIds(matcher.searchFilms(snapshot, "400", ColorType.COLOR)));
        assertEquals(List.of(TRI_X), filmIds(matcher.searchFilms(snapshot, "400", ColorType.BW)));
        assertTrue(matcher.searchFilms(snapshot, "kodak", ColorType.SLIDE).isEmpty());
    }

    @Test
    @DisplayName("An empty query should match everything")
    void emptyQuery() {
        assertEquals(5, matcher.searchFilms(snapshot, "", null).size());
        assertEquals(4, matcher.searchDevelopers(snapshot, "").size());
    }

    @Test
    @DisplayName("Developers should match on name or manufacturer")
    void developers() {
        List<String> kodak = matcher.searchDevelopers(snapshot, "KODAK").stream().map(Developer::getId).toList();
        List<String> rodinal = matcher.searchDevelopers(snapshot, "rodin").stream().map(Developer::getId).toList();

        assertEquals(List.of(D76, HC110), kodak);
        assertEquals(List.of(RODINAL), rodinal);
        assertTrue(matcher.searchDevelopers(snapshot, "xtol").isEmpty());
    }

    @Test
    @DisplayName("Combinations should be listed by film and by developer in catalog order")
    void combinationsByReference() {
        List<String> forTriX = matcher.listCombinationsForFilm(snapshot, TRI_X).stream()
                .map(Combination::getId).toList();
        List<String> forHc110 = matcher.listCombinationsForDeveloper(snapshot, HC110).stream()
                .map(Combination::getId).toList();

        assertEquals(List.of("combo-1", "combo-2"), forTriX);
        assertEquals(List.of("combo-4"), forHc110);
        assertTrue(matcher.listCombinationsForFilm(snapshot, VELVIA).isEmpty());
    }
}
