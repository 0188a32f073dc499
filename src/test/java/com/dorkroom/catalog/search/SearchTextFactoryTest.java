package com.dorkroom.catalog.search;

import com.dorkroom.catalog.CatalogFixtures;
import com.dorkroom.catalog.cache.CacheConfig;
import com.dorkroom.catalog.cache.CaffeineSearchTextCache;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.index.CatalogIndex;
import com.dorkroom.catalog.index.CatalogSnapshot;
import com.dorkroom.catalog.similarity.SearchText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.dorkroom.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SearchTextFactoryTest {

    private SearchTextFactory factory;
    private CatalogSnapshot snapshot;

    @BeforeEach
    void setUp() {
        factory = new SearchTextFactory();
        snapshot = new CatalogIndex().load(CatalogFixtures.films(), CatalogFixtures.developers(),
                CatalogFixtures.combinations());
    }

    @Test
    @DisplayName("Film text should be brand and name, then ISO, color type and description")
    void filmText() {
        SearchText text = factory.forFilm(snapshot, snapshot.getFilm(TRI_X).orElseThrow());

        assertEquals("kodak tri-x 400", text.primary());
        assertEquals("400 bw classic high-speed black and white film", text.secondary());
    }

    @Test
    @DisplayName("Film text should skip a missing description")
    void filmWithoutDescription() {
        SearchText text = factory.forFilm(snapshot, snapshot.getFilm(DELTA_3200).orElseThrow());
        assertEquals("3200 bw", text.secondary());
    }

    @Test
    @DisplayName("Developer text should be name and manufacturer, then type and purpose")
    void developerText() {
        SearchText text = factory.forDeveloper(snapshot, snapshot.getDeveloper(D76).orElseThrow());

        assertEquals("d-76 kodak", text.primary());
        assertEquals("powder film", text.secondary());
    }

    @Test
    @DisplayName("Combination text should pull in the film and developer names")
    void combinationText() {
        SearchText text = factory.forCombination(snapshot, snapshot.getCombination("combo-2").orElseThrow());

        assertEquals("tri-x 400 @ 1600 in d-76 1+1", text.primary());
        assertEquals("kodak tri-x 400 d-76", text.secondary());
    }

    @Test
    @DisplayName("Combination text should skip references that do not resolve")
    void danglingCombination() {
        CatalogSnapshot partial = new CatalogIndex().load(CatalogFixtures.films(), List.of(),
                CatalogFixtures.combinations());
        Combination combination = partial.getCombination("combo-1").orElseThrow();

        assertEquals("kodak tri-x 400", factory.forCombination(partial, combination).secondary());
    }

    @Test
    @DisplayName("Texts should be served from the cache within one generation")
    void cached() {
        CaffeineSearchTextCache cache = new CaffeineSearchTextCache(CacheConfig.defaults());
        SearchTextFactory cachingFactory = new SearchTextFactory(cache);

        SearchText first = cachingFactory.forFilm(snapshot, snapshot.getFilm(HP5).orElseThrow());
        SearchText second = cachingFactory.forFilm(snapshot, snapshot.getFilm(HP5).orElseThrow());

        assertSame(first, second);
    }

    @ParameterizedTest
    @DisplayName("Whole numbers should be formatted without a fraction")
    @CsvSource({
            "400.0, 400",
            "50, 50",
            "12.5, 12.5"
    })
    void formatNumber(double value, String expected) {
        assertEquals(expected, SearchTextFactory.formatNumber(value));
    }
}
