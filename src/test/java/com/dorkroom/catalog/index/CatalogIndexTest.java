package com.dorkroom.catalog.index;

import com.dorkroom.catalog.CatalogFixtures;
import com.dorkroom.catalog.core.exception.CatalogNotLoadedException;
import com.dorkroom.catalog.core.exception.DuplicateRecordException;
import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.dorkroom.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CatalogIndex Tests")
@ExtendWith(MockitoExtension.class)
class CatalogIndexTest {

    @Mock
    private ReloadListener reloadListener;

    private CatalogIndex index;

    @BeforeEach
    void setUp() {
        index = new CatalogIndex();
    }

    private CatalogSnapshot loadFixtures() {
        return index.load(CatalogFixtures.films(), CatalogFixtures.developers(), CatalogFixtures.combinations());
    }

    @Nested
    @DisplayName("Before load")
    class BeforeLoadTests {

        @Test
        @DisplayName("Queries should fail with CatalogNotLoadedException")
        void notLoaded() {
            assertFalse(index.isLoaded());
            assertThrows(CatalogNotLoadedException.class, () -> index.snapshot());
            assertThrows(CatalogNotLoadedException.class, () -> index.getFilm(TRI_X));
        }

        @Test
        @DisplayName("Appending should fail with CatalogNotLoadedException")
        void appendBeforeLoad() {
            assertThrows(CatalogNotLoadedException.class,
                    () -> index.appendFilm(s -> film("x", "Foma", "Fomapan 100", 100, ColorType.BW, null)));
        }
    }

    @Nested
    @DisplayName("Load")
    class LoadTests {

        @Test
        @DisplayName("Every loaded id should resolve to its record")
        void lookups() {
            loadFixtures();

            for (Film film : CatalogFixtures.films()) {
                assertEquals(film.getName(), index.getFilm(film.getId()).orElseThrow().getName());
            }
            assertEquals("D-76", index.getDeveloper(D76).orElseThrow().getName());
            assertEquals(TRI_X, index.getCombination("combo-2").orElseThrow().getFilmStockId());
        }

        @Test
        @DisplayName("Unknown ids should be absent rather than fail")
        void unknownIds() {
            loadFixtures();
            assertTrue(index.getFilm("nope").isEmpty());
            assertTrue(index.getDeveloper(null).isEmpty());
            assertTrue(index.getCombination("nope").isEmpty());
        }

        @Test
        @DisplayName("Catalog order should be preserved")
        void order() {
            CatalogSnapshot snapshot = loadFixtures();
            assertEquals(List.of(TRI_X, HP5, PORTRA, VELVIA, DELTA_3200),
                    snapshot.films().stream().map(Film::getId).toList());
        }

        @Test
        @DisplayName("A reload should replace the previous contents wholesale")
        void reloadReplaces() {
            CatalogSnapshot first = loadFixtures();
            CatalogSnapshot second = index.load(
                    List.of(film("only", "Foma", "Fomapan 100", 100, ColorType.BW, null)), List.of(), List.of());

            assertTrue(second.generation() > first.generation());
            assertTrue(index.getFilm(TRI_X).isEmpty());
            assertTrue(index.getFilm("only").isPresent());
            assertEquals(5, first.films().size(), "Earlier snapshots must not change");
        }

        @Test
        @DisplayName("Duplicate ids should be rejected and the previous snapshot kept")
        void duplicateIdKeepsPrevious() {
            CatalogSnapshot before = loadFixtures();
            List<Film> films = new ArrayList<>(CatalogFixtures.films());
            films.add(film(TRI_X, "Foma", "Fomapan 100", 100, ColorType.BW, null));

            DuplicateRecordException e = assertThrows(DuplicateRecordException.class,
                    () -> index.load(films, CatalogFixtures.developers(), List.of()));

            assertEquals(RecordKind.FILM, e.getKind());
            assertSame(before, index.snapshot());
        }

        @Test
        @DisplayName("Films with the same brand and name in another case should be rejected")
        void duplicateNaturalKey() {
            List<Film> films = List.of(
                    film("a", "Kodak", "Tri-X 400", 400, ColorType.BW, null),
                    film("b", "KODAK", "tri-x 400", 400, ColorType.BW, null));

            assertThrows(DuplicateRecordException.class, () -> index.load(films, List.of(), List.of()));
            assertFalse(index.isLoaded());
        }

        @Test
        @DisplayName("Developers with the same manufacturer and name should be rejected")
        void duplicateDeveloper() {
            assertThrows(DuplicateRecordException.class, () -> index.load(List.of(),
                    List.of(developer("a", "Kodak", "D-76", "Powder"), developer("b", "kodak", "d-76", "Powder")),
                    List.of()));
        }

        @Test
        @DisplayName("Dangling combination references should be tolerated")
        void danglingReferences() {
            CatalogSnapshot snapshot = index.load(CatalogFixtures.films(), List.of(), CatalogFixtures.combinations());
            assertEquals(4, snapshot.countDanglingReferences());
            assertEquals(4, snapshot.combinations().size());
        }

        @Test
        @DisplayName("Reload listeners should be told the new generation")
        void notifiesListeners() {
            index.addReloadListener(reloadListener);

            CatalogSnapshot snapshot = loadFixtures();

            verify(reloadListener).onReload(snapshot.generation());
        }
    }

    @Nested
    @DisplayName("Append")
    class AppendTests {

        @Test
        @DisplayName("Appending should publish a new generation containing the record")
        void appendPublishes() {
            CatalogSnapshot before = loadFixtures();
            Film fomapan = film("film-foma", "Foma", "Fomapan 100", 100, ColorType.BW, null);

            CatalogSnapshot after = index.appendFilm(s -> fomapan);

            assertEquals(before.generation() + 1, after.generation());
            assertEquals(fomapan, index.getFilm("film-foma").orElseThrow());
            assertEquals(5, before.films().size());
            assertEquals(6, after.films().size());
        }

        @Test
        @DisplayName("The prepare step should see the latest snapshot")
        void prepareSeesLatest() {
            CatalogSnapshot loaded = loadFixtures();
            index.appendCombination(s -> {
                assertSame(loaded, s);
                return combination("combo-5", "x", HP5, D76, 1, 400, 0);
            });
            assertTrue(index.getCombination("combo-5").isPresent());
        }

        @Test
        @DisplayName("A failing prepare step should leave the snapshot unchanged")
        void rejectedAppend() {
            CatalogSnapshot before = loadFixtures();
            index.addReloadListener(reloadListener);

            assertThrows(DuplicateRecordException.class, () -> index.appendDeveloper(s -> {
                throw new DuplicateRecordException(RecordKind.DEVELOPER, "rejected");
            }));

            assertSame(before, index.snapshot());
            verifyNoInteractions(reloadListener);
        }

        @Test
        @DisplayName("Appending a record with an existing id should be rejected")
        void appendDuplicateId() {
            CatalogSnapshot before = loadFixtures();
            Combination clash = combination("combo-1", "clash", HP5, ID11, null, 1600, 2);

            assertThrows(DuplicateRecordException.class, () -> index.appendCombination(s -> clash));
            assertSame(before, index.snapshot());
        }
    }

    @Test
    @DisplayName("Readers should never see a mix of two loads")
    void concurrentReadersSeeConsistentSnapshots() throws Exception {
        List<Film> smallFilms = List.of(film("f", "Foma", "Fomapan 100", 100, ColorType.BW, null));
        List<Combination> smallCombos = List.of(combination("c", "x", "f", "d", null, 100, 0));
        loadFixtures();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(executor.submit(() -> {
                    boolean consistent = true;
                    while (running.get()) {
                        CatalogSnapshot s = index.snapshot();
                        boolean big = s.films().size() == 5;
                        consistent &= big ? s.combinations().size() == 4 : s.combinations().size() == 1;
                    }
                    return consistent;
                }));
            }
            for (int i = 0; i < 200; i++) {
                if (i % 2 == 0) {
                    index.load(smallFilms, List.of(), smallCombos);
                } else {
                    loadFixtures();
                }
            }
            running.set(false);
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get(10, TimeUnit.SECONDS));
            }
        } finally {
            running.set(false);
            executor.shutdownNow();
        }
    }
}
