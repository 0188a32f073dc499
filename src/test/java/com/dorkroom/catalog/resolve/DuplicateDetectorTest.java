package com.dorkroom.catalog.resolve;

import com.dorkroom.catalog.CatalogFixtures;
import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.index.CatalogIndex;
import com.dorkroom.catalog.index.CatalogSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.dorkroom.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DuplicateDetectorTest {

    private DuplicateDetector detector;
    private CatalogSnapshot snapshot;

    @BeforeEach
    void setUp() {
        detector = new DuplicateDetector();
        snapshot = new CatalogIndex().load(CatalogFixtures.films(), CatalogFixtures.developers(),
                CatalogFixtures.combinations());
    }

    @Test
    @DisplayName("Films with the same brand and name in another case are duplicates")
    void filmDuplicate() {
        Film candidate = film("other-id", "KODAK", "tri-x 400", 320, ColorType.BW, null);
        assertTrue(detector.isDuplicate(candidate, RecordKind.FILM, snapshot));
    }

    @Test
    @DisplayName("Same name under another brand is not a duplicate")
    void filmDifferentBrand() {
        Film candidate = film("other-id", "Foma", "Tri-X 400", 400, ColorType.BW, null);
        assertFalse(detector.isDuplicate(candidate, snapshot));
    }

    @Test
    @DisplayName("Developers with the same manufacturer and name are duplicates")
    void developerDuplicate() {
        assertTrue(detector.isDuplicate(developer("x", "kodak", "hc-110", "Liquid"), RecordKind.DEVELOPER, snapshot));
        assertFalse(detector.isDuplicate(developer("x", "Ilford", "HC-110", "Liquid"), snapshot));
    }

    @Test
    @DisplayName("Combinations are duplicates only when film, developer, dilution, ISO and push/pull all match")
    void combinationDuplicate() {
        Combination same = combination("other", "Different name", TRI_X, D76, 2, 1600, 2);
        Combination otherPush = combination("other", "x", TRI_X, D76, 2, 1600, 1);
        Combination otherDilution = combination("other", "x", TRI_X, D76, 1, 1600, 2);
        Combination noDilution = combination("other", "x", TRI_X, D76, null, 1600, 2);
        Combination otherIso = combination("other", "x", TRI_X, D76, 2, 1250, 2);

        assertTrue(detector.isDuplicate(same, RecordKind.COMBINATION, snapshot));
        assertFalse(detector.isDuplicate(otherPush, snapshot));
        assertFalse(detector.isDuplicate(otherDilution, snapshot));
        assertFalse(detector.isDuplicate(noDilution, snapshot));
        assertFalse(detector.isDuplicate(otherIso, snapshot));
    }

    @Test
    @DisplayName("Combinations with a custom dilution compare on the empty dilution id")
    void customDilutionCombination() {
        Combination sameAsCombo3 = Combination.builder()
                .id("other").name("x").filmStockId(HP5).developerId(ID11)
                .customDilution("1+1").temperatureF(75).timeMinutes(5).shootingIso(400)
                .build();
        assertTrue(detector.isDuplicate(sameAsCombo3, snapshot));
    }

    @Test
    @DisplayName("A candidate of the wrong type for the kind should be rejected")
    void wrongType() {
        Film film = film("x", "Kodak", "Gold 200", 200, ColorType.COLOR, null);
        assertThrows(IllegalArgumentException.class, () -> detector.isDuplicate(film, RecordKind.DEVELOPER, snapshot));
    }
}
