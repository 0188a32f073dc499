package com.dorkroom.catalog.resolve;

import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Dilution;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.index.CatalogSnapshot;

import java.util.Optional;

/**
 * Builds the default display name of a combination:
 * {@code <brand name> @ <iso> in <developer name> <dilution>}, for example
 * {@code Kodak Tri-X 400 @ 1600 in D-76 1+1}.
 */
public final class CombinationNamer {

    static final String UNKNOWN_FILM = "Unknown Film";
    static final String UNKNOWN_DEVELOPER = "Unknown Developer";
    static final String UNKNOWN_DILUTION = "Unknown Dilution";

    private CombinationNamer() {
    }

    public static String generateName(Combination combination, CatalogSnapshot snapshot) {
        Optional<Film> film = snapshot.getFilm(combination.getFilmStockId());
        Optional<Developer> developer = snapshot.getDeveloper(combination.getDeveloperId());

        String filmName = film.map(Film::getDisplayName).orElse(UNKNOWN_FILM);
        String developerName = developer.map(Developer::getName).orElse(UNKNOWN_DEVELOPER);
        String iso = Long.toString((long) combination.getShootingIso());

        // dilution id 0 means none was picked
        Optional<Integer> dilutionId = combination.getDilutionId().filter(id -> id != 0);
        String dilution;
        if (dilutionId.isPresent() && developer.isPresent()) {
            // an id the developer does not have leaves the dilution part empty
            dilution = developer.get().getDilution(dilutionId.get())
                    .map(Dilution::dilution)
                    .orElse("");
        } else if (combination.getCustomDilution().filter(s -> !s.isBlank()).isPresent()) {
            dilution = combination.getCustomDilution().get();
        } else {
            dilution = UNKNOWN_DILUTION;
        }

        return (filmName + " @ " + iso + " in " + developerName + " " + dilution).trim();
    }
}
