package com.dorkroom.catalog.resolve;

import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.index.CatalogSnapshot;

import java.util.Objects;

/**
 * Decides whether a candidate record already exists in a snapshot.
 *
 * <ul>
 *   <li>Films: same brand and name, ignoring case</li>
 *   <li>Developers: same manufacturer and name, ignoring case</li>
 *   <li>Combinations: same film, developer, dilution id, shooting ISO and push/pull</li>
 * </ul>
 */
public class DuplicateDetector {

    /**
     * Dispatches on the kind.
     *
     * @throws IllegalArgumentException if the candidate's type does not match the kind
     */
    public boolean isDuplicate(Object candidate, RecordKind kind, CatalogSnapshot snapshot) {
        Objects.requireNonNull(candidate, "candidate");
        switch (kind) {
            case FILM:
                return isDuplicate(cast(candidate, Film.class, kind), snapshot);
            case DEVELOPER:
                return isDuplicate(cast(candidate, Developer.class, kind), snapshot);
            case COMBINATION:
                return isDuplicate(cast(candidate, Combination.class, kind), snapshot);
            default:
                throw new IllegalArgumentException("Unknown record kind: " + kind);
        }
    }

    public boolean isDuplicate(Film candidate, CatalogSnapshot snapshot) {
        for (Film film : snapshot.films()) {
            if (film.getBrand().equalsIgnoreCase(candidate.getBrand())
                    && film.getName().equalsIgnoreCase(candidate.getName())) {
                return true;
            }
        }
        return false;
    }

    public boolean isDuplicate(Developer candidate, CatalogSnapshot snapshot) {
        for (Developer developer : snapshot.developers()) {
            if (developer.getManufacturer().equalsIgnoreCase(candidate.getManufacturer())
                    && developer.getName().equalsIgnoreCase(candidate.getName())) {
                return true;
            }
        }
        return false;
    }

    public boolean isDuplicate(Combination candidate, CatalogSnapshot snapshot) {
        for (Combination combination : snapshot.combinations()) {
            if (combination.getFilmStockId().equals(candidate.getFilmStockId())
                    && combination.getDeveloperId().equals(candidate.getDeveloperId())
                    && combination.getDilutionId().equals(candidate.getDilutionId())
                    && Double.compare(combination.getShootingIso(), candidate.getShootingIso()) == 0
                    && combination.getPushPull() == candidate.getPushPull()) {
                return true;
            }
        }
        return false;
    }

    private static <T> T cast(Object candidate, Class<T> type, RecordKind kind) {
        if (!type.isInstance(candidate)) {
            throw new IllegalArgumentException("Expected a " + type.getSimpleName() + " for kind " + kind
                    + " but got " + candidate.getClass().getSimpleName());
        }
        return type.cast(candidate);
    }
}
