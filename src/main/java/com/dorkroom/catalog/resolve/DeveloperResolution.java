package com.dorkroom.catalog.resolve;

import java.util.Optional;

/**
 * Outcome of resolving a (manufacturer, name, dilution label) triple.
 * The dilution id is only ever present when the developer was found.
 *
 * @param developerId matched developer id, or null
 * @param dilutionId  matched dilution id within that developer, or null
 */
public record DeveloperResolution(String developerId, Integer dilutionId) {

    public DeveloperResolution {
        if (developerId == null && dilutionId != null) {
            throw new IllegalArgumentException("dilutionId requires a resolved developer");
        }
    }

    public static DeveloperResolution notFound() {
        return new DeveloperResolution(null, null);
    }

    public Optional<String> getDeveloperId() {
        return Optional.ofNullable(developerId);
    }

    public Optional<Integer> getDilutionId() {
        return Optional.ofNullable(dilutionId);
    }

    public boolean isDeveloperFound() {
        return developerId != null;
    }
}
