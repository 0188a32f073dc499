package com.dorkroom.catalog.resolve;

import com.dorkroom.catalog.core.exception.RecordNotFoundException;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Dilution;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.index.CatalogSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Links textual identifiers to canonical records.
 *
 * <p>Matching is exact and case-insensitive. There is deliberately no fuzzy fallback here:
 * a near miss such as "Kodak Tri X" does not resolve to "Tri-X 400". Use the fuzzy search
 * operations to offer candidates instead.</p>
 */
public class EntityResolver {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    /**
     * Finds the id of the film whose brand and name both equal the given values, ignoring case.
     */
    public Optional<String> resolveFilm(CatalogSnapshot snapshot, String brand, String name) {
        if (brand == null || name == null) {
            return Optional.empty();
        }
        for (Film film : snapshot.films()) {
            if (film.getBrand().equalsIgnoreCase(brand) && film.getName().equalsIgnoreCase(name)) {
                return Optional.of(film.getId());
            }
        }
        log.debug("resolve.film.miss brand='{}' name='{}'", brand, name);
        return Optional.empty();
    }

    /**
     * Finds a developer by manufacturer and name, then one of its dilutions by label.
     * The label is compared with each dilution's name and ratio text; the first match wins.
     *
     * @param dilutionLabel dilution name or ratio, may be null or blank
     */
    public DeveloperResolution resolveDeveloperAndDilution(CatalogSnapshot snapshot, String manufacturer,
                                                           String name, String dilutionLabel) {
        if (manufacturer == null || name == null) {
            return DeveloperResolution.notFound();
        }
        for (Developer developer : snapshot.developers()) {
            if (developer.getManufacturer().equalsIgnoreCase(manufacturer)
                    && developer.getName().equalsIgnoreCase(name)) {
                Integer dilutionId = null;
                if (dilutionLabel != null && !dilutionLabel.isBlank()) {
                    dilutionId = developer.findDilutionByLabel(dilutionLabel)
                            .map(Dilution::id)
                            .orElse(null);
                }
                return new DeveloperResolution(developer.getId(), dilutionId);
            }
        }
        log.debug("resolve.developer.miss manufacturer='{}' name='{}'", manufacturer, name);
        return DeveloperResolution.notFound();
    }

    /**
     * Checks that the combination's film, developer and dilution exist in the snapshot.
     *
     * @throws RecordNotFoundException naming the first reference that does not resolve
     */
    public void requireResolvableReferences(Combination combination, CatalogSnapshot snapshot) {
        if (snapshot.getFilm(combination.getFilmStockId()).isEmpty()) {
            throw new RecordNotFoundException(RecordKind.FILM, combination.getFilmStockId(),
                    "Film not found: " + combination.getFilmStockId());
        }
        Developer developer = snapshot.getDeveloper(combination.getDeveloperId())
                .orElseThrow(() -> new RecordNotFoundException(RecordKind.DEVELOPER,
                        combination.getDeveloperId(),
                        "Developer not found: " + combination.getDeveloperId()));
        Optional<Integer> dilutionId = combination.getDilutionId();
        if (dilutionId.isPresent() && developer.getDilution(dilutionId.get()).isEmpty()) {
            throw new RecordNotFoundException(RecordKind.DEVELOPER,
                    developer.getId() + "#" + dilutionId.get(),
                    "Dilution " + dilutionId.get() + " not found on developer " + developer.getId());
        }
    }
}
