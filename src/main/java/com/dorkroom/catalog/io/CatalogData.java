package com.dorkroom.catalog.io;

import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;

import java.util.List;

/**
 * The three collections read from one set of catalog documents, ready to load.
 */
public record CatalogData(List<Film> films, List<Developer> developers, List<Combination> combinations) {

    public CatalogData {
        films = films != null ? List.copyOf(films) : List.of();
        developers = developers != null ? List.copyOf(developers) : List.of();
        combinations = combinations != null ? List.copyOf(combinations) : List.of();
    }
}
