package com.dorkroom.catalog.search;

import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import com.dorkroom.catalog.core.model.SearchResult;

import java.util.List;

/**
 * Fuzzy results across all three collections for one query.
 */
public record CatalogSearchResults(
        List<SearchResult<Film>> films,
        List<SearchResult<Developer>> developers,
        List<SearchResult<Combination>> combinations
) {
    public CatalogSearchResults {
        films = films != null ? List.copyOf(films) : List.of();
        developers = developers != null ? List.copyOf(developers) : List.of();
        combinations = combinations != null ? List.copyOf(combinations) : List.of();
    }

    public int totalCount() {
        return films.size() + developers.size() + combinations.size();
    }

    public boolean isEmpty() {
        return totalCount() == 0;
    }
}
