package com.dorkroom.catalog.cache;

import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.similarity.SearchText;

import java.util.function.Supplier;

/**
 * Cache used when caching is disabled: always computes.
 */
public class NoOpSearchTextCache implements SearchTextCache {

    @Override
    public SearchText get(long generation, RecordKind kind, String recordId, Supplier<SearchText> loader) {
        return loader.get();
    }

    @Override
    public void invalidateAll() {
        // no-op
    }
}
