package com.dorkroom.catalog.cache;

import com.dorkroom.catalog.core.model.RecordKind;
import com.dorkroom.catalog.similarity.SearchText;

import java.util.function.Supplier;

/**
 * Memo table for the text each record is fuzzy-matched on.
 * Entries are keyed by snapshot generation, so an entry built from one snapshot is never
 * served for another.
 */
public interface SearchTextCache {

    /**
     * Returns the cached text for the record, computing and storing it on a miss.
     *
     * @param generation snapshot generation the text was derived from
     * @param kind       record collection
     * @param recordId   record id
     * @param loader     builds the text on a miss
     */
    SearchText get(long generation, RecordKind kind, String recordId, Supplier<SearchText> loader);

    /**
     * Drops all entries.
     */
    void invalidateAll();
}
