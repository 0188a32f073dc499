package com.dorkroom.catalog.index;

/**
 * Notified after the catalog publishes a new snapshot, by a full load or an append.
 * Used to drop anything derived from the previous snapshot.
 */
public interface ReloadListener {

    /**
     * Called after a new snapshot has been published.
     *
     * @param generation the generation of the snapshot now current
     */
    void onReload(long generation);
}
