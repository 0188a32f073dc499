package com.dorkroom.catalog.index;

import com.dorkroom.catalog.core.exception.CatalogNotLoadedException;
import com.dorkroom.catalog.core.model.Combination;
import com.dorkroom.catalog.core.model.Developer;
import com.dorkroom.catalog.core.model.Film;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Holds the current {@link CatalogSnapshot} and swaps it atomically on load or append.
 *
 * <p>Readers call {@link #snapshot()} once per operation and work on that snapshot, so they
 * never observe a mix of two versions and never block. Writers build the next snapshot
 * completely before publishing it and are serialized by a lock.</p>
 */
public class CatalogIndex {
    private static final Logger log = LoggerFactory.getLogger(CatalogIndex.class);

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<ReloadListener> reloadListeners = new CopyOnWriteArrayList<>();
    private long lastGeneration;

    /**
     * Registers a listener notified after every new snapshot is published.
     */
    public void addReloadListener(ReloadListener listener) {
        reloadListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Replaces the whole catalog. If validation fails the previous snapshot stays current.
     *
     * @return the newly published snapshot
     * @throws com.dorkroom.catalog.core.exception.DuplicateRecordException if ids or natural keys repeat
     */
    public CatalogSnapshot load(List<Film> films, List<Developer> developers, List<Combination> combinations) {
        Objects.requireNonNull(films, "films");
        Objects.requireNonNull(developers, "developers");
        Objects.requireNonNull(combinations, "combinations");

        writeLock.lock();
        try {
            CatalogSnapshot next = CatalogSnapshot.of(lastGeneration + 1, films, developers, combinations);
            publish(next);

            int dangling = next.countDanglingReferences();
            if (dangling > 0) {
                log.warn("catalog.load.dangling combinations={} generation={}", dangling, next.generation());
            }
            log.info("catalog.loaded films={} developers={} combinations={} generation={}",
                    next.films().size(), next.developers().size(), next.combinations().size(),
                    next.generation());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends a film. {@code prepare} receives the latest snapshot and returns the film to
     * append, or throws to reject it. It runs under the write lock, so no other writer can
     * slip in between the check and the append.
     */
    public CatalogSnapshot appendFilm(Function<CatalogSnapshot, Film> prepare) {
        return append(base -> base.withFilm(prepare.apply(base)));
    }

    public CatalogSnapshot appendDeveloper(Function<CatalogSnapshot, Developer> prepare) {
        return append(base -> base.withDeveloper(prepare.apply(base)));
    }

    public CatalogSnapshot appendCombination(Function<CatalogSnapshot, Combination> prepare) {
        return append(base -> base.withCombination(prepare.apply(base)));
    }

    /**
     * Returns the current snapshot.
     *
     * @throws CatalogNotLoadedException if nothing has been loaded yet
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new CatalogNotLoadedException();
        }
        return snapshot;
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public Optional<Film> getFilm(String id) {
        return snapshot().getFilm(id);
    }

    public Optional<Developer> getDeveloper(String id) {
        return snapshot().getDeveloper(id);
    }

    public Optional<Combination> getCombination(String id) {
        return snapshot().getCombination(id);
    }

    private CatalogSnapshot append(UnaryOperator<CatalogSnapshot> change) {
        writeLock.lock();
        try {
            CatalogSnapshot next = change.apply(snapshot());
            publish(next);
            log.debug("catalog.appended generation={}", next.generation());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    private void publish(CatalogSnapshot next) {
        current.set(next);
        lastGeneration = next.generation();
        for (ReloadListener listener : reloadListeners) {
            listener.onReload(next.generation());
        }
    }
}
