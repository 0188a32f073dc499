package com.dorkroom.catalog.core.exception;

import com.dorkroom.catalog.core.model.RecordKind;

/**
 * Thrown when a new record references a film, developer or dilution that is not in the catalog.
 * Plain lookups report misses with {@link java.util.Optional} instead.
 */
public class RecordNotFoundException extends CatalogException {

    private final RecordKind kind;
    private final String reference;

    public RecordNotFoundException(RecordKind kind, String reference, String message) {
        super(message);
        this.kind = kind;
        this.reference = reference;
    }

    /**
     * The kind of record that could not be found.
     */
    public RecordKind getKind() {
        return kind;
    }

    public String getReference() {
        return reference;
    }
}
