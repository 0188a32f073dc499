package com.dorkroom.catalog.core.exception;

import com.dorkroom.catalog.core.model.RecordKind;

/**
 * Thrown when adding or loading a record would break a uniqueness rule.
 * Raised before anything is changed.
 */
public class DuplicateRecordException extends CatalogException {

    private final RecordKind kind;

    public DuplicateRecordException(RecordKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RecordKind getKind() {
        return kind;
    }
}
