package com.dorkroom.catalog.core.model;

/**
 * The three record collections held by the catalog.
 */
public enum RecordKind {
    FILM("Film"),
    DEVELOPER("Developer"),
    COMBINATION("Combination");

    private final String label;

    RecordKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
