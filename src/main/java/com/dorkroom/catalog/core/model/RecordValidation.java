package com.dorkroom.catalog.core.model;

/**
 * Construction-time checks shared by the record builders.
 */
final class RecordValidation {

    private RecordValidation() {
        // utility class
    }

    static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
