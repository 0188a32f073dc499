package com.dorkroom.catalog.core.exception;

/**
 * Thrown when a catalog data document cannot be read into records.
 */
public class CatalogParseException extends CatalogException {

    public CatalogParseException(String message) {
        super(message);
    }

    public CatalogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
