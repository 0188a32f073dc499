package com.dorkroom.catalog.core.exception;

/**
 * Base class for failures raised by the catalog.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
