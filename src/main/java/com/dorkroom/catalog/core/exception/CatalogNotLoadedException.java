package com.dorkroom.catalog.core.exception;

/**
 * Thrown when the catalog is queried before its first load has completed.
 */
public class CatalogNotLoadedException extends CatalogException {

    public CatalogNotLoadedException() {
        super("Catalog has not been loaded; call load() before querying");
    }
}
