package com.catalog.objcat.api;

/**
 * Base class of every failure raised by the catalog core. All catalog
 * failures are unchecked.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
