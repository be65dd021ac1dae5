package com.catalog.objcat.api;

/** An unknown field, source slot, child or path target. */
public class LookupException extends CatalogException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
