package com.catalog.objcat.api;

/**
 * Raised when a reparenting would make a node its own ancestor, or when an
 * invalidation pass re-enters a derived value that is already in flight.
 */
public class CycleException extends CatalogException {

    public CycleException(String message) {
        super(message);
    }
}
