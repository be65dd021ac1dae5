package com.catalog.objcat.api;

/** A node could not be captured or restored. */
public class SnapshotException extends CatalogException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
