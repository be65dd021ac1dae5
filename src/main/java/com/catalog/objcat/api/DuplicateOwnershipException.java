package com.catalog.objcat.api;

/**
 * An object that may only have one owner was attached twice: a field name
 * already present in a container, a field owned by another container, a
 * source already present in a field, or a derived value bound to another
 * field.
 */
public class DuplicateOwnershipException extends CatalogException {

    public DuplicateOwnershipException(String message) {
        super(message);
    }
}
