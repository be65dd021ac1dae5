package com.catalog.objcat.api;

/** A value does not satisfy the type constraint of the field it targets. */
public class TypeMismatchException extends CatalogException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
