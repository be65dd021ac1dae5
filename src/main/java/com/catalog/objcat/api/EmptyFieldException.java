package com.catalog.objcat.api;

/** The current value of a field holding no values was requested. */
public class EmptyFieldException extends LookupException {

    public EmptyFieldException(String message) {
        super(message);
    }
}
