package com.catalog.objcat.biblio;

/** The bibliographic service could not be reached or answered with an error. */
public class SourceTransportException extends SourceDataException {

    public SourceTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
