package com.catalog.objcat.biblio;

/** The bibliographic service answered that the requested record does not exist. */
public class NoSuchRecordException extends SourceDataException {

    public NoSuchRecordException(String message) {
        super(message);
    }
}
