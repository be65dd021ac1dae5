package com.catalog.objcat.biblio;

import com.catalog.objcat.api.CatalogException;

/** Bibliographic data for a source could not be obtained or understood. */
public class SourceDataException extends CatalogException {

    public SourceDataException(String message) {
        super(message);
    }

    public SourceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
