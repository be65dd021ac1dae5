package com.catalog.objcat.biblio;

import java.io.IOException;
import java.net.URI;

/**
 * Retrieves a text page over the network.
 */
@FunctionalInterface
public interface PageFetcher {

    /** Status code and body of a response. */
    record Page(int status, String body) {
    }

    Page fetch(URI uri) throws IOException;
}
