package com.catalog.objcat.biblio;

import com.catalog.objcat.source.LocationResolver;

/**
 * Looks up publications for source locations.
 */
public interface BibliographicService {

    /**
     * Turns a free-form citation (arXiv id, astro-ph id, DOI, URL or raw code)
     * into the service's canonical code.
     *
     * @throws NoSuchRecordException    if the service knows no such publication
     * @throws SourceTransportException if the service could not be asked
     */
    String resolveCode(String locator);

    /**
     * @throws NoSuchRecordException    if there is no record for {@code code}
     * @throws SourceTransportException if the service could not be asked
     */
    BibRecord fetchRecord(String code);

    /** The BibTeX entry for {@code code}. */
    String fetchBibtex(String code);

    /** This service as the resolver of {@code "name/locator"} source strings. */
    default LocationResolver asLocationResolver() {
        return locator -> locator == null || locator.isBlank() ? null : resolveCode(locator.strip());
    }
}
