package com.catalog.objcat.biblio;

import java.util.List;
import java.util.Map;

/**
 * Bibliographic entry of a publication. Text parts are null when the service
 * did not provide them.
 *
 * @param links       URLs by link type, e.g. {@code ABSTRACT}
 * @param keywordType the vocabulary the keywords come from
 */
public record BibRecord(String code, List<String> authors, String title, String abstractText, String date,
        Map<String, List<String>> links, List<String> keywords, String keywordType) {

    public BibRecord {
        authors = authors == null ? List.of() : List.copyOf(authors);
        links = links == null ? Map.of() : Map.copyOf(links);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    /** URL of the abstract page, or null. */
    public String abstractUrl() {
        List<String> urls = links.get("ABSTRACT");
        return urls == null || urls.isEmpty() ? null : urls.get(0);
    }
}
