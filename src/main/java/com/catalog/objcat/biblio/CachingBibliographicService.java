package com.catalog.objcat.biblio;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * Keeps fetched records by code in front of another service. Disabling the
 * cache drops every entry.
 */
@Log4j2
public final class CachingBibliographicService implements BibliographicService {
    private final BibliographicService delegate;
    private Map<String, BibRecord> records = new HashMap<>();

    public CachingBibliographicService(BibliographicService delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public String resolveCode(String locator) {
        return delegate.resolveCode(locator);
    }

    @Override
    public BibRecord fetchRecord(String code) {
        if (records == null) {
            return delegate.fetchRecord(code);
        }
        BibRecord cached = records.get(code);
        if (cached != null) {
            return cached;
        }
        BibRecord fetched = delegate.fetchRecord(code);
        records.put(code, fetched);
        log.debug("Cached record {}", code);
        return fetched;
    }

    @Override
    public String fetchBibtex(String code) {
        return delegate.fetchBibtex(code);
    }

    public boolean isEnabled() {
        return records != null;
    }

    public void setEnabled(boolean enabled) {
        if (enabled && records == null) {
            records = new HashMap<>();
        } else if (!enabled) {
            records = null;
        }
    }

    public void clear() {
        if (records != null) {
            records.clear();
        }
    }

    public void clear(String code) {
        if (records != null) {
            records.remove(code);
        }
    }

    public int size() {
        return records == null ? 0 : records.size();
    }
}
