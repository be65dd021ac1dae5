package com.catalog.objcat.source;

import java.util.Objects;
import java.util.Optional;

import com.catalog.objcat.biblio.BibRecord;
import com.catalog.objcat.biblio.BibliographicService;
import com.catalog.objcat.biblio.SourceDataException;

/**
 * Provenance of a field value.
 *
 * <p>
 * Sources are interned by name through the {@link SourceRegistry}: every
 * {@code Source.of("X")} returns the same instance while anything still
 * references it, so sources compare by identity. A source may carry a location
 * code pointing at the publication it came from.
 *
 * <p>
 * Source strings:
 * <ul>
 * <li>{@code "X"}: source named X, location untouched</li>
 * <li>{@code "X/locator"}: the locator goes through the registry's
 * {@link LocationResolver}</li>
 * <li>{@code "X//code"}: the code is stored verbatim</li>
 * </ul>
 */
public class Source {

    /** Tags the default value of a field. */
    public static final Source DEFAULT = of("<default>");

    private final String name;
    private String location;

    protected Source(String name, String location) {
        this.name = Objects.requireNonNull(name, "name");
        this.location = location;
    }

    /** Interns {@code spec} in the global registry. */
    public static Source of(String spec) {
        return SourceRegistry.global().source(spec);
    }

    /** Interns {@code name} in the global registry, resolving {@code locator}. */
    public static Source of(String name, String locator) {
        return SourceRegistry.global().source(name, locator);
    }

    /**
     * Looks up a live source by name without creating it. Any location suffix
     * in {@code spec} is ignored.
     */
    public static Optional<Source> find(String spec) {
        return SourceRegistry.global().find(spec);
    }

    public String name() {
        return name;
    }

    /** The location code, or null. */
    public String location() {
        return location;
    }

    public boolean hasLocation() {
        return location != null;
    }

    void relocate(String newLocation) {
        this.location = newLocation;
    }

    /** The string that re-interns this source with its location, without resolution. */
    public String spec() {
        return location == null ? name : name + "//" + location;
    }

    /**
     * Fetches the bibliographic record for this source's location.
     *
     * @throws SourceDataException if the source has no location or the lookup
     *                             fails
     */
    public BibRecord record(BibliographicService service) {
        if (location == null) {
            throw new SourceDataException("No location provided for additional source data on " + this);
        }
        return service.fetchRecord(location);
    }

    @Override
    public String toString() {
        return location == null ? "Source " + name : "Source " + name + " @" + location;
    }
}
