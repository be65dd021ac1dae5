package com.catalog.objcat.source;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Interning table for {@link Source}s.
 *
 * <p>
 * Entries are weakly held: a source nothing references any more may be
 * collected and a later {@code source(name)} then creates a fresh identity.
 * Not thread-safe; the catalog is single-threaded.
 */
@Log4j2
public final class SourceRegistry {
    private static final SourceRegistry GLOBAL = new SourceRegistry(LocationResolver.VERBATIM);

    private final Map<String, Entry> interned = new HashMap<>();
    private final ReferenceQueue<Source> collected = new ReferenceQueue<>();
    private LocationResolver resolver;

    public SourceRegistry(LocationResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public static SourceRegistry global() {
        return GLOBAL;
    }

    public LocationResolver locationResolver() {
        return resolver;
    }

    public void setLocationResolver(LocationResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /** Interns a source string; see {@link Source} for the accepted forms. */
    public Source source(String spec) {
        Objects.requireNonNull(spec, "spec");
        int slash = spec.indexOf('/');
        if (slash < 0) {
            return intern(spec.strip(), null);
        }
        String name = spec.substring(0, slash).strip();
        if (slash + 1 < spec.length() && spec.charAt(slash + 1) == '/') {
            String code = spec.substring(slash + 2).strip();
            return intern(name, code.isEmpty() ? null : code);
        }
        return intern(name, resolver.resolve(spec.substring(slash + 1)));
    }

    /** Interns {@code name}, passing {@code locator} through the resolver. */
    public Source source(String name, String locator) {
        Objects.requireNonNull(name, "name");
        return intern(name.strip(), locator == null ? null : resolver.resolve(locator));
    }

    public Optional<Source> find(String spec) {
        purge();
        int slash = spec.indexOf('/');
        String name = (slash < 0 ? spec : spec.substring(0, slash)).strip();
        Entry entry = interned.get(name);
        return Optional.ofNullable(entry == null ? null : entry.get());
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public int size() {
        purge();
        return interned.size();
    }

    private Source intern(String name, String location) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Source name must not be blank");
        }
        purge();
        Entry entry = interned.get(name);
        Source existing = entry == null ? null : entry.get();
        if (existing == null) {
            Source created = new Source(name, location);
            interned.put(name, new Entry(name, created, collected));
            log.debug("Interned {}", created);
            return created;
        }
        if (location != null && !location.equals(existing.location())) {
            if (existing.location() != null) {
                log.warn("Location {} for source {} does not match existing {}; overwriting", location, name,
                        existing.location());
            }
            existing.relocate(location);
        }
        return existing;
    }

    private void purge() {
        Entry stale;
        while ((stale = (Entry) collected.poll()) != null) {
            if (interned.get(stale.name) == stale) {
                interned.remove(stale.name);
            }
        }
    }

    private static final class Entry extends WeakReference<Source> {
        private final String name;

        Entry(String name, Source source, ReferenceQueue<Source> queue) {
            super(source, queue);
            this.name = name;
        }
    }
}
