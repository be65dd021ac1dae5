package com.catalog.objcat.node;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Narrows the results of {@link CatalogNode#visit}. A predicate keeps the
 * visitor from being called on rejected nodes; a sentinel removes results
 * identical to it after the visit.
 */
public final class VisitFilter<R> {
    private static final VisitFilter<Object> NONE = new VisitFilter<>(null, null, false);

    private final Predicate<? super CatalogNode> predicate;
    private final R sentinel;
    private final boolean hasSentinel;

    private VisitFilter(Predicate<? super CatalogNode> predicate, R sentinel, boolean hasSentinel) {
        this.predicate = predicate;
        this.sentinel = sentinel;
        this.hasSentinel = hasSentinel;
    }

    @SuppressWarnings("unchecked")
    public static <R> VisitFilter<R> none() {
        return (VisitFilter<R>) NONE;
    }

    public static <R> VisitFilter<R> where(Predicate<? super CatalogNode> predicate) {
        return new VisitFilter<>(Objects.requireNonNull(predicate, "predicate"), null, false);
    }

    /** Drops every visitor result that is the same object as {@code sentinel}. */
    public static <R> VisitFilter<R> excluding(R sentinel) {
        return new VisitFilter<>(null, sentinel, true);
    }

    boolean admits(CatalogNode node) {
        return predicate == null || predicate.test(node);
    }

    boolean rejectsResult(Object result) {
        return hasSentinel && result == sentinel;
    }

    boolean hasSentinel() {
        return hasSentinel;
    }
}
