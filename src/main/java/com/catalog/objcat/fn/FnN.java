package com.catalog.objcat.fn;

/**
 * Derivation function of any number of field values.
 *
 * The argument array is freshly built for every call and holds the current
 * values of the dependencies in declaration order.
 */
@FunctionalInterface
public interface FnN<R> {
    /**
     * Computes a result from the dependency values.
     *
     * @param args The dependency values, in declaration order.
     * @return The derived value.
     */
    R apply(Object[] args);
}
