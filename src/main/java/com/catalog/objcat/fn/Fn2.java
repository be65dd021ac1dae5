package com.catalog.objcat.fn;

/**
 * Derivation function of two field values.
 */
@FunctionalInterface
public interface Fn2<A, B, R> {
    R apply(A a, B b);
}
