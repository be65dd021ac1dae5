package com.catalog.objcat.fn;

/**
 * Derivation function of three field values.
 */
@FunctionalInterface
public interface Fn3<A, B, C, R> {
    R apply(A a, B b, C c);
}
