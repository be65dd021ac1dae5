package com.catalog.objcat.fn;

/**
 * Derivation function of one field value.
 *
 * <p>
 * Used by
 * {@link com.catalog.objcat.node.DerivedValue#of(Fn1, Object)} to derive a
 * value from the current value of a single other field.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code (Double x) -> x * 2.0}</li>
 * <li>{@code String::length}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1<A, R> {
    /**
     * Applies the function.
     *
     * @param a The current value of the dependency, possibly null.
     * @return The derived value.
     */
    R apply(A a);
}
