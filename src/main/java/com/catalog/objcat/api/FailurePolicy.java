package com.catalog.objcat.api;

import java.util.Locale;

/**
 * What a derived value does when its computation fails.
 */
public enum FailurePolicy {
    /** Propagate the failure to the reader. */
    RAISE,
    /** Log a warning, yield null and stay invalid. */
    WARN,
    /** Yield null and stay invalid. */
    SKIP,
    /** Yield null and cache it as valid until the next invalidation. */
    IGNORE;

    public static FailurePolicy parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure policy: " + text, e);
        }
    }
}
