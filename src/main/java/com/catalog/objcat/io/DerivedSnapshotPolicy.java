package com.catalog.objcat.io;

import java.util.Locale;

/**
 * What capturing a snapshot does with a derived value that can't be written
 * as a recipe: one bound to direct field references or built from a bare
 * function.
 */
public enum DerivedSnapshotPolicy {
    /** Abort the capture with a {@link com.catalog.objcat.api.SnapshotException}. */
    FAIL,
    /** Leave the value out and log a warning. */
    DROP;

    public static DerivedSnapshotPolicy parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown derived snapshot policy: " + text, e);
        }
    }
}
