package com.catalog.objcat.api;

import com.catalog.objcat.engine.InvalidationPass;
import com.catalog.objcat.node.FieldValue;

/**
 * Receives current-value changes of a field.
 *
 * <p>
 * Called <b>before</b> the change is committed: the field still holds
 * {@code oldValue} as its current entry. Throwing aborts the mutation.
 */
@FunctionalInterface
public interface ChangeListener {

    /**
     * @param oldValue the current entry before the change, or null if the field
     *                 was empty
     * @param newValue the entry about to become current, or null if the field
     *                 will be empty
     * @param pass     the invalidation pass this change belongs to
     */
    void onValueChange(FieldValue<?> oldValue, FieldValue<?> newValue, InvalidationPass pass);
}
