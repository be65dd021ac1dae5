package com.catalog.objcat.api;

/**
 * Handle returned when registering a {@link ChangeListener} on a field.
 * Cancelled handles are skipped and pruned on the next notification round.
 */
public interface Subscription extends AutoCloseable {

    void cancel();

    boolean isActive();

    @Override
    default void close() {
        cancel();
    }
}
