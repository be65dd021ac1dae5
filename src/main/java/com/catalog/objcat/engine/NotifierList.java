package com.catalog.objcat.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.catalog.objcat.api.ChangeListener;
import com.catalog.objcat.api.Subscription;
import com.catalog.objcat.node.FieldValue;

/**
 * Ordered change listeners of a single field.
 *
 * <p>
 * Listeners fire in registration order. Listeners registered during a round
 * join from the next round on. Cancelled handles are skipped and removed once
 * the round completes.
 */
public final class NotifierList {
    private final List<Handle> handles = new ArrayList<>();

    public Subscription add(ChangeListener listener) {
        Handle handle = new Handle(Objects.requireNonNull(listener, "listener"));
        handles.add(handle);
        return handle;
    }

    public void fire(FieldValue<?> oldValue, FieldValue<?> newValue, InvalidationPass pass) {
        if (handles.isEmpty()) {
            return;
        }
        Handle[] round = handles.toArray(new Handle[0]);
        boolean sawCancelled = false;
        for (Handle handle : round) {
            if (!handle.active) {
                sawCancelled = true;
                continue;
            }
            handle.listener.onValueChange(oldValue, newValue, pass);
        }
        if (sawCancelled) {
            handles.removeIf(h -> !h.active);
        }
    }

    /** Listeners not yet cancelled. */
    public int liveCount() {
        int n = 0;
        for (Handle h : handles) {
            if (h.active) {
                n++;
            }
        }
        return n;
    }

    /** Handles still held, cancelled ones included until the next round prunes them. */
    public int heldCount() {
        return handles.size();
    }

    private static final class Handle implements Subscription {
        private final ChangeListener listener;
        private boolean active = true;

        Handle(ChangeListener listener) {
            this.listener = listener;
        }

        @Override
        public void cancel() {
            active = false;
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
