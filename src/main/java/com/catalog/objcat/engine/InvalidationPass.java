package com.catalog.objcat.engine;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import com.catalog.objcat.api.CycleException;

/**
 * Token threaded through one chain of change notifications.
 *
 * <p>
 * Tracks which derived values are currently being invalidated on the call
 * stack. Entering a participant twice means the notification chain loops
 * back onto itself.
 */
public final class InvalidationPass {
    private final Set<Object> inFlight = Collections.newSetFromMap(new IdentityHashMap<>());

    public void enter(Object participant) {
        if (!inFlight.add(participant)) {
            throw new CycleException("Attempting to invalidate " + participant + " results in a cycle");
        }
    }

    public void exit(Object participant) {
        inFlight.remove(participant);
    }

    public boolean isInFlight(Object participant) {
        return inFlight.contains(participant);
    }

    public int depth() {
        return inFlight.size();
    }
}
