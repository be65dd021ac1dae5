package com.catalog.objcat.engine;

import com.catalog.objcat.api.CycleException;
import com.catalog.objcat.api.Subscription;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class NotifierListTest {

    @Test
    public void testListenersAddedDuringRoundWaitForNextRound() {
        NotifierList list = new NotifierList();
        List<String> calls = new ArrayList<>();
        list.add((o, n, p) -> {
            calls.add("first");
            if (list.heldCount() == 1) {
                list.add((o2, n2, p2) -> calls.add("late"));
            }
        });

        list.fire(null, null, new InvalidationPass());
        assertEquals(List.of("first"), calls);

        list.fire(null, null, new InvalidationPass());
        assertEquals(List.of("first", "first", "late"), calls);
    }

    @Test
    public void testCancelledHandlesPrunedAfterRound() {
        NotifierList list = new NotifierList();
        List<String> calls = new ArrayList<>();
        Subscription first = list.add((o, n, p) -> calls.add("first"));
        try (Subscription second = list.add((o, n, p) -> calls.add("second"))) {
            first.cancel();
            assertEquals(1, list.liveCount());
            assertEquals(2, list.heldCount());

            list.fire(null, null, new InvalidationPass());
            assertEquals(List.of("second"), calls);
            assertEquals(1, list.heldCount());
            assertTrue(second.isActive());
        }
        assertEquals(0, list.liveCount());
    }

    @Test
    public void testPassRejectsReentry() {
        InvalidationPass pass = new InvalidationPass();
        Object participant = new Object();
        pass.enter(participant);
        assertTrue(pass.isInFlight(participant));
        assertEquals(1, pass.depth());
        try {
            pass.enter(participant);
            fail("Expected CycleException");
        } catch (CycleException e) {
            // expected
        }
        pass.exit(participant);
        assertFalse(pass.isInFlight(participant));
        pass.enter(participant);
    }
}
