package com.catalog.objcat.engine;

import com.catalog.objcat.api.UnresolvedDependencyException;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.source.Source;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class DependencySourceTest {

    private Source survey;
    private FieldNode node;
    private Field<Double> a;
    private Field<Double> b;
    private List<String> heard;

    @Before
    public void setUp() {
        survey = Source.of("dependency-test-survey");
        node = new FieldNode();
        a = new Field<>("a");
        a.put(survey, 1.0);
        b = new Field<>("b");
        b.put(survey, 2.0);
        node.addField(a);
        node.addField(b);
        heard = new ArrayList<>();
    }

    private DependencySource source(List<?> links) {
        return new DependencySource(links, node,
                (oldValue, newValue, pass) -> heard.add(newValue == null ? "empty" : String.valueOf(newValue.value())));
    }

    @Test
    public void testResolvesPathsLazily() {
        DependencySource deps = source(List.of("a", "b"));
        assertTrue(deps.isPathOnly());
        assertFalse(deps.isResolved());
        assertEquals(0, a.notifierCount());

        assertEquals(List.of(1.0, 2.0), deps.getDependencyValues());
        assertTrue(deps.isResolved());
        assertEquals(1, a.notifierCount());
        assertEquals(Arrays.asList("a", "b"), deps.links());
    }

    @Test
    public void testListenerHearsResolvedFields() {
        DependencySource deps = source(List.of("a"));
        a.put(survey, 3.0);
        assertTrue("Nothing subscribed before resolution", heard.isEmpty());

        deps.populateReferences();
        a.put(survey, 4.0);
        assertEquals(List.of("4.0"), heard);
    }

    @Test
    public void testDirectReferences() {
        Field<Double> loose = new Field<>("loose");
        loose.put(survey, 9.0);
        DependencySource deps = new DependencySource(List.of(loose, "a"), node, null);
        assertFalse(deps.isPathOnly());
        assertTrue(deps.isLive(0));
        assertEquals(Arrays.asList(null, "a"), deps.links());
        assertEquals(List.of(9.0, 1.0), deps.getDependencyValues());
    }

    @Test
    public void testRejectsOtherLinkTypes() {
        try {
            new DependencySource(List.of("a", 42), node, null);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testFailedSlotsReported() {
        DependencySource deps = source(List.of("a", "missing", "^b"));
        try {
            deps.populateReferences();
            fail("Expected UnresolvedDependencyException");
        } catch (UnresolvedDependencyException e) {
            assertArrayEquals(new int[] { 1, 2 }, e.failedIndices());
        }
        assertTrue(deps.isLive(0));
        assertFalse(deps.isLive(1));
    }

    @Test
    public void testNoPathNode() {
        DependencySource deps = new DependencySource(List.of("a"), null, null);
        try {
            deps.getDependencyValues();
            fail("Expected UnresolvedDependencyException");
        } catch (UnresolvedDependencyException e) {
            assertEquals("Missing or dead field(s) cannot be dereferenced without a catalog location",
                    e.getMessage());
        }
    }

    @Test
    public void testRemovedFieldIsDead() {
        DependencySource deps = source(List.of("a"));
        deps.populateReferences();
        node.delField("a");
        assertFalse(deps.isLive(0));

        Field<Double> fresh = new Field<>("a");
        fresh.put(survey, 5.0);
        node.addField(fresh);
        assertEquals(List.of(5.0), deps.getDependencyValues());
        assertEquals("Old subscription is cancelled on relink", 0, a.notifierCount());
        assertEquals(1, fresh.notifierCount());
    }

    @Test
    public void testMovingPathNodeUnlinks() {
        DependencySource deps = source(List.of("a"));
        deps.populateReferences();

        FieldNode other = new FieldNode();
        Field<Double> otherA = new Field<>("a");
        otherA.put(survey, 7.0);
        other.addField(otherA);

        deps.setPathNode(other);
        assertSame(other, deps.pathNode());
        assertEquals(0, a.notifierCount());
        assertFalse(deps.isResolved());
        assertEquals(List.of(7.0), deps.getDependencyValues());
    }

    @Test
    public void testNamesAreUniqueAndNotInterned() {
        DependencySource first = source(List.of("a"));
        DependencySource second = source(List.of("a"));
        assertNotEquals(first.name(), second.name());
        assertFalse(Source.find(first.name()).isPresent());
        assertEquals(1, first.size());
    }
}
