package com.catalog.objcat.util;

import com.catalog.objcat.api.TypeConstraint;
import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.*;

public class TypeConstraintsTest {

    @Test
    public void testInstanceOfBoxesPrimitives() {
        TypeConstraint doubles = TypeConstraints.instanceOf(double.class);
        assertTrue(doubles.accepts(1.5));
        assertFalse(doubles.accepts(1));
        assertEquals("Double", doubles.describe());
        assertEquals(Optional.of(Double.class), doubles.valueClass());
    }

    @Test
    public void testArrayOf() {
        TypeConstraint doubles = TypeConstraints.arrayOf(double.class);
        assertTrue(doubles.accepts(new double[] { 1.0 }));
        assertFalse(doubles.accepts(new Double[] { 1.0 }));
        assertFalse(doubles.accepts(1.0));
        assertEquals("double[]", doubles.describe());
        assertEquals(Optional.of(double[].class), doubles.valueClass());
    }

    @Test
    public void testAnyOf() {
        TypeConstraint numberOrText = TypeConstraints.anyOf(Number.class, String.class);
        assertTrue(numberOrText.accepts(3));
        assertTrue(numberOrText.accepts("three"));
        assertFalse(numberOrText.accepts(Boolean.TRUE));
        assertEquals("[Number, String]", numberOrText.describe());
        assertFalse(numberOrText.valueClass().isPresent());
    }

    @Test
    public void testMatching() {
        TypeConstraint positive = TypeConstraints.matching(v -> v instanceof Number n && n.doubleValue() > 0,
                "positive number");
        assertTrue(positive.accepts(2));
        assertFalse(positive.accepts(-2));
        assertEquals("positive number", positive.describe());
        assertFalse(TypeConstraints.nameOf(positive).isPresent());
    }

    @Test
    public void testNamedTypes() {
        assertSame(TypeConstraint.ANY, TypeConstraints.named(null));
        assertSame(TypeConstraint.ANY, TypeConstraints.named(" "));
        assertSame(TypeConstraint.ANY, TypeConstraints.named("any"));
        assertTrue(TypeConstraints.named("double").accepts(2.0));
        assertTrue(TypeConstraints.named("number").accepts(2));
        assertTrue(TypeConstraints.named("double[]").accepts(new double[0]));
        assertTrue(TypeConstraints.named("string[]").accepts(new String[0]));
        assertTrue(TypeConstraints.named("class:java.time.LocalDate").accepts(java.time.LocalDate.of(2004, 1, 1)));
        assertTrue(TypeConstraints.named("array:java.lang.Integer").accepts(new Integer[0]));
    }

    @Test
    public void testUnknownNames() {
        for (String bad : new String[] { "float", "class:no.such.Type", "array:no.such.Type" }) {
            try {
                TypeConstraints.named(bad);
                fail("Expected IllegalArgumentException for " + bad);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test
    public void testNameOfRoundTrips() {
        for (String name : new String[] { "any", "string", "integer", "double", "number", "double[]", "int[]",
                "class:java.time.LocalDate", "array:java.lang.Integer" }) {
            assertEquals(Optional.of(name), TypeConstraints.nameOf(TypeConstraints.named(name)));
        }
        assertEquals(Optional.of("double"), TypeConstraints.nameOf(TypeConstraints.instanceOf(Double.class)));
    }
}
