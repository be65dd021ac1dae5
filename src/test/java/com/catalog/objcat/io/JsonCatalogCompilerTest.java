package com.catalog.objcat.io;

import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.api.SnapshotException;
import com.catalog.objcat.node.Catalog;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.DerivedValue;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.node.ObservedValue;
import com.catalog.objcat.node.StructuredFieldNode;
import com.catalog.objcat.source.Source;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class JsonCatalogCompilerTest {

    private JsonCatalogCompiler compiler;

    @Before
    public void setUp() {
        compiler = new JsonCatalogCompiler(CatalogFixtures.schemas(), CatalogFixtures.recipes());
    }

    private FieldNode compileSingle(String nodeJson) {
        CatalogNode node = compiler.compile("{\"root\": " + nodeJson + "}");
        return (FieldNode) node;
    }

    @Test
    public void testCompileFixture() {
        CatalogNode root = compiler.compile(CatalogFixtures.m31());
        assertTrue(root instanceof Catalog);
        assertEquals("local", ((Catalog) root).name());
        assertEquals(4, root.countNodes());

        FieldNode galaxy = (FieldNode) root.child(0);
        assertEquals("m31", galaxy.get("name"));
        assertEquals(780.0, galaxy.get("dist"));
        Source ned = galaxy.field("dist").get(0).source();
        assertEquals("m31-fixture-ned", ned.name());
        assertEquals("1998AJ....115.1916S", ned.location());
        assertTrue(galaxy.matches("m31"));
    }

    @Test
    public void testStructuredChild() {
        CatalogNode root = compiler.compile(CatalogFixtures.m31());
        StructuredFieldNode star = (StructuredFieldNode) root.child(0).child(0);
        assertEquals("Star", star.schema().name());
        assertFalse(star.isAltered());
        assertEquals(List.of("name", "mag", "flux"), star.fieldNames());
        assertEquals("s1", star.get("name"));
        assertEquals(5.0, star.get("mag"));
        assertEquals("Listed values replace the default", 1, star.field("mag").size());
        assertEquals(0.01, (Double) star.get("flux"), 1e-12);
    }

    @Test
    public void testRecipesLinkAcrossTree() {
        CatalogNode root = compiler.compile(CatalogFixtures.m31());
        FieldNode calc = (FieldNode) root.child(0).child(1);
        assertEquals(5.0, calc.get("total"));
        assertEquals(3900.0, calc.get("scaled"));

        DerivedValue<?> scaled = (DerivedValue<?>) calc.field("scaled").current();
        assertEquals("product", scaled.recipe().get());

        calc.<Object>field("a").put("m31-fixture-sim", 4);
        assertFalse(scaled.isValid());
        assertEquals(5460.0, calc.get("scaled"));
    }

    @Test
    public void testAlteredStructuredNode() {
        FieldNode node = compileSingle("{\"kind\": \"structured\", \"schema\": \"Star\", \"altered\": true,"
                + " \"fields\": ["
                + "  {\"name\": \"mag\", \"values\": [{\"source\": \"compiler-test\", \"value\": 2.5}]},"
                + "  {\"name\": \"color\", \"type\": \"string\","
                + "   \"values\": [{\"source\": \"compiler-test\", \"value\": \"blue\"}]}"
                + "]}");
        StructuredFieldNode star = (StructuredFieldNode) node;
        assertTrue(star.isAltered());
        assertEquals(List.of("mag", "color"), star.fieldNames());
        assertEquals("blue", star.get("color"));
    }

    @Test
    public void testDerivedIndexPlacesSchemaValue() {
        FieldNode node = compileSingle("{\"kind\": \"structured\", \"schema\": \"Star\", \"fields\": ["
                + "  {\"name\": \"flux\", \"derivedIndex\": 1,"
                + "   \"values\": [{\"source\": \"compiler-test\", \"value\": 0.5}]}"
                + "]}");
        StructuredFieldNode star = (StructuredFieldNode) node;
        Field<Object> flux = star.field("flux");
        assertEquals(2, flux.size());
        assertTrue(flux.get(0) instanceof ObservedValue);
        assertSame(star.schemaDerivedValue("flux"), flux.get(1));
        assertEquals(0.5, star.get("flux"));
    }

    @Test
    public void testValueClassConversion() {
        FieldNode node = compileSingle("{\"fields\": ["
                + "  {\"name\": \"spectrum\", \"type\": \"double[]\","
                + "   \"values\": [{\"source\": \"compiler-test\", \"value\": [1, 2.5], \"valueClass\": \"[D\"}]},"
                + "  {\"name\": \"count\", \"type\": \"long\","
                + "   \"values\": [{\"source\": \"compiler-test\", \"value\": 7, \"valueClass\": \"java.lang.Long\"}]}"
                + "]}");
        assertArrayEquals(new double[] { 1.0, 2.5 }, (double[]) node.get("spectrum"), 0.0);
        assertEquals(7L, node.get("count"));
    }

    @Test
    public void testDefaultKindIsFields() {
        FieldNode node = compileSingle("{\"fields\": [{\"name\": \"note\"}]}");
        assertEquals(FieldNode.class, node.getClass());
        assertTrue(node.field("note").isEmpty());
        assertNull(node.parent());
    }

    @Test
    public void testRejectsMalformedDefinitions() {
        String[] bad = {
                "{\"kind\": \"galaxy\"}",
                "{\"kind\": \"structured\"}",
                "{\"kind\": \"catalog\", \"fields\": [{\"name\": \"x\"}]}",
                "{\"kind\": \"fields\", \"children\": [{\"kind\": \"catalog\"}]}",
                "{\"fields\": [{\"name\": \"x\", \"values\": [{\"value\": 1}]}]}",
                "{\"fields\": [{\"name\": \"x\", \"type\": \"float\"}]}",
        };
        for (String json : bad) {
            try {
                compileSingle(json);
                fail("Expected IllegalArgumentException for " + json);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
        try {
            compiler.compile("{\"version\": \"1\"}");
            fail("Expected IllegalArgumentException for a definition without root");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            compiler.compile("{\"root\": ");
            fail("Expected IllegalArgumentException for malformed JSON");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testUnknownRegistryEntries() {
        for (String json : new String[] {
                "{\"kind\": \"structured\", \"schema\": \"Galaxy\"}",
                "{\"fields\": [{\"name\": \"x\", \"values\": [{\"recipe\": \"integral\"}]}]}" }) {
            try {
                compileSingle(json);
                fail("Expected LookupException for " + json);
            } catch (LookupException e) {
                // expected
            }
        }
    }

    @Test
    public void testUnknownValueClass() {
        try {
            compileSingle("{\"fields\": [{\"name\": \"x\","
                    + " \"values\": [{\"source\": \"compiler-test\", \"value\": 1, \"valueClass\": \"no.such.Type\"}]}]}");
            fail("Expected SnapshotException");
        } catch (SnapshotException e) {
            // expected
        }
    }
}
