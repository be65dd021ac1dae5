package com.catalog.objcat.util;

import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.node.Catalog;
import com.catalog.objcat.node.DerivedValue;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.source.Source;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TreeExplainTest {

    private Catalog catalog;
    private FieldNode galaxy;
    private FieldNode star;
    private TreeExplain explain;

    @Before
    public void setUp() {
        Source survey = Source.of("explain-test-survey");
        catalog = new Catalog("sky");
        galaxy = new FieldNode(catalog);
        Field<Double> dist = new Field<>("dist", TypeConstraints.instanceOf(Double.class));
        dist.put(survey, 780.0);
        galaxy.addField(dist);

        star = new FieldNode(galaxy);
        Field<Double> mag = new Field<>("mag");
        mag.put(survey, 5.0);
        star.addField(mag);
        Field<Double> scaled = new Field<>("scaled");
        DerivedValue<Double> dv = DerivedValue.of((Double a, Double b) -> a * b, "mag", "^dist");
        dv.setFailurePolicy(FailurePolicy.RAISE);
        scaled.add(dv);
        star.addField(scaled);
        star.addField(new Field<>("note"));

        explain = new TreeExplain();
    }

    @Test
    public void testExplainNode() {
        String text = explain.explainNode(star);
        assertTrue(text, text.startsWith("Node: FieldNode with fields [mag, scaled, note]\n"));
        assertTrue(text, text.contains("  Type: FieldNode\n"));
        assertTrue(text, text.contains("  Parent: FieldNode with fields [dist]\n"));
        assertTrue(text, text.contains("  Children: 0\n"));
        assertTrue(text, text.contains("  Field mag (any)\n    * explain-test-survey = 5.0\n"));
        assertTrue(text, text.contains("  Field scaled (any)\n    * derived {mag=mag, ^dist=^dist} [stale] = 3900.0\n"));
        assertTrue(text, text.contains("  Field note (any)\n    <empty>\n"));
    }

    @Test
    public void testExplainFieldMarksValidity() {
        Field<Double> scaled = star.field("scaled");
        assertTrue(explain.explainField(scaled).contains("[stale] = 3900.0"));
        assertTrue(explain.explainField(scaled).contains("[valid] = 3900.0"));
    }

    @Test
    public void testDumpTree() {
        assertEquals("Catalog sky\n"
                + "  FieldNode with fields [dist]\n"
                + "    FieldNode with fields [mag, scaled, note]\n", explain.dumpTree(catalog));
    }

    @Test
    public void testMermaid() {
        String mermaid = explain.toMermaid(catalog);
        assertTrue(mermaid, mermaid.startsWith("graph TD\n"));
        assertTrue(mermaid, mermaid.contains("  n0[\"Catalog sky\"]\n"));
        assertTrue(mermaid, mermaid.contains("  n1[\"FieldNode with fields [dist]<br/>dist: 780.0\"]\n"));
        assertTrue(mermaid, mermaid.contains("<br/>scaled: 3900.0<br/>note: null\"]\n"));
        assertTrue(mermaid, mermaid.contains("  n0 --> n1\n"));
        assertTrue(mermaid, mermaid.contains("  n1 --> n2\n"));
    }

    @Test
    public void testDot() {
        String dot = explain.toDot(catalog);
        assertTrue(dot, dot.startsWith("digraph catalog {\n"));
        assertTrue(dot, dot.contains("  n0 [shape=ellipse, label=\"Catalog sky\"];\n"));
        assertTrue(dot, dot.contains("  n1 [shape=record, label=\"{FieldNode with fields [dist]|dist: 780.0\\l}\"];\n"));
        assertTrue(dot, dot.contains("  n1 -> n2;\n"));
        assertTrue(dot, dot.endsWith("}\n"));
    }

    @Test
    public void testWithoutFields() {
        TreeExplain plain = new TreeExplain(NodeStyler.DEFAULT, false);
        String mermaid = plain.toMermaid(galaxy);
        assertTrue(mermaid, mermaid.contains("  n0[\"FieldNode with fields [dist]\"]\n"));
        assertFalse(mermaid, mermaid.contains("<br/>"));
    }
}
