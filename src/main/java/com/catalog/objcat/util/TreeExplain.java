package com.catalog.objcat.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.catalog.objcat.api.FailurePolicy;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.DerivedValue;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.node.FieldValue;
import com.catalog.objcat.node.Traversal;

/**
 * Diagnostic utility for inspecting catalog trees.
 *
 * <p>
 * Produces text dumps of nodes and fields and exports trees as Mermaid or
 * Graphviz DOT diagrams. Rendering reads derived values with
 * {@link FailurePolicy#SKIP}, so a broken derivation shows as null instead of
 * failing the dump.
 */
public final class TreeExplain {
    private final NodeStyler styler;
    private final boolean drawFields;

    public TreeExplain() {
        this(NodeStyler.DEFAULT, true);
    }

    public TreeExplain(NodeStyler styler, boolean drawFields) {
        this.styler = styler;
        this.drawFields = drawFields;
    }

    /**
     * Dumps the fields of a single node.
     */
    public String explainNode(FieldNode node) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Parent: ").append(node.parent() == null ? "none" : node.parent()).append('\n')
                .append("  Children: ").append(node.childCount()).append('\n');
        for (Field<?> field : node.fields()) {
            sb.append(explainField(field));
        }
        return sb.toString();
    }

    /**
     * Dumps every entry of a field, current first.
     */
    public String explainField(Field<?> field) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("  Field ").append(field.name())
                .append(" (").append(field.type().describe()).append(")\n");
        if (field.isEmpty()) {
            sb.append("    <empty>\n");
        }
        List<? extends FieldValue<?>> entries = field.entries();
        for (int i = 0; i < entries.size(); i++) {
            FieldValue<?> entry = entries.get(i);
            sb.append(i == 0 ? "    * " : "      ");
            if (entry instanceof DerivedValue<?> derived) {
                sb.append(derived.recipe().orElse("derived")).append(' ').append(derived.links())
                        .append(derived.isValid() ? " [valid]" : " [stale]")
                        .append(" = ").append(derived.value(FailurePolicy.SKIP));
            } else {
                sb.append(entry.source().name()).append(" = ").append(entry.value());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Indented pre-order listing of a subtree. */
    public String dumpTree(CatalogNode root) {
        StringBuilder sb = new StringBuilder(256);
        dump(root, 0, sb);
        return sb.toString();
    }

    private void dump(CatalogNode node, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(styler.style(node).label()).append('\n');
        for (CatalogNode child : node.children()) {
            dump(child, depth + 1, sb);
        }
    }

    /**
     * Exports the subtree as a Mermaid flowchart.
     */
    public String toMermaid(CatalogNode root) {
        Map<CatalogNode, Integer> ids = number(root);
        StringBuilder sb = new StringBuilder(512);
        sb.append("graph TD\n");
        for (Map.Entry<CatalogNode, Integer> e : ids.entrySet()) {
            CatalogNode node = e.getKey();
            String label = escape(styler.style(node).label());
            if (drawFields && styler.isFieldContainer(node) && node instanceof FieldNode container) {
                for (String line : fieldLines(container)) {
                    label = label + "<br/>" + escape(line);
                }
            }
            sb.append("  n").append(e.getValue()).append("[\"").append(label).append("\"]\n");
        }
        appendEdges(ids, sb, " --> ", "");
        return sb.toString();
    }

    /**
     * Exports the subtree as a Graphviz DOT digraph; field containers are
     * drawn as records listing their current field values.
     */
    public String toDot(CatalogNode root) {
        Map<CatalogNode, Integer> ids = number(root);
        StringBuilder sb = new StringBuilder(512);
        sb.append("digraph catalog {\n");
        for (Map.Entry<CatalogNode, Integer> e : ids.entrySet()) {
            CatalogNode node = e.getKey();
            NodeStyle style = styler.style(node);
            String label = dotEscape(style.label());
            if (drawFields && styler.isFieldContainer(node) && node instanceof FieldNode container) {
                StringBuilder record = new StringBuilder("{").append(label).append('|');
                for (String line : fieldLines(container)) {
                    record.append(dotEscape(line)).append("\\l");
                }
                label = record.append('}').toString();
            }
            sb.append("  n").append(e.getValue())
                    .append(" [shape=").append(style.shape())
                    .append(", label=\"").append(label).append("\"];\n");
        }
        appendEdges(ids, sb, " -> ", ";");
        sb.append("}\n");
        return sb.toString();
    }

    private static Map<CatalogNode, Integer> number(CatalogNode root) {
        Map<CatalogNode, Integer> ids = new LinkedHashMap<>();
        List<CatalogNode> nodes = root.visit(n -> n, Traversal.PREORDER);
        for (CatalogNode node : nodes) {
            ids.put(node, ids.size());
        }
        return ids;
    }

    private static void appendEdges(Map<CatalogNode, Integer> ids, StringBuilder sb, String arrow, String end) {
        for (Map.Entry<CatalogNode, Integer> e : ids.entrySet()) {
            Integer parentId = e.getKey().parent() == null ? null : ids.get(e.getKey().parent());
            if (parentId != null) {
                sb.append("  n").append(parentId).append(arrow).append('n').append(e.getValue()).append(end)
                        .append('\n');
            }
        }
    }

    private static List<String> fieldLines(FieldNode node) {
        List<String> lines = new ArrayList<>(node.size());
        for (Field<?> field : node.fields()) {
            Object value = field.isEmpty() ? null
                    : field.current() instanceof DerivedValue<?> d ? d.value(FailurePolicy.SKIP)
                            : field.currentValue();
            lines.add(field.name() + ": " + value);
        }
        return lines;
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String dotEscape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("{", "\\{").replace("}", "\\}")
                .replace("|", "\\|").replace("<", "\\<").replace(">", "\\>");
    }
}
