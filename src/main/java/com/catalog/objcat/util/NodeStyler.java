package com.catalog.objcat.util;

import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.FieldNode;

/**
 * Chooses how {@link TreeExplain} draws each node.
 */
public interface NodeStyler {

    /** Labels nodes with their string form; field containers are records. */
    NodeStyler DEFAULT = node -> new NodeStyle(node.toString(), node instanceof FieldNode ? "record" : "ellipse");

    NodeStyle style(CatalogNode node);

    /** Whether the node's fields are drawn inside it. */
    default boolean isFieldContainer(CatalogNode node) {
        return node instanceof FieldNode;
    }
}
