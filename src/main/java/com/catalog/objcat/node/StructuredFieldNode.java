package com.catalog.objcat.node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.catalog.objcat.dsl.FieldDescriptor;
import com.catalog.objcat.dsl.NodeSchema;

import lombok.extern.log4j.Log4j2;

/**
 * Field node whose fields are laid out by a {@link NodeSchema}.
 *
 * <p>
 * Every instance gets fresh fields built from the schema's descriptors; a
 * derived field gets its recipe's derived value in front. Adding or removing
 * fields afterwards marks the node altered until {@link #revert()}.
 */
@Log4j2
public class StructuredFieldNode extends FieldNode {
    private final NodeSchema schema;
    private final Map<String, DerivedValue<?>> schemaDerived = new HashMap<>();
    private boolean altered;

    public StructuredFieldNode(NodeSchema schema) {
        this(null, schema);
    }

    public StructuredFieldNode(CatalogNode parent, NodeSchema schema) {
        super(parent);
        this.schema = Objects.requireNonNull(schema, "schema");
        buildFields(schema.fields());
    }

    private void buildFields(List<FieldDescriptor> descriptors) {
        List<FieldDescriptor> derived = new ArrayList<>();
        for (FieldDescriptor descriptor : descriptors) {
            super.addField(descriptor.newField());
            if (descriptor.isDerived()) {
                derived.add(descriptor);
            }
        }
        for (FieldDescriptor descriptor : derived) {
            DerivedValue<Object> dv = descriptor.newDerivedValue(this);
            this.<Object>field(descriptor.name()).insert(0, dv);
            schemaDerived.put(descriptor.name(), dv);
        }
    }

    public NodeSchema schema() {
        return schema;
    }

    public boolean isAltered() {
        return altered;
    }

    /** The derived value the schema placed in {@code fieldName}, or null. */
    public DerivedValue<?> schemaDerivedValue(String fieldName) {
        return schemaDerived.get(fieldName);
    }

    @Override
    public void addField(Field<?> field) {
        super.addField(field);
        altered = true;
    }

    @Override
    public void delField(String name) {
        super.delField(name);
        schemaDerived.remove(name);
        altered = true;
    }

    /**
     * Restores the schema's field set: extra fields are removed, missing ones
     * recreated fresh, and the schema order reinstated.
     */
    public void revert() {
        List<String> schemaNames = schema.fieldNames();
        for (String name : fieldNames()) {
            if (!schemaNames.contains(name)) {
                super.delField(name);
                schemaDerived.remove(name);
            }
        }
        List<FieldDescriptor> missing = new ArrayList<>();
        for (FieldDescriptor descriptor : schema.fields()) {
            if (!hasField(descriptor.name())) {
                missing.add(descriptor);
            }
        }
        buildFields(missing);
        reorderFields(schemaNames);
        altered = false;
        log.debug("Reverted {} to schema {}", this, schema.name());
    }

    @Override
    public boolean matches(String qualifier) {
        return schema.name().equals(qualifier) || super.matches(qualifier);
    }

    @Override
    public String toString() {
        return schema.name() + " with fields " + fieldNames();
    }
}
