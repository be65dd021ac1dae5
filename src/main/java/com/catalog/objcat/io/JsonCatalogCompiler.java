package com.catalog.objcat.io;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.catalog.objcat.api.SnapshotException;
import com.catalog.objcat.dsl.DerivationRecipe;
import com.catalog.objcat.dsl.RecipeRegistry;
import com.catalog.objcat.dsl.SchemaRegistry;
import com.catalog.objcat.node.Catalog;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.DerivedValue;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;
import com.catalog.objcat.node.FieldValue;
import com.catalog.objcat.node.ObservedValue;
import com.catalog.objcat.node.StructuredFieldNode;
import com.catalog.objcat.source.Source;
import com.catalog.objcat.util.TypeConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Builds live catalog trees from {@link CatalogDefinition}s, looking up
 * schemas, recipes and named type constraints.
 */
@Log4j2
public final class JsonCatalogCompiler {
    public static final String KIND_CATALOG = "catalog";
    public static final String KIND_FIELDS = "fields";
    public static final String KIND_STRUCTURED = "structured";

    private final SchemaRegistry schemas;
    private final RecipeRegistry recipes;
    private final ObjectMapper mapper = CatalogJson.mapper();

    public JsonCatalogCompiler() {
        this(new SchemaRegistry(), new RecipeRegistry());
    }

    public JsonCatalogCompiler(SchemaRegistry schemas, RecipeRegistry recipes) {
        this.schemas = schemas;
        this.recipes = recipes;
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    public RecipeRegistry recipes() {
        return recipes;
    }

    /**
     * Compiles the definition into a tree.
     *
     * @return the root node
     */
    public CatalogNode compile(CatalogDefinition definition) {
        if (definition.getRoot() == null) {
            throw new IllegalArgumentException("Catalog definition has no root node");
        }
        CatalogNode root = compileNode(definition.getRoot(), null);
        log.info("Compiled catalog definition with {} nodes", root.countNodes());
        return root;
    }

    public CatalogNode compile(String json) {
        return compile(CatalogJson.parse(json));
    }

    /** Compiles {@code def} and its subtree under {@code parent}, which may be null. */
    public CatalogNode compileNode(CatalogDefinition.NodeDef def, CatalogNode parent) {
        String kind = def.getKind() == null ? KIND_FIELDS : def.getKind().strip().toLowerCase(Locale.ROOT);
        CatalogNode node;
        switch (kind) {
            case KIND_CATALOG:
                if (parent != null) {
                    throw new IllegalArgumentException("A catalog node must be a root: " + def.getName());
                }
                if (def.getFields() != null && !def.getFields().isEmpty()) {
                    throw new IllegalArgumentException("A catalog node holds no fields: " + def.getName());
                }
                node = def.getName() == null ? new Catalog() : new Catalog(def.getName());
                break;
            case KIND_FIELDS:
                node = compileFields(new FieldNode(parent), def.getFields());
                break;
            case KIND_STRUCTURED:
                node = compileStructured(def, parent);
                break;
            default:
                throw new IllegalArgumentException("Unknown node kind: " + def.getKind());
        }
        if (def.getChildren() != null) {
            for (CatalogDefinition.NodeDef child : def.getChildren()) {
                compileNode(child, node);
            }
        }
        return node;
    }

    private FieldNode compileFields(FieldNode node, List<CatalogDefinition.FieldDef> fields) {
        if (fields == null) {
            return node;
        }
        for (CatalogDefinition.FieldDef fd : fields) {
            Field<Object> field = new Field<>(fd.getName(), TypeConstraints.named(fd.getType()));
            node.addField(field);
            appendValues(field, fd.getValues());
        }
        return node;
    }

    private StructuredFieldNode compileStructured(CatalogDefinition.NodeDef def, CatalogNode parent) {
        if (def.getSchema() == null) {
            throw new IllegalArgumentException("Structured node without a schema");
        }
        StructuredFieldNode node = new StructuredFieldNode(parent, schemas.get(def.getSchema()));
        if (def.getFields() != null) {
            for (CatalogDefinition.FieldDef fd : def.getFields()) {
                if (node.hasField(fd.getName())) {
                    fillSchemaField(node, node.field(fd.getName()), fd);
                } else {
                    Field<Object> field = new Field<>(fd.getName(), TypeConstraints.named(fd.getType()));
                    node.addField(field);
                    appendValues(field, fd.getValues());
                }
            }
            if (Boolean.TRUE.equals(def.getAltered())) {
                List<String> listed = def.getFields().stream().map(CatalogDefinition.FieldDef::getName).toList();
                for (String name : node.fieldNames()) {
                    if (!listed.contains(name)) {
                        node.delField(name);
                    }
                }
            }
        }
        return node;
    }

    /**
     * Replaces everything but the schema's derived value with the listed
     * values, then moves the derived value to its recorded position.
     */
    private void fillSchemaField(StructuredFieldNode node, Field<Object> field, CatalogDefinition.FieldDef fd) {
        DerivedValue<?> schemaValue = node.schemaDerivedValue(field.name());
        if (fd.getValues() != null) {
            for (FieldValue<Object> existing : List.copyOf(field.entries())) {
                if (existing != schemaValue) {
                    field.delete(existing.source());
                }
            }
            appendValues(field, fd.getValues());
        }
        if (schemaValue != null && fd.getDerivedIndex() != null) {
            @SuppressWarnings("unchecked")
            DerivedValue<Object> moving = (DerivedValue<Object>) schemaValue;
            field.delete(moving.source());
            field.insert(Math.max(0, Math.min(fd.getDerivedIndex(), field.size())), moving);
        }
    }

    private void appendValues(Field<Object> field, List<CatalogDefinition.ValueDef> values) {
        if (values == null) {
            return;
        }
        for (CatalogDefinition.ValueDef vd : values) {
            field.add(toFieldValue(vd));
        }
    }

    @SuppressWarnings("unchecked")
    private FieldValue<Object> toFieldValue(CatalogDefinition.ValueDef vd) {
        if (vd.getRecipe() != null) {
            DerivationRecipe<?> recipe = recipes.get(vd.getRecipe());
            Map<String, String> links = vd.getLinks() == null ? Map.of() : vd.getLinks();
            return (DerivedValue<Object>) recipe.instantiate(links);
        }
        if (vd.getSource() == null) {
            throw new IllegalArgumentException("Observed value without a source: " + vd.getValue());
        }
        return new ObservedValue<>(convert(vd.getValue(), vd.getValueClass()), Source.of(vd.getSource()));
    }

    private Object convert(Object raw, String valueClass) {
        if (raw == null || valueClass == null) {
            return raw;
        }
        try {
            return mapper.convertValue(raw, Class.forName(valueClass));
        } catch (ClassNotFoundException e) {
            throw new SnapshotException("Unknown value class " + valueClass, e);
        } catch (IllegalArgumentException e) {
            throw new SnapshotException("Cannot convert " + raw + " to " + valueClass, e);
        }
    }
}
