package com.catalog.objcat.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.catalog.objcat.api.SnapshotException;
import com.catalog.objcat.api.TypeConstraint;
import com.catalog.objcat.config.CatalogSettings;
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
import com.catalog.objcat.util.TypeConstraints;

import lombok.extern.log4j.Log4j2;

/**
 * Capture and restore of catalog subtrees.
 *
 * <p>
 * A snapshot is a {@link CatalogDefinition.NodeDef}: it never records the
 * parent, and records children only on request, so a restored node is always
 * detached. Observed values are written with their class name so Jackson can
 * rebuild them. Recipe derived values are written as their recipe and links;
 * the derived values a schema owns are rebuilt by the schema, only their
 * position is recorded. Other derived values follow the
 * {@link DerivedSnapshotPolicy}.
 */
@Log4j2
public final class CatalogSnapshot {
    private final JsonCatalogCompiler compiler;
    private final DerivedSnapshotPolicy derivedPolicy;

    public CatalogSnapshot(SchemaRegistry schemas, RecipeRegistry recipes) {
        this(schemas, recipes, CatalogSettings.fromSystemProperties().getSnapshotPolicy());
    }

    public CatalogSnapshot(SchemaRegistry schemas, RecipeRegistry recipes, DerivedSnapshotPolicy derivedPolicy) {
        this.compiler = new JsonCatalogCompiler(schemas, recipes);
        this.derivedPolicy = derivedPolicy;
    }

    public DerivedSnapshotPolicy derivedPolicy() {
        return derivedPolicy;
    }

    public CatalogDefinition.NodeDef capture(CatalogNode node, boolean includeChildren) {
        CatalogDefinition.NodeDef def = new CatalogDefinition.NodeDef();
        if (node instanceof Catalog catalog) {
            def.setKind(JsonCatalogCompiler.KIND_CATALOG);
            def.setName(catalog.name());
        } else if (node instanceof StructuredFieldNode structured) {
            def.setKind(JsonCatalogCompiler.KIND_STRUCTURED);
            def.setSchema(structured.schema().name());
            def.setAltered(structured.isAltered() ? Boolean.TRUE : null);
            def.setFields(captureFields(structured, structured));
        } else if (node instanceof FieldNode container) {
            def.setKind(JsonCatalogCompiler.KIND_FIELDS);
            def.setFields(captureFields(container, null));
        } else {
            throw new SnapshotException("Cannot snapshot node type " + node.getClass().getName());
        }
        if (includeChildren && node.childCount() > 0) {
            List<CatalogDefinition.NodeDef> children = new ArrayList<>(node.childCount());
            for (CatalogNode child : node.children()) {
                children.add(capture(child, true));
            }
            def.setChildren(children);
        }
        return def;
    }

    /** Rebuilds a detached node from a captured definition. */
    public CatalogNode restore(CatalogDefinition.NodeDef def) {
        return compiler.compileNode(def, null);
    }

    public String toJson(CatalogNode node, boolean includeChildren) {
        return CatalogJson.write(wrap(capture(node, includeChildren)));
    }

    public CatalogNode fromJson(String json) {
        return restore(root(CatalogJson.parse(json)));
    }

    public void save(CatalogNode node, Path file, boolean includeChildren) throws IOException {
        CatalogJson.writeFile(wrap(capture(node, includeChildren)), file);
        log.info("Saved {} to {}", node, file);
    }

    public CatalogNode load(Path file) throws IOException {
        return restore(root(CatalogJson.parseFile(file)));
    }

    private static CatalogDefinition wrap(CatalogDefinition.NodeDef root) {
        CatalogDefinition definition = new CatalogDefinition();
        definition.setVersion("1");
        definition.setRoot(root);
        return definition;
    }

    private static CatalogDefinition.NodeDef root(CatalogDefinition definition) {
        if (definition.getRoot() == null) {
            throw new SnapshotException("Snapshot has no root node");
        }
        return definition.getRoot();
    }

    private List<CatalogDefinition.FieldDef> captureFields(FieldNode node, StructuredFieldNode structured) {
        List<CatalogDefinition.FieldDef> defs = new ArrayList<>(node.size());
        for (Field<?> field : node.fields()) {
            DerivedValue<?> schemaValue = structured == null ? null : structured.schemaDerivedValue(field.name());
            defs.add(captureField(field, schemaValue));
        }
        return defs;
    }

    private CatalogDefinition.FieldDef captureField(Field<?> field, DerivedValue<?> schemaValue) {
        CatalogDefinition.FieldDef fd = new CatalogDefinition.FieldDef();
        fd.setName(field.name());
        fd.setType(typeName(field));
        List<CatalogDefinition.ValueDef> values = new ArrayList<>(field.size());
        List<? extends FieldValue<?>> entries = field.entries();
        for (int i = 0; i < entries.size(); i++) {
            FieldValue<?> entry = entries.get(i);
            if (entry == schemaValue) {
                fd.setDerivedIndex(values.size());
            } else if (entry instanceof ObservedValue<?> observed) {
                values.add(observedDef(observed));
            } else if (entry instanceof DerivedValue<?> derived) {
                CatalogDefinition.ValueDef vd = derivedDef(field, derived);
                if (vd != null) {
                    values.add(vd);
                }
            }
        }
        fd.setValues(values);
        return fd;
    }

    private static CatalogDefinition.ValueDef observedDef(ObservedValue<?> observed) {
        CatalogDefinition.ValueDef vd = new CatalogDefinition.ValueDef();
        vd.setSource(observed.source().spec());
        vd.setValue(observed.value());
        vd.setValueClass(observed.value() == null ? null : observed.value().getClass().getName());
        return vd;
    }

    private CatalogDefinition.ValueDef derivedDef(Field<?> field, DerivedValue<?> derived) {
        if (derived.recipe().isPresent() && derived.source().isPathOnly()) {
            CatalogDefinition.ValueDef vd = new CatalogDefinition.ValueDef();
            vd.setRecipe(derived.recipe().get());
            vd.setLinks(derived.links());
            return vd;
        }
        String message = "Cannot snapshot derived value of field " + field.name()
                + " that is neither schema-owned nor a path-linked recipe";
        if (derivedPolicy == DerivedSnapshotPolicy.FAIL) {
            throw new SnapshotException(message);
        }
        log.warn("{}; dropping it", message);
        return null;
    }

    private static String typeName(Field<?> field) {
        TypeConstraint type = field.type();
        if (type == TypeConstraint.ANY) {
            return null;
        }
        String name = TypeConstraints.nameOf(type).orElse(null);
        if (name == null) {
            log.warn("Type constraint {} of field {} has no name; the snapshot drops it", type.describe(),
                    field.name());
        }
        return name;
    }
}
