package com.catalog.objcat.dsl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.catalog.objcat.api.LookupException;

/**
 * Registry mapping schema names to {@link NodeSchema}s.
 */
public final class SchemaRegistry {
    private final Map<String, NodeSchema> schemas = new LinkedHashMap<>();

    public SchemaRegistry register(NodeSchema schema) {
        if (schemas.containsKey(schema.name())) {
            throw new IllegalArgumentException("Duplicate schema name: " + schema.name());
        }
        schemas.put(schema.name(), schema);
        return this;
    }

    public NodeSchema get(String name) {
        NodeSchema schema = schemas.get(name);
        if (schema == null) {
            throw new LookupException("Unknown schema: " + name);
        }
        return schema;
    }

    public Optional<NodeSchema> find(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(schemas.keySet());
    }
}
