package com.catalog.objcat.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a catalog tree, used both for hand-written catalog
 * definitions and for snapshots.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogDefinition {
    private String version;
    private NodeDef root;

    /** One node and, optionally, its subtree. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        /** {@code catalog}, {@code fields} (default) or {@code structured}. */
        private String kind;
        private String name;
        private String schema;
        private Boolean altered;
        private List<FieldDef> fields;
        private List<NodeDef> children;
    }

    /** A field with its values in order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class FieldDef {
        private String name;
        private String type;
        private List<ValueDef> values;
        /** Position of the schema's derived value among the values, structured nodes only. */
        private Integer derivedIndex;
    }

    /** An observed value, or a recipe derived value when {@code recipe} is set. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ValueDef {
        private String source;
        private Object value;
        private String valueClass;
        private String recipe;
        private Map<String, String> links;
    }
}
