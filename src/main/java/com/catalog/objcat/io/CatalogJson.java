package com.catalog.objcat.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@link CatalogDefinition}s as JSON.
 */
public final class CatalogJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private CatalogJson() {
        // Utility class
    }

    /** The shared mapper, also used to convert leaf values back to their classes. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Parses a JSON file into a CatalogDefinition. */
    public static CatalogDefinition parseFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), CatalogDefinition.class);
    }

    /**
     * Parses a JSON string into a CatalogDefinition.
     *
     * @throws IllegalArgumentException if the text is not a valid definition
     */
    public static CatalogDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, CatalogDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed catalog definition: " + e.getOriginalMessage(), e);
        }
    }

    public static String write(CatalogDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not write catalog definition", e);
        }
    }

    public static void writeFile(CatalogDefinition definition, Path path) throws IOException {
        Files.writeString(path, write(definition));
    }
}
