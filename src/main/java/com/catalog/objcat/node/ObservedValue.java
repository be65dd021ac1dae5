package com.catalog.objcat.node;

import java.util.Objects;

import com.catalog.objcat.source.Source;

/**
 * Immutable literal value tagged with the source it was observed in.
 */
public record ObservedValue<T>(T value, Source source) implements FieldValue<T> {

    public ObservedValue {
        Objects.requireNonNull(source, "source");
    }

    public static <T> ObservedValue<T> of(T value, String source) {
        return new ObservedValue<>(value, Source.of(source));
    }

    @Override
    public String toString() {
        return "Value " + value + ":" + source;
    }
}
