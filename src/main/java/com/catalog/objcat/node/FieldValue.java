package com.catalog.objcat.node;

import com.catalog.objcat.source.Source;

/**
 * One entry of a {@link Field}: a value together with its provenance.
 */
public sealed interface FieldValue<T> permits ObservedValue, DerivedValue {

    T value();

    Source source();
}
