package com.catalog.objcat.api;

import java.util.Optional;

/**
 * Check applied to every value stored in a field. Null values are always
 * accepted by the field itself and never reach the constraint.
 */
@FunctionalInterface
public interface TypeConstraint {

    TypeConstraint ANY = new TypeConstraint() {
        @Override
        public boolean accepts(Object value) {
            return true;
        }

        @Override
        public String describe() {
            return "any";
        }

        @Override
        public String toString() {
            return "any";
        }
    };

    boolean accepts(Object value);

    default String describe() {
        return "custom check";
    }

    /** The class every accepted value is an instance of, if there is one. */
    default Optional<Class<?>> valueClass() {
        return Optional.empty();
    }
}
