package com.warden.guard;

import java.util.Objects;

/**
 * Equality constraint on one resource field: {@code field == expected}.
 *
 * @param field    the field to compare
 * @param expected the value the field must equal
 * @param <T>      resource type
 */
public record FieldMatch<T>(ResourceField<T, ?> field, Object expected) {

    public FieldMatch {
        if (field == null) {
            throw new IllegalArgumentException("field must not be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected must not be null");
        }
    }

    public static <T, V> FieldMatch<T> of(ResourceField<T, V> field, V expected) {
        return new FieldMatch<>(field, expected);
    }

    /** Evaluates the constraint against a resource in-process. */
    public boolean test(T resource) {
        return Objects.equals(field.valueOf(resource), expected);
    }
}
