package com.warden.guard;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * A named accessor for one field of a resource.
 * <p>
 * The {@code name} identifies the field for data sources that push the comparison down to the
 * store (for JDBC it is the column name); the {@code getter} extracts the value in-process.
 *
 * <pre>{@code
 * ResourceField<Document, UUID> id = ResourceField.of("id", Document::id);
 * ResourceField<Document, String> owner = ResourceField.of("owner_id", Document::ownerId);
 * }</pre>
 *
 * @param name   logical field name, a plain identifier ({@code [A-Za-z_][A-Za-z0-9_]*})
 * @param getter extracts the field value from a resource
 * @param <T>    resource type
 * @param <V>    field value type
 */
public record ResourceField<T, V>(String name, Function<? super T, ? extends V> getter) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ResourceField {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("name must be a plain identifier but was: " + name);
        }
        if (getter == null) {
            throw new IllegalArgumentException("getter must not be null");
        }
    }

    public static <T, V> ResourceField<T, V> of(String name, Function<? super T, ? extends V> getter) {
        return new ResourceField<>(name, getter);
    }

    /** Extracts this field's value from the given resource. */
    public V valueOf(T resource) {
        return getter.apply(resource);
    }
}
