package com.warden.guard;

import java.util.Optional;

/**
 * Parses a raw route identifier into a resource's native key type.
 *
 * @param <K> key type
 * @see KeyParsers
 */
@FunctionalInterface
public interface KeyParser<K> {

    /**
     * Parses the raw value.
     *
     * @param raw route-supplied identifier (may be null)
     * @return the parsed key, or empty if the value is not a valid key
     */
    Optional<K> tryParse(String raw);
}
