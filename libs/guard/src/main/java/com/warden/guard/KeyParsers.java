package com.warden.guard;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Built-in {@link KeyParser}s for common key types.
 */
public final class KeyParsers {

    // UUID.fromString accepts shortened groups such as "1-2-3-4-5"; keys must be canonical.
    private static final Pattern CANONICAL_UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    // Long.parseLong accepts any Unicode decimal digit; keys must be ASCII.
    private static final Pattern ASCII_DECIMAL = Pattern.compile("[+-]?[0-9]+");

    private static final KeyParser<String> STRINGS =
            raw -> raw == null || raw.isEmpty() ? Optional.empty() : Optional.of(raw);

    private static final KeyParser<UUID> UUIDS = raw -> {
        if (raw == null || !CANONICAL_UUID.matcher(raw).matches()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(raw));
    };

    private static final KeyParser<Long> LONGS = raw -> {
        if (raw == null || !ASCII_DECIMAL.matcher(raw).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    };

    private static final KeyParser<Integer> INTEGERS = raw -> {
        if (raw == null || !ASCII_DECIMAL.matcher(raw).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    };

    private KeyParsers() {
        // utility class
    }

    /** Accepts any non-empty string unchanged. */
    public static KeyParser<String> strings() {
        return STRINGS;
    }

    /** Accepts canonical 8-4-4-4-12 hexadecimal UUIDs, case-insensitively. */
    public static KeyParser<UUID> uuids() {
        return UUIDS;
    }

    /** Accepts base-10 {@code long} values with an optional sign. */
    public static KeyParser<Long> longs() {
        return LONGS;
    }

    /** Accepts base-10 {@code int} values with an optional sign. */
    public static KeyParser<Integer> integers() {
        return INTEGERS;
    }
}
