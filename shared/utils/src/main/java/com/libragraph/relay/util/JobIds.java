package com.libragraph.relay.util;

import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Job identifiers: 8 lowercase hex characters cut from a random UUID.
 *
 * <p>Short enough to embed in filenames and URLs. Uniqueness within a store is
 * the store's job; this class only generates and validates the shape.
 */
public final class JobIds {

    public static final int LENGTH = 8;

    private static final Pattern WELL_FORMED = Pattern.compile("[0-9a-f]{" + LENGTH + "}");

    private JobIds() {
    }

    public static String newId() {
        return UUID.randomUUID().toString().substring(0, LENGTH);
    }

    public static boolean isWellFormed(String id) {
        return id != null && WELL_FORMED.matcher(id).matches();
    }

    /**
     * Returns {@code id} unchanged if well formed.
     *
     * @throws IllegalArgumentException otherwise
     */
    public static String requireWellFormed(String id) {
        Objects.requireNonNull(id, "job id cannot be null");
        if (!isWellFormed(id)) {
            throw new IllegalArgumentException("Malformed job id: '" + id + "'");
        }
        return id;
    }
}
