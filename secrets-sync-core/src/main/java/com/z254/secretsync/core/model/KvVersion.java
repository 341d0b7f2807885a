package com.z254.secretsync.core.model;

import java.util.Locale;

/**
 * Addressing scheme of a KV secrets engine mount.
 */
public enum KvVersion {

    /**
     * Unversioned engine: the key is read directly under the mount.
     */
    V1,

    /**
     * Versioned engine: the key lives under {@code <mount>/data/} and the fields are
     * nested in a {@code data} object of the response.
     */
    V2;

    /**
     * Parse the configuration form ({@code v1}, {@code v2}, case-insensitive).
     */
    public static KvVersion parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("kvVersion is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "v1", "1" -> V1;
            case "v2", "2" -> V2;
            default -> throw new IllegalArgumentException("kvVersion must be v1 or v2, got: " + value);
        };
    }
}
