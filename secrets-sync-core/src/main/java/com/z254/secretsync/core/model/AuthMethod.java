package com.z254.secretsync.core.model;

import java.util.Locale;

/**
 * Authentication methods accepted by the secret store.
 */
public enum AuthMethod {
    TOKEN,
    APPROLE;

    public static AuthMethod parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("authMethod is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "token" -> TOKEN;
            case "approle" -> APPROLE;
            default -> throw new IllegalArgumentException(
                    "unsupported authMethod: " + value + " (supported: token, approle)");
        };
    }
}
