package com.z254.secretsync.core.vault;

/**
 * Authentication against the secret store failed: missing or rejected credentials, or
 * an unreachable store. Never cached; the next resolution attempts to log in again.
 */
public class VaultAuthenticationException extends RuntimeException {

    public VaultAuthenticationException(String message) {
        super(message);
    }

    public VaultAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
