package com.z254.secretsync.core.vault;

/**
 * Reading a secret failed. Plain instances are transient (network error, timeout, 5xx)
 * and retried by {@link SecretFetcher}; see the subclasses for the non-retried cases.
 */
public class SecretFetchException extends RuntimeException {

    private final int statusCode;

    public SecretFetchException(String message) {
        this(message, -1, null);
    }

    public SecretFetchException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public SecretFetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the store, or {@code -1} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
