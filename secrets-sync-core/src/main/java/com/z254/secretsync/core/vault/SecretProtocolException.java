package com.z254.secretsync.core.vault;

/**
 * The store answered, but not with usable secret data: the secret is missing, the
 * response shape does not match the KV version, or the body is too large. Retrying does
 * not help, so these are surfaced immediately.
 */
public class SecretProtocolException extends SecretFetchException {

    public SecretProtocolException(String message) {
        super(message);
    }

    public SecretProtocolException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public SecretProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
