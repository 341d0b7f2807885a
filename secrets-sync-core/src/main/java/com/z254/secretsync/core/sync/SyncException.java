package com.z254.secretsync.core.sync;

/**
 * A sync of one secret failed. The cause identifies the stage: authentication, fetch,
 * template or file write.
 */
public class SyncException extends RuntimeException {

    private final String secretName;

    public SyncException(String secretName, String message) {
        super("secret " + secretName + ": " + message);
        this.secretName = secretName;
    }

    public SyncException(String secretName, String message, Throwable cause) {
        super("secret " + secretName + ": " + message, cause);
        this.secretName = secretName;
    }

    public String getSecretName() {
        return secretName;
    }
}
