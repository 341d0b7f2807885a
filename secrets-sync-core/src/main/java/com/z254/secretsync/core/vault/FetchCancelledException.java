package com.z254.secretsync.core.vault;

/**
 * The fetching thread was interrupted, either while waiting between attempts or during
 * the request. The interrupt flag is restored before this is thrown.
 */
public class FetchCancelledException extends SecretFetchException {

    public FetchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
