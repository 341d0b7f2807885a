package com.z254.secretsync.core.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one synchronization run of a secret.
 *
 * @param error cause of the failure, {@code null} on success
 */
public record SyncResult(String secretName, boolean success, Throwable error, Instant timestamp, Duration duration) {

    public static SyncResult succeeded(String secretName, Instant timestamp, Duration duration) {
        return new SyncResult(secretName, true, null, timestamp, duration);
    }

    public static SyncResult failed(String secretName, Throwable error, Instant timestamp, Duration duration) {
        return new SyncResult(secretName, false, error, timestamp, duration);
    }
}
