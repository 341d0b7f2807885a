package com.z254.secretsync.core.sync;

import com.z254.secretsync.core.model.SecretSpec;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Scheduler entry for one secret. Once cancelled a job never runs or reports again.
 */
final class SyncJob {

    private final SecretSpec secret;
    private volatile ScheduledFuture<?> future;
    private volatile boolean cancelled;
    private volatile Instant lastSync;

    SyncJob(SecretSpec secret) {
        this.secret = secret;
    }

    SecretSpec secret() {
        return secret;
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    /**
     * Mark the job cancelled and interrupt a running sync. Waits for a publish in
     * progress, so nothing is published after this returns.
     */
    synchronized void cancel() {
        cancelled = true;
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(true);
        }
    }

    /**
     * Run {@code publisher} unless the job is cancelled. Mutually exclusive with
     * {@link #cancel()}.
     *
     * @return {@code false} if the job was cancelled and nothing ran
     */
    synchronized boolean publishIfActive(Runnable publisher) {
        if (cancelled) {
            return false;
        }
        publisher.run();
        return true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void markSynced(Instant when) {
        lastSync = when;
    }

    Optional<Instant> lastSync() {
        return Optional.ofNullable(lastSync);
    }
}
