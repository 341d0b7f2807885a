package com.z254.secretsync.agent.lifecycle;

import com.z254.secretsync.agent.health.ReadinessTracker;
import com.z254.secretsync.agent.observability.SyncMetrics;
import com.z254.secretsync.core.sync.SyncException;
import com.z254.secretsync.core.sync.SyncResult;
import com.z254.secretsync.core.sync.SyncScheduler;
import com.z254.secretsync.core.template.TemplateException;
import com.z254.secretsync.core.vault.FetchCancelledException;
import com.z254.secretsync.core.vault.SecretFetchException;
import com.z254.secretsync.core.vault.SecretProtocolException;
import com.z254.secretsync.core.vault.VaultAuthenticationException;
import com.z254.secretsync.core.writer.FileWriteException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Drains the scheduler's result stream: logs each outcome, records metrics and updates
 * readiness. Exits once the scheduler has stopped and the stream is empty.
 */
@Slf4j
public class SyncResultMonitor {

    private static final long POLL_MILLIS = 200;

    private final SyncScheduler scheduler;
    private final SyncMetrics metrics;
    private final ReadinessTracker readiness;

    private volatile Thread thread;

    public SyncResultMonitor(SyncScheduler scheduler, SyncMetrics metrics, ReadinessTracker readiness) {
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.readiness = readiness;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        thread = new Thread(this::drain, "secrets-sync-monitor");
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Wait for the monitor to finish after the scheduler was stopped.
     *
     * @return {@code true} if it finished in time
     */
    public boolean awaitTermination(Duration timeout) {
        Thread current = thread;
        if (current == null) {
            return true;
        }
        try {
            current.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !current.isAlive();
    }

    void drain() {
        while (!(scheduler.isStopped() && scheduler.results().isEmpty())) {
            try {
                SyncResult result = scheduler.results().poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (result != null) {
                    handle(result);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        log.debug("Result monitor finished");
    }

    void handle(SyncResult result) {
        String name = result.secretName();
        if (result.success()) {
            log.info("Secret {} synced in {}ms", name, result.duration().toMillis());
            metrics.recordSuccess(name, result.duration());
            if (readiness.markSynced(name)) {
                metrics.setSecretsSynced(readiness.getSyncedCount());
            }
            return;
        }

        Throwable error = result.error();
        String type = errorType(error);
        log.error("Secret {} sync failed ({}): {}", name, type, error != null ? error.getMessage() : "unknown error");
        log.debug("Sync failure details for secret {}", name, error);
        metrics.recordFailure(name, type, result.duration());
    }

    static String errorType(Throwable error) {
        Throwable cause = error instanceof SyncException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof VaultAuthenticationException) {
            return "auth";
        }
        if (cause instanceof FetchCancelledException) {
            return "cancelled";
        }
        if (cause instanceof SecretProtocolException) {
            return "protocol";
        }
        if (cause instanceof SecretFetchException) {
            return "fetch";
        }
        if (cause instanceof TemplateException) {
            return "template";
        }
        if (cause instanceof FileWriteException) {
            return "write";
        }
        return "sync";
    }
}
