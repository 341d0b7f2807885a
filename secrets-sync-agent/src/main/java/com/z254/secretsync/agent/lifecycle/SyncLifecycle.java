package com.z254.secretsync.agent.lifecycle;

import com.z254.secretsync.agent.health.ReadinessTracker;
import com.z254.secretsync.agent.observability.SyncMetrics;
import com.z254.secretsync.core.model.SecretSpec;
import com.z254.secretsync.core.sync.SyncScheduler;
import com.z254.secretsync.core.vault.VaultClientPool;
import com.z254.secretsync.core.writer.TempFileSweeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.List;

/**
 * Starts synchronization once the application context is ready and stops it gracefully
 * on shutdown.
 * <p>
 * Startup sweeps orphaned temp files from every output directory before the first
 * write. Shutdown cancels all jobs, lets the monitor drain pending results and clears
 * readiness.
 */
@Slf4j
public class SyncLifecycle implements SmartLifecycle {

    private static final Duration MONITOR_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final List<SecretSpec> secrets;
    private final SyncScheduler scheduler;
    private final SyncResultMonitor monitor;
    private final TempFileSweeper sweeper;
    private final SyncMetrics metrics;
    private final ReadinessTracker readiness;
    private final VaultClientPool clientPool;

    private volatile boolean running;

    public SyncLifecycle(List<SecretSpec> secrets, SyncScheduler scheduler, SyncResultMonitor monitor,
                         TempFileSweeper sweeper, SyncMetrics metrics, ReadinessTracker readiness,
                         VaultClientPool clientPool) {
        this.secrets = List.copyOf(secrets);
        this.scheduler = scheduler;
        this.monitor = monitor;
        this.sweeper = sweeper;
        this.metrics = metrics;
        this.readiness = readiness;
        this.clientPool = clientPool;
    }

    @Override
    public void start() {
        int removed = sweeper.sweep(TempFileSweeper.outputDirectories(secrets));
        if (removed > 0) {
            log.info("Removed {} orphaned temp file(s) before first sync", removed);
        }

        metrics.setSecretsConfigured(secrets.size());
        monitor.start();
        for (SecretSpec secret : secrets) {
            scheduler.addSecret(secret);
        }
        running = true;
        log.info("Secret synchronization started for {} secret(s)", secrets.size());
    }

    @Override
    public void stop() {
        log.info("Stopping secret synchronization");
        scheduler.stop();
        if (!monitor.awaitTermination(MONITOR_DRAIN_TIMEOUT)) {
            log.warn("Result monitor did not finish within {}", MONITOR_DRAIN_TIMEOUT);
        }
        readiness.reset();
        clientPool.close();
        running = false;
        log.info("Secret synchronization stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
