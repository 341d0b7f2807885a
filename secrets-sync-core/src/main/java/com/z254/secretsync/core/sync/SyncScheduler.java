package com.z254.secretsync.core.sync;

import com.z254.secretsync.core.model.SecretSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each secret's sync on its own fixed-delay schedule, starting immediately.
 * <p>
 * Jobs are independent: a failing or slow secret never delays another. A job never
 * overlaps itself. Results are offered to a bounded queue and dropped when it is full.
 */
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    public static final int RESULT_QUEUE_CAPACITY = 100;

    private final SecretSyncer syncer;
    private final ScheduledThreadPoolExecutor executor;
    private final BlockingQueue<SyncResult> results = new ArrayBlockingQueue<>(RESULT_QUEUE_CAPACITY);
    private final Duration shutdownTimeout;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, SyncJob> jobs = new HashMap<>();
    private boolean stopping;
    private volatile boolean stopped;

    public SyncScheduler(SecretSyncer syncer, int poolSize, Duration shutdownTimeout) {
        this(syncer, poolSize, shutdownTimeout, Clock.systemUTC());
    }

    SyncScheduler(SecretSyncer syncer, int poolSize, Duration shutdownTimeout, Clock clock) {
        this.syncer = syncer;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, poolSize), new SyncThreadFactory());
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    /**
     * Schedule a secret, replacing any job with the same name. The first sync starts
     * right away.
     *
     * @throws IllegalStateException after {@link #stop()}
     */
    public void addSecret(SecretSpec secret) {
        synchronized (lock) {
            if (stopping) {
                throw new IllegalStateException("scheduler is stopped");
            }
            SyncJob previous = jobs.remove(secret.name());
            if (previous != null) {
                previous.cancel();
                log.info("Replacing scheduled sync for secret {}", secret.name());
            }

            SyncJob job = new SyncJob(secret);
            jobs.put(secret.name(), job);
            if (executor.getCorePoolSize() < jobs.size()) {
                executor.setCorePoolSize(jobs.size());
            }
            ScheduledFuture<?> future = executor.scheduleWithFixedDelay(() -> runJob(job),
                    0, secret.refreshInterval().toMillis(), TimeUnit.MILLISECONDS);
            job.attach(future);
        }
        log.info("Scheduled secret {} every {}", secret.name(), secret.refreshInterval());
    }

    /**
     * Stop syncing a secret. An in-flight run is interrupted and does not report.
     *
     * @return {@code true} if the secret was scheduled
     */
    public boolean removeSecret(String name) {
        SyncJob job;
        synchronized (lock) {
            job = jobs.remove(name);
            if (job != null) {
                job.cancel();
            }
        }
        if (job != null) {
            log.info("Removed secret {} from schedule", name);
        }
        return job != null;
    }

    /**
     * Replace the whole schedule with {@code secrets}.
     */
    public void reload(Collection<SecretSpec> secrets) {
        synchronized (lock) {
            if (stopping) {
                throw new IllegalStateException("scheduler is stopped");
            }
            jobs.values().forEach(SyncJob::cancel);
            jobs.clear();
            for (SecretSpec secret : secrets) {
                addSecret(secret);
            }
        }
        log.info("Reloaded schedule with {} secret(s)", secrets.size());
    }

    /**
     * Time of the last successful sync; empty for unknown or never-synced secrets.
     */
    public Optional<Instant> lastSyncTime(String name) {
        synchronized (lock) {
            SyncJob job = jobs.get(name);
            return job != null ? job.lastSync() : Optional.empty();
        }
    }

    public boolean isScheduled(String name) {
        synchronized (lock) {
            return jobs.containsKey(name);
        }
    }

    public Set<String> secretNames() {
        synchronized (lock) {
            return new TreeSet<>(jobs.keySet());
        }
    }

    /**
     * Stream of sync outcomes. Consumers should keep draining until {@link #isStopped()}
     * is true and the queue is empty.
     */
    public BlockingQueue<SyncResult> results() {
        return results;
    }

    /**
     * Cancel every job and wait for running syncs to finish, up to the shutdown timeout.
     * Idempotent.
     */
    public void stop() {
        List<SyncJob> cancelled;
        synchronized (lock) {
            if (stopping) {
                return;
            }
            stopping = true;
            cancelled = new ArrayList<>(jobs.values());
            jobs.clear();
        }
        cancelled.forEach(SyncJob::cancel);

        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Sync jobs did not finish within {}, forcing shutdown", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        stopped = true;
        log.info("Scheduler stopped, {} job(s) cancelled", cancelled.size());
    }

    public boolean isStopped() {
        return stopped;
    }

    private void runJob(SyncJob job) {
        if (job.isCancelled()) {
            return;
        }
        String name = job.secret().name();
        long start = System.nanoTime();
        Throwable error = null;
        try {
            syncer.sync(job.secret());
        } catch (RuntimeException e) {
            log.debug("Sync of secret {} failed", name, e);
            error = e;
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);

        Instant now = clock.instant();
        SyncResult result = error == null
                ? SyncResult.succeeded(name, now, duration)
                : SyncResult.failed(name, error, now, duration);
        boolean published = job.publishIfActive(() -> {
            if (result.success()) {
                job.markSynced(now);
            }
            if (!results.offer(result)) {
                log.warn("Result queue full, dropping result for secret {}", name);
            }
        });
        if (!published) {
            log.debug("Discarding result of cancelled job {}", name);
        }
    }

    private static final class SyncThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "secrets-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
