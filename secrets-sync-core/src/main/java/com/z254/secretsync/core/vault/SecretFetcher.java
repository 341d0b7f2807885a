package com.z254.secretsync.core.vault;

import com.z254.secretsync.core.model.KvVersion;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Reads secrets through a client's circuit breaker, retrying transient failures with
 * exponential backoff.
 * <p>
 * Protocol errors and calls rejected by an open breaker fail immediately. Waits between
 * attempts end early when the calling thread is interrupted.
 */
public class SecretFetcher {

    private static final Logger log = LoggerFactory.getLogger(SecretFetcher.class);

    /**
     * Blocks the current thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final Sleeper sleeper;

    public SecretFetcher() {
        this(Sleeper.THREAD);
    }

    public SecretFetcher(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Fetch the fields of one secret.
     *
     * @param namespace namespace header; {@code null} or empty sends none
     * @throws SecretProtocolException  if the store's answer is unusable
     * @throws FetchCancelledException  if the thread is interrupted
     * @throws SecretFetchException     if the breaker is open or retries are exhausted
     */
    public Map<String, Object> fetch(VaultClient client, String mountPath, String key, KvVersion kvVersion,
                                     String namespace, RetrySettings retry) {
        String path = VaultClient.secretPath(mountPath, key, kvVersion);
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                retry.initialBackoff().toMillis(), retry.multiplier(), retry.maxBackoff().toMillis());

        SecretFetchException lastError = null;
        for (int attempt = 0; attempt <= retry.maxRetries(); attempt++) {
            if (attempt > 0) {
                long delay = backoff.apply(attempt);
                log.debug("Retrying fetch of {} in {}ms (attempt {}/{})", path, delay, attempt, retry.maxRetries());
                waitBeforeRetry(path, delay);
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new FetchCancelledException("fetch of " + path + " cancelled", null);
            }

            try {
                return client.circuitBreaker().executeSupplier(
                        () -> readOnce(client, mountPath, key, kvVersion, namespace, path));
            } catch (CallNotPermittedException e) {
                throw new SecretFetchException("circuit breaker open for context '"
                        + client.contextName() + "', not fetching " + path, e);
            } catch (SecretProtocolException | FetchCancelledException e) {
                throw e;
            } catch (SecretFetchException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new FetchCancelledException("fetch of " + path + " cancelled", e);
                }
                lastError = e;
                log.warn("Fetch of {} failed (attempt {}/{}): {}",
                        path, attempt + 1, retry.maxRetries() + 1, e.getMessage());
            }
        }

        throw new SecretFetchException("failed to fetch " + path + " after " + retry.maxRetries()
                + " retries: " + lastError.getMessage(), lastError.getStatusCode(), lastError);
    }

    // an interrupted read is a cancellation, which the breaker does not record
    private static Map<String, Object> readOnce(VaultClient client, String mountPath, String key,
                                                KvVersion kvVersion, String namespace, String path) {
        try {
            return client.readSecret(mountPath, key, kvVersion, namespace);
        } catch (SecretFetchException e) {
            if (Thread.currentThread().isInterrupted() && !(e instanceof FetchCancelledException)) {
                throw new FetchCancelledException("fetch of " + path + " cancelled", e);
            }
            throw e;
        }
    }

    private void waitBeforeRetry(String path, long delayMillis) {
        try {
            sleeper.sleep(Duration.ofMillis(delayMillis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException("fetch of " + path + " cancelled during backoff", e);
        }
    }
}
