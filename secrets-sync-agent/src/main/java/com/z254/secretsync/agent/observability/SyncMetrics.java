package com.z254.secretsync.agent.observability;

import com.z254.secretsync.core.vault.BreakerStateListener;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics of the secrets-sync agent.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Sync outcomes per secret (attempts, errors by type, duration)</li>
 *     <li>Circuit breaker state per credential context</li>
 *     <li>Configured and synced secret counts</li>
 * </ul>
 * Breaker gauges are registered when a context's client is created and follow its
 * state transitions.
 */
@Component
public class SyncMetrics implements BreakerStateListener {

    private final MeterRegistry meterRegistry;

    private final AtomicInteger secretsConfigured = new AtomicInteger();
    private final AtomicInteger secretsSynced = new AtomicInteger();
    private final Map<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();

    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        Gauge.builder("secrets.configured", secretsConfigured, AtomicInteger::get)
                .description("Number of configured secrets")
                .register(meterRegistry);
        Gauge.builder("secrets.synced", secretsSynced, AtomicInteger::get)
                .description("Number of secrets synced successfully at least once")
                .register(meterRegistry);
    }

    public void recordSuccess(String secretName, Duration duration) {
        fetchCounter(secretName, "success").increment();
        syncTimer(secretName).record(duration);
    }

    public void recordFailure(String secretName, String errorType, Duration duration) {
        fetchCounter(secretName, "failure").increment();
        Counter.builder("secret.fetch.errors")
                .description("Failed secret syncs by error type")
                .tag("secret", secretName)
                .tag("type", errorType)
                .register(meterRegistry)
                .increment();
        syncTimer(secretName).record(duration);
    }

    public void setSecretsConfigured(int count) {
        secretsConfigured.set(count);
    }

    public void setSecretsSynced(int count) {
        secretsSynced.set(count);
    }

    @Override
    public void onCreated(String contextName, CircuitBreaker.State initialState) {
        recordBreakerState(contextName, initialState);
    }

    @Override
    public void onStateChange(String contextName, CircuitBreaker.State from, CircuitBreaker.State to) {
        recordBreakerState(contextName, to);
    }

    /**
     * Gauge value: 0 closed, 1 half-open, 2 open.
     */
    public void recordBreakerState(String contextName, CircuitBreaker.State state) {
        breakerStates.computeIfAbsent(contextName, name -> {
            AtomicInteger value = new AtomicInteger();
            Gauge.builder("circuit.breaker.state", value, AtomicInteger::get)
                    .description("Circuit breaker state (0=closed, 1=half-open, 2=open)")
                    .tag("context", name)
                    .register(meterRegistry);
            return value;
        }).set(stateValue(state));
    }

    static int stateValue(CircuitBreaker.State state) {
        return switch (state) {
            case HALF_OPEN -> 1;
            case OPEN, FORCED_OPEN -> 2;
            default -> 0;
        };
    }

    private Counter fetchCounter(String secretName, String outcome) {
        return Counter.builder("secret.fetch")
                .description("Secret sync attempts")
                .tag("secret", secretName)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private Timer syncTimer(String secretName) {
        return Timer.builder("secret.sync.duration")
                .description("Duration of secret sync operations")
                .tag("secret", secretName)
                .register(meterRegistry);
    }
}
