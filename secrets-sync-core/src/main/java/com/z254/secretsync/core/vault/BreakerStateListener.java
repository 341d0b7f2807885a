package com.z254.secretsync.core.vault;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * Receives circuit breaker state changes of pooled clients.
 */
@FunctionalInterface
public interface BreakerStateListener {

    BreakerStateListener NO_OP = (contextName, from, to) -> {
    };

    void onStateChange(String contextName, CircuitBreaker.State from, CircuitBreaker.State to);

    /**
     * Called once when the breaker of a new client is built.
     */
    default void onCreated(String contextName, CircuitBreaker.State initialState) {
    }
}
