package com.z254.secretsync.core.vault;

import java.time.Duration;

/**
 * Retry schedule of {@link SecretFetcher}: up to {@code maxRetries} further attempts,
 * waiting {@code min(initialBackoff * multiplier^(n-1), maxBackoff)} before attempt n.
 */
public record RetrySettings(Duration initialBackoff, Duration maxBackoff, double multiplier, int maxRetries) {

    public static final RetrySettings DEFAULTS =
            new RetrySettings(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 3);

    public RetrySettings {
        if (initialBackoff == null || initialBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("initialBackoff must be at least 1ms");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }
}
