package com.z254.secretsync.core.vault;

import java.time.Duration;

/**
 * Circuit breaker tuning applied to every client.
 *
 * @param maxRequests     trial calls allowed while half-open
 * @param minimumRequests calls within the interval needed before the failure ratio is
 *                        evaluated
 * @param failureRatio    ratio of failed calls, in {@code (0, 1]}, that opens the breaker
 * @param interval        rolling window over which calls are counted while closed,
 *                        whole seconds
 * @param timeout         time spent open before trial calls are let through
 */
public record BreakerSettings(int maxRequests, int minimumRequests, double failureRatio,
                              Duration interval, Duration timeout) {

    public static final BreakerSettings DEFAULTS =
            new BreakerSettings(3, 3, 0.6, Duration.ofSeconds(60), Duration.ofSeconds(30));

    public BreakerSettings {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (minimumRequests < 1) {
            throw new IllegalArgumentException("minimumRequests must be >= 1");
        }
        if (failureRatio <= 0 || failureRatio > 1) {
            throw new IllegalArgumentException("failureRatio must be in (0, 1]");
        }
        if (interval == null || interval.toSeconds() < 1) {
            throw new IllegalArgumentException("interval must be at least 1s");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    float failureRateThresholdPercent() {
        return (float) (failureRatio * 100.0);
    }

    int intervalSeconds() {
        return (int) Math.min(Integer.MAX_VALUE, interval.toSeconds());
    }
}
