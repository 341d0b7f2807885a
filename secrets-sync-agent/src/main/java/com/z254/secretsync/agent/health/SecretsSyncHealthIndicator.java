package com.z254.secretsync.agent.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports UP once at least one secret has synced, OUT_OF_SERVICE before that.
 */
@Component
public class SecretsSyncHealthIndicator implements HealthIndicator {

    private final ReadinessTracker readiness;

    public SecretsSyncHealthIndicator(ReadinessTracker readiness) {
        this.readiness = readiness;
    }

    @Override
    public Health health() {
        Health.Builder builder = readiness.isReady() ? Health.up() : Health.outOfService();
        return builder
                .withDetail("secretCount", readiness.getSecretCount())
                .withDetail("syncedCount", readiness.getSyncedCount())
                .build();
    }
}
