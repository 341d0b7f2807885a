package com.z254.secretsync.agent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.secretsync.agent.health.ReadinessTracker;
import com.z254.secretsync.agent.lifecycle.SyncLifecycle;
import com.z254.secretsync.agent.lifecycle.SyncResultMonitor;
import com.z254.secretsync.agent.observability.SyncMetrics;
import com.z254.secretsync.core.model.SecretStoreSpec;
import com.z254.secretsync.core.sync.SecretSyncer;
import com.z254.secretsync.core.sync.SyncScheduler;
import com.z254.secretsync.core.vault.SecretFetcher;
import com.z254.secretsync.core.vault.VaultClientFactory;
import com.z254.secretsync.core.vault.VaultClientPool;
import com.z254.secretsync.core.writer.SecureFileWriter;
import com.z254.secretsync.core.writer.TempFileSweeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the synchronization engine from {@link SecretsSyncProperties}.
 * <p>
 * The configuration is validated before the store settings are built, so an invalid
 * configuration aborts startup before any secret is touched.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SecretsSyncProperties.class)
public class SecretsSyncConfiguration {

    @Bean
    public SecretsSyncPropertiesValidator secretsSyncPropertiesValidator() {
        return new SecretsSyncPropertiesValidator();
    }

    @Bean
    public SecretStoreSpec secretStoreSpec(SecretsSyncProperties properties,
                                           SecretsSyncPropertiesValidator validator) {
        validator.validate(properties);
        SecretStoreSpec store = properties.toStoreSpec();
        log.info("Using secret store at {} ({} credential set(s) besides the default)",
                store.address(), store.credentials().size());
        return store;
    }

    @Bean
    public SecureFileWriter secureFileWriter() {
        return new SecureFileWriter();
    }

    @Bean
    public TempFileSweeper tempFileSweeper() {
        return new TempFileSweeper();
    }

    @Bean
    public VaultClientFactory vaultClientFactory(SecretStoreSpec store, SecretsSyncProperties properties,
                                                 SyncMetrics metrics, ObjectMapper objectMapper) {
        return new VaultClientFactory(store, properties.getCircuitBreaker().toSettings(), metrics, objectMapper);
    }

    @Bean
    public VaultClientPool vaultClientPool(VaultClientFactory factory) {
        return new VaultClientPool(factory);
    }

    @Bean
    public SecretFetcher secretFetcher() {
        return new SecretFetcher();
    }

    @Bean
    public SecretSyncer secretSyncer(SecretStoreSpec store, VaultClientPool pool, SecretFetcher fetcher,
                                     SecureFileWriter writer, SecretsSyncProperties properties) {
        return new SecretSyncer(store, pool, fetcher, writer, properties.getRetry().toSettings());
    }

    // stopped by SyncLifecycle
    @Bean(destroyMethod = "")
    public SyncScheduler syncScheduler(SecretSyncer syncer, SecretsSyncProperties properties) {
        SecretsSyncProperties.Scheduler settings = properties.getScheduler();
        return new SyncScheduler(syncer, settings.getPoolSize(), settings.getShutdownTimeout());
    }

    @Bean
    public ReadinessTracker readinessTracker(SecretsSyncProperties properties, SecureFileWriter writer) {
        return new ReadinessTracker(properties.getSecrets().size(), properties.getHealth().getStatusFile(), writer);
    }

    @Bean
    public SyncResultMonitor syncResultMonitor(SyncScheduler scheduler, SyncMetrics metrics,
                                               ReadinessTracker readiness) {
        return new SyncResultMonitor(scheduler, metrics, readiness);
    }

    @Bean
    public SyncLifecycle syncLifecycle(SecretStoreSpec store, SecretsSyncProperties properties,
                                       SyncScheduler scheduler, SyncResultMonitor monitor,
                                       TempFileSweeper sweeper, SyncMetrics metrics,
                                       ReadinessTracker readiness, VaultClientPool pool) {
        return new SyncLifecycle(properties.toSecretSpecs(), scheduler, monitor, sweeper, metrics, readiness, pool);
    }
}
