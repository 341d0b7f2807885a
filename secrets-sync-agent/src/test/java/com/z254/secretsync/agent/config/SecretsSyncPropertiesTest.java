package com.z254.secretsync.agent.config;

import com.z254.secretsync.core.model.AuthMethod;
import com.z254.secretsync.core.model.KvVersion;
import com.z254.secretsync.core.model.OutputFile;
import com.z254.secretsync.core.model.SecretSpec;
import com.z254.secretsync.core.model.SecretStoreSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests binding of {@link SecretsSyncProperties} and its conversion to engine types.
 */
@DisplayName("SecretsSyncProperties Tests")
class SecretsSyncPropertiesTest {

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        SecretsSyncProperties properties = bind(Map.of(
                "secrets-sync.vault.address", "http://vault:8200",
                "secrets-sync.vault.auth.token", "s.root"));

        assertThat(properties.getRetry().toSettings().initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(properties.getRetry().toSettings().maxBackoff()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.getRetry().getMaxRetries()).isEqualTo(3);
        assertThat(properties.getCircuitBreaker().toSettings().failureRatio()).isEqualTo(0.6);
        assertThat(properties.getCircuitBreaker().getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.getCircuitBreaker().toSettings().interval()).isEqualTo(Duration.ofSeconds(60));
        assertThat(properties.getScheduler().getPoolSize()).isEqualTo(4);

        SecretStoreSpec store = properties.toStoreSpec();
        assertThat(store.defaultCredentials().method()).isEqualTo(AuthMethod.TOKEN);
        assertThat(store.tls()).isNull();
        assertThat(store.credentials()).isEmpty();
    }

    @Test
    @DisplayName("should map secrets, files and named credentials")
    void shouldMapSecrets() {
        Map<String, String> source = new HashMap<>();
        source.put("secrets-sync.vault.address", "https://vault:8200");
        source.put("secrets-sync.vault.namespace", "team-a");
        source.put("secrets-sync.vault.auth.token", "s.root");
        source.put("secrets-sync.vault.credentials.admin.method", "approle");
        source.put("secrets-sync.vault.credentials.admin.role-id", "role");
        source.put("secrets-sync.vault.credentials.admin.secret-id", "secret");
        source.put("secrets-sync.secrets[0].name", "db");
        source.put("secrets-sync.secrets[0].key", "app/db");
        source.put("secrets-sync.secrets[0].kv-version", "v1");
        source.put("secrets-sync.secrets[0].credentials", "admin");
        source.put("secrets-sync.secrets[0].refresh-interval", "30m");
        source.put("secrets-sync.secrets[0].templates.username", "{{ .username }}");
        source.put("secrets-sync.secrets[0].templates.password", "{{ .password }}");
        source.put("secrets-sync.secrets[0].files[0].path", "/run/secrets/db_password");
        source.put("secrets-sync.secrets[0].files[1].path", "/run/secrets/db_username");
        source.put("secrets-sync.secrets[0].files[1].mode", "0640");
        source.put("secrets-sync.secrets[0].files[1].owner", "1000");

        SecretsSyncProperties properties = bind(source);

        SecretStoreSpec store = properties.toStoreSpec();
        assertThat(store.namespace()).isEqualTo("team-a");
        assertThat(store.credentialsFor("admin")).hasValueSatisfying(credentials -> {
            assertThat(credentials.method()).isEqualTo(AuthMethod.APPROLE);
            assertThat(credentials.roleId()).isEqualTo("role");
        });

        List<SecretSpec> specs = properties.toSecretSpecs();
        assertThat(specs).hasSize(1);
        SecretSpec db = specs.get(0);
        assertThat(db.mountPath()).isEqualTo("secret");
        assertThat(db.kvVersion()).isEqualTo(KvVersion.V1);
        assertThat(db.credentials()).isEqualTo("admin");
        assertThat(db.refreshInterval()).isEqualTo(Duration.ofMinutes(30));
        assertThat(db.hasNamespaceOverride()).isFalse();
        assertThat(db.sortedTemplateNames()).containsExactly("password", "username");
        assertThat(db.files()).containsExactly(
                new OutputFile("/run/secrets/db_password", "0600", null, null),
                new OutputFile("/run/secrets/db_username", "0640", 1000, null));
    }

    @Test
    @DisplayName("should carry TLS material when configured")
    void shouldMapTls() {
        SecretsSyncProperties properties = bind(Map.of(
                "secrets-sync.vault.address", "https://vault:8200",
                "secrets-sync.vault.auth.token", "s.root",
                "secrets-sync.vault.tls.ca-cert", "/etc/vault/ca.pem"));

        SecretStoreSpec.TlsSettings tls = properties.toStoreSpec().tls();

        assertThat(tls).isNotNull();
        assertThat(tls.caCert()).hasToString("/etc/vault/ca.pem");
        assertThat(tls.hasClientCertificate()).isFalse();
    }

    private static SecretsSyncProperties bind(Map<String, String> source) {
        return new Binder(new MapConfigurationPropertySource(source))
                .bind("secrets-sync", SecretsSyncProperties.class)
                .get();
    }
}
