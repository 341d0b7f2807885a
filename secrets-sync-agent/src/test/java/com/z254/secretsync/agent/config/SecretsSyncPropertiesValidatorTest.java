package com.z254.secretsync.agent.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SecretsSyncPropertiesValidator}.
 */
@DisplayName("SecretsSyncPropertiesValidator Tests")
class SecretsSyncPropertiesValidatorTest {

    private SecretsSyncPropertiesValidator validator;
    private SecretsSyncProperties properties;

    @BeforeEach
    void setUp() {
        validator = new SecretsSyncPropertiesValidator();
        properties = new SecretsSyncProperties();
        properties.getVault().setAddress("https://vault.example.com:8200");
        properties.getVault().getAuth().setToken("s.root");
        properties.getSecrets().add(secret("db", "/run/secrets/db_password"));
    }

    @Test
    @DisplayName("should accept a minimal valid configuration")
    void shouldAcceptMinimalConfiguration() {
        assertThatCode(() -> validator.validate(properties)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should report every problem at once")
    void shouldCollectAllProblems() {
        properties.getVault().setAddress("ftp://vault");
        properties.getVault().getAuth().setToken(null);
        properties.getSecrets().get(0).setKey("");

        assertThatThrownBy(() -> validator.validate(properties))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getProblems()).hasSize(3))
                .hasMessageContaining("vault.address must use http or https")
                .hasMessageContaining("vault.auth.token is required")
                .hasMessageContaining("secret 'db': key is required");
    }

    @Nested
    @DisplayName("Vault settings")
    class VaultSettings {

        @Test
        @DisplayName("should require role and secret id for approle")
        void shouldRequireAppRoleFields() {
            SecretsSyncProperties.Auth auth = properties.getVault().getAuth();
            auth.setMethod("approle");
            auth.setRoleId("role");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("vault.auth.secret-id is required for approle authentication");
        }

        @Test
        @DisplayName("should reject unknown auth methods")
        void shouldRejectUnknownMethod() {
            properties.getVault().getAuth().setMethod("kubernetes");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("vault.auth.method");
        }

        @Test
        @DisplayName("should reserve the default credential name")
        void shouldReserveDefaultCredentialName() {
            SecretsSyncProperties.Auth auth = new SecretsSyncProperties.Auth();
            auth.setToken("other");
            properties.getVault().getCredentials().put("default", auth);

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("'default' is reserved");
        }

        @Test
        @DisplayName("should validate named credential sets")
        void shouldValidateNamedCredentials() {
            SecretsSyncProperties.Auth auth = new SecretsSyncProperties.Auth();
            auth.setMethod("approle");
            properties.getVault().getCredentials().put("admin", auth);

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("vault.credentials.admin.role-id is required");
        }

        @Test
        @DisplayName("should require client certificate and key together")
        void shouldPairClientCertificateAndKey(@TempDir Path dir) throws IOException {
            Path cert = Files.writeString(dir.resolve("client.pem"), "cert");
            properties.getVault().getTls().setClientCert(cert.toString());

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("must be set together");
        }

        @Test
        @DisplayName("should reject unreadable TLS files")
        void shouldRejectMissingCaFile(@TempDir Path dir) {
            properties.getVault().getTls().setCaCert(dir.resolve("missing-ca.pem").toString());

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("vault.tls.ca-cert: file not found or not readable");
        }
    }

    @Nested
    @DisplayName("Secret definitions")
    class SecretDefinitions {

        @Test
        @DisplayName("should require at least one secret")
        void shouldRequireSecrets() {
            properties.getSecrets().clear();

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("at least one secret must be configured");
        }

        @Test
        @DisplayName("should cap the number of secrets")
        void shouldCapSecretCount() {
            properties.getSecrets().clear();
            for (int i = 0; i <= SecretsSyncPropertiesValidator.MAX_SECRETS; i++) {
                properties.getSecrets().add(secret("s" + i, "/run/secrets/s" + i));
            }

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("too many secrets: 101 (maximum 100)");
        }

        @Test
        @DisplayName("should reject duplicate names and shared output files")
        void shouldRejectDuplicates() {
            properties.getSecrets().add(secret("db", "/run/secrets/db_password"));

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("secret 'db': duplicate secret name")
                    .hasMessageContaining("is also written by");
        }

        @Test
        @DisplayName("should enforce the minimum refresh interval")
        void shouldEnforceMinimumRefresh() {
            properties.getSecrets().get(0).setRefreshInterval(Duration.ofSeconds(10));

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("refresh-interval must be at least 30s");
        }

        @Test
        @DisplayName("should accept references to named credentials and default")
        void shouldAcceptKnownCredentials() {
            SecretsSyncProperties.Auth auth = new SecretsSyncProperties.Auth();
            auth.setToken("admin-token");
            properties.getVault().getCredentials().put("admin", auth);
            properties.getSecrets().get(0).setCredentials("admin");
            SecretsSyncProperties.Secret other = secret("api", "/run/secrets/api");
            other.setCredentials("default");
            properties.getSecrets().add(other);

            assertThatCode(() -> validator.validate(properties)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject unknown credential references")
        void shouldRejectUnknownCredentials() {
            properties.getSecrets().get(0).setCredentials("missing");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("unknown credentials 'missing'");
        }

        @Test
        @DisplayName("should require matching template and file counts")
        void shouldMatchTemplatesToFiles() {
            properties.getSecrets().get(0).getTemplates().put("username", "{{ .username }}");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("template count (2) does not match file count (1)");
        }

        @Test
        @DisplayName("should reject malformed templates")
        void shouldRejectMalformedTemplate() {
            properties.getSecrets().get(0).getTemplates().put("password", "{{ .password ");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("unclosed action");
        }

        @Test
        @DisplayName("should reject relative and traversing paths")
        void shouldRejectUnsafePaths() {
            properties.getSecrets().get(0).getFiles().get(0).setPath("relative/file");
            properties.getSecrets().add(secret("other", "/run/secrets/../etc/passwd"));

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("path must be absolute")
                    .hasMessageContaining("'..' which is not allowed");
        }

        @Test
        @DisplayName("should reject modes above the permission ceiling")
        void shouldRejectPermissiveMode() {
            properties.getSecrets().get(0).getFiles().get(0).setMode("0666");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("world-writable");
        }

        @Test
        @DisplayName("should reject invalid kv versions")
        void shouldRejectKvVersion() {
            properties.getSecrets().get(0).setKvVersion("v3");

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("secret 'db'");
        }
    }

    @Nested
    @DisplayName("Tuning")
    class Tuning {

        @Test
        @DisplayName("should reject invalid retry settings")
        void shouldRejectRetrySettings() {
            properties.getRetry().setMultiplier(0.5);

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("retry: ");
        }

        @Test
        @DisplayName("should reject invalid breaker settings")
        void shouldRejectBreakerSettings() {
            properties.getCircuitBreaker().setFailureRatio(1.5);

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("circuit-breaker: ");
        }

        @Test
        @DisplayName("should reject a breaker interval below one second")
        void shouldRejectBreakerInterval() {
            properties.getCircuitBreaker().setInterval(Duration.ofMillis(100));

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("circuit-breaker: interval must be at least 1s");
        }

        @Test
        @DisplayName("should reject non-positive timeouts")
        void shouldRejectTimeouts() {
            properties.getScheduler().setShutdownTimeout(Duration.ZERO);

            assertThatThrownBy(() -> validator.validate(properties))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("scheduler.shutdown-timeout must be positive");
        }
    }

    static SecretsSyncProperties.Secret secret(String name, String path) {
        SecretsSyncProperties.Secret secret = new SecretsSyncProperties.Secret();
        secret.setName(name);
        secret.setKey("app/" + name);
        secret.getTemplates().put("password", "{{ .password }}");
        SecretsSyncProperties.File file = new SecretsSyncProperties.File();
        file.setPath(path);
        secret.getFiles().add(file);
        return secret;
    }
}
