package com.z254.secretsync.agent.config;

import com.z254.secretsync.core.model.AuthMethod;
import com.z254.secretsync.core.model.CredentialSet;
import com.z254.secretsync.core.model.KvVersion;
import com.z254.secretsync.core.model.OutputFile;
import com.z254.secretsync.core.model.SecretSpec;
import com.z254.secretsync.core.model.SecretStoreSpec;
import com.z254.secretsync.core.vault.BreakerSettings;
import com.z254.secretsync.core.vault.RetrySettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties of the secrets-sync agent.
 * <p>
 * Configuration example:
 * <pre>
 * secrets-sync:
 *   vault:
 *     address: https://vault.example.com:8200
 *     auth:
 *       method: approle
 *       role-id: ${VAULT_ROLE_ID}
 *       secret-id: ${VAULT_SECRET_ID}
 *   secrets:
 *     - name: db-credentials
 *       key: app/db
 *       refresh-interval: 30m
 *       templates:
 *         password: "{{ .password }}"
 *         username: "{{ .username }}"
 *       files:
 *         - path: /run/secrets/db_password
 *         - path: /run/secrets/db_username
 *           mode: "0640"
 * </pre>
 * Files are paired with templates by position in sorted template-name order.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "secrets-sync")
public class SecretsSyncProperties {

    @Valid
    private Vault vault = new Vault();

    @Valid
    @NotEmpty
    private List<Secret> secrets = new ArrayList<>();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Valid
    private Scheduler scheduler = new Scheduler();

    private Health health = new Health();

    /**
     * Secret store connection and credentials.
     */
    @Data
    public static class Vault {

        /** Base URL of the Vault or OpenBao server. */
        @NotBlank
        private String address;

        /** Default credentials. */
        @Valid
        private Auth auth = new Auth();

        /** Named credential sets that secrets may select with {@code credentials}. */
        @Valid
        private Map<String, Auth> credentials = new LinkedHashMap<>();

        /** Default namespace (Vault Enterprise / OpenBao). */
        private String namespace;

        private Tls tls = new Tls();

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Auth {

        /** token or approle. */
        private String method = "token";

        private String token;

        private String roleId;

        private String secretId;

        CredentialSet toCredentialSet() {
            return new CredentialSet(AuthMethod.parse(method), token, roleId, secretId);
        }
    }

    @Data
    public static class Tls {

        /** PEM CA bundle used to verify the server. */
        private String caCert;

        /** PEM client certificate; requires {@code clientKey}. */
        private String clientCert;

        private String clientKey;

        boolean hasMaterial() {
            return hasText(caCert) || hasText(clientCert) || hasText(clientKey);
        }

        SecretStoreSpec.TlsSettings toSettings() {
            return new SecretStoreSpec.TlsSettings(toPath(caCert), toPath(clientCert), toPath(clientKey));
        }
    }

    @Data
    public static class Secret {

        private String name;

        /** Path of the secret below the mount. */
        private String key;

        private String mountPath = "secret";

        /** v1 or v2. */
        private String kvVersion = "v2";

        /** Namespace override; an empty string selects the root namespace. */
        private String namespace;

        /** Name of a credential set under {@code vault.credentials}; default when unset. */
        private String credentials;

        private Duration refreshInterval = Duration.ofMinutes(5);

        private Map<String, String> templates = new LinkedHashMap<>();

        @Valid
        private List<File> files = new ArrayList<>();

        SecretSpec toSecretSpec() {
            List<OutputFile> outputFiles = new ArrayList<>(files.size());
            for (File file : files) {
                outputFiles.add(file.toOutputFile());
            }
            return SecretSpec.builder()
                    .name(name)
                    .key(key)
                    .mountPath(mountPath)
                    .kvVersion(KvVersion.parse(kvVersion))
                    .namespace(namespace)
                    .credentials(credentials)
                    .refreshInterval(refreshInterval)
                    .templates(templates)
                    .files(outputFiles)
                    .build();
        }
    }

    @Data
    public static class File {

        @NotBlank
        private String path;

        /** Octal permissions, at most 0644. */
        private String mode = "0600";

        private Integer owner;

        private Integer group;

        OutputFile toOutputFile() {
            return new OutputFile(path, mode, owner, group);
        }
    }

    @Data
    public static class Retry {

        private Duration initialBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofMinutes(5);

        private double multiplier = 2.0;

        private int maxRetries = 3;

        public RetrySettings toSettings() {
            return new RetrySettings(initialBackoff, maxBackoff, multiplier, maxRetries);
        }
    }

    @Data
    public static class CircuitBreaker {

        /** Trial calls let through while half-open. */
        @Positive
        private int maxRequests = 3;

        /** Calls within the interval needed before the failure ratio is evaluated. */
        @Positive
        private int minimumRequests = 3;

        private double failureRatio = 0.6;

        /** Rolling window over which calls are counted while closed. */
        private Duration interval = Duration.ofSeconds(60);

        /** Time spent open before trial calls are allowed. */
        private Duration timeout = Duration.ofSeconds(30);

        public BreakerSettings toSettings() {
            return new BreakerSettings(maxRequests, minimumRequests, failureRatio, interval, timeout);
        }
    }

    @Data
    public static class Scheduler {

        /** Initial worker threads; grows to the number of secrets. */
        @Positive
        private int poolSize = 4;

        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Health {

        /** File containing {@code ready} once a secret has synced; disabled when unset. */
        private String statusFile;
    }

    /**
     * Store settings as consumed by the engine. Call after validation.
     */
    public SecretStoreSpec toStoreSpec() {
        Map<String, CredentialSet> named = new LinkedHashMap<>();
        vault.getCredentials().forEach((name, auth) -> named.put(name, auth.toCredentialSet()));
        return new SecretStoreSpec(
                vault.getAddress(),
                vault.getAuth().toCredentialSet(),
                named,
                vault.getNamespace(),
                vault.getTls().hasMaterial() ? vault.getTls().toSettings() : null,
                vault.getConnectTimeout(),
                vault.getReadTimeout());
    }

    /**
     * Secrets as consumed by the engine. Call after validation.
     */
    public List<SecretSpec> toSecretSpecs() {
        List<SecretSpec> specs = new ArrayList<>(secrets.size());
        for (Secret secret : secrets) {
            specs.add(secret.toSecretSpec());
        }
        return specs;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static Path toPath(String value) {
        return hasText(value) ? Path.of(value) : null;
    }
}
