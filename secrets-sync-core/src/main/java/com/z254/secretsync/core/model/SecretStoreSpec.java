package com.z254.secretsync.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings of the remote secret store, shared by every secret.
 *
 * @param address            base URL, e.g. {@code https://vault.example.com:8200}
 * @param defaultCredentials credentials used when a secret names none
 * @param credentials        named credential sets secrets may refer to
 * @param namespace          default namespace, {@code null} when unset
 * @param tls                TLS material, {@code null} for the JVM defaults
 * @param connectTimeout     TCP connect timeout
 * @param readTimeout        per-request response timeout
 */
public record SecretStoreSpec(
        String address,
        CredentialSet defaultCredentials,
        Map<String, CredentialSet> credentials,
        String namespace,
        TlsSettings tls,
        Duration connectTimeout,
        Duration readTimeout) {

    /**
     * Context name under which the default credentials are cached.
     */
    public static final String DEFAULT_CONTEXT = "default";

    public SecretStoreSpec {
        Objects.requireNonNull(address, "address must not be null");
        Objects.requireNonNull(defaultCredentials, "defaultCredentials must not be null");
        credentials = credentials != null ? Map.copyOf(credentials) : Map.of();
        connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
        readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(15);
    }

    /**
     * Look up credentials by context name; {@code null}, empty and {@value #DEFAULT_CONTEXT}
     * all resolve to the default set.
     */
    public Optional<CredentialSet> credentialsFor(String contextName) {
        if (contextName == null || contextName.isEmpty() || DEFAULT_CONTEXT.equals(contextName)) {
            return Optional.of(defaultCredentials);
        }
        return Optional.ofNullable(credentials.get(contextName));
    }

    /**
     * Context name of a secret: its own override, or {@value #DEFAULT_CONTEXT}.
     */
    public static String contextNameFor(SecretSpec secret) {
        String name = secret.credentials();
        return name == null || name.isEmpty() ? DEFAULT_CONTEXT : name;
    }

    /**
     * Namespace of a secret: its own override when set (an empty string selects the root
     * namespace), otherwise the store-wide default.
     */
    public String namespaceFor(SecretSpec secret) {
        return secret.hasNamespaceOverride() ? secret.namespace() : namespace;
    }

    /**
     * Client TLS material. Certificate and key are PEM files and must be given together.
     */
    public record TlsSettings(Path caCert, Path clientCert, Path clientKey) {

        public boolean hasClientCertificate() {
            return clientCert != null && clientKey != null;
        }
    }
}
