package com.z254.secretsync.agent.config;

import com.z254.secretsync.core.model.AuthMethod;
import com.z254.secretsync.core.model.KvVersion;
import com.z254.secretsync.core.model.SecretStoreSpec;
import com.z254.secretsync.core.template.TemplateEngine;
import com.z254.secretsync.core.template.TemplateException;
import com.z254.secretsync.core.writer.FileMode;
import com.z254.secretsync.core.writer.FileWriteException;
import com.z254.secretsync.core.writer.SecureFileWriter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic checks of {@link SecretsSyncProperties} that bean validation cannot express.
 * All problems are collected and reported together.
 */
@Slf4j
public class SecretsSyncPropertiesValidator {

    public static final int MAX_SECRETS = 100;
    public static final Duration MIN_REFRESH_INTERVAL = Duration.ofSeconds(30);

    /**
     * @throws ConfigurationException listing every problem found
     */
    public void validate(SecretsSyncProperties properties) {
        List<String> problems = new ArrayList<>();

        validateVault(properties.getVault(), problems);
        validateSecrets(properties, problems);
        validateTuning(properties, problems);

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
        log.info("Configuration valid: {} secret(s), {} named credential set(s)",
                properties.getSecrets().size(), properties.getVault().getCredentials().size());
    }

    private void validateVault(SecretsSyncProperties.Vault vault, List<String> problems) {
        validateAddress(vault.getAddress(), problems);
        validateAuth("vault.auth", vault.getAuth(), problems);
        vault.getCredentials().forEach((name, auth) -> {
            if (SecretStoreSpec.DEFAULT_CONTEXT.equals(name)) {
                problems.add("vault.credentials: '" + name + "' is reserved for vault.auth");
            }
            validateAuth("vault.credentials." + name, auth, problems);
        });
        validateTls(vault.getTls(), problems);
        requirePositive("vault.connect-timeout", vault.getConnectTimeout(), problems);
        requirePositive("vault.read-timeout", vault.getReadTimeout(), problems);
    }

    private void validateAddress(String address, List<String> problems) {
        if (address == null || address.isBlank()) {
            problems.add("vault.address is required");
            return;
        }
        try {
            URI uri = new URI(address);
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                problems.add("vault.address must use http or https: " + address);
            } else if (uri.getHost() == null) {
                problems.add("vault.address has no host: " + address);
            }
        } catch (URISyntaxException e) {
            problems.add("vault.address is not a valid URL: " + e.getMessage());
        }
    }

    private void validateAuth(String prefix, SecretsSyncProperties.Auth auth, List<String> problems) {
        if (auth == null) {
            problems.add(prefix + " is required");
            return;
        }
        AuthMethod method;
        try {
            method = AuthMethod.parse(auth.getMethod());
        } catch (IllegalArgumentException e) {
            problems.add(prefix + ".method: " + e.getMessage());
            return;
        }
        switch (method) {
            case TOKEN -> {
                if (isBlank(auth.getToken())) {
                    problems.add(prefix + ".token is required for token authentication");
                }
            }
            case APPROLE -> {
                if (isBlank(auth.getRoleId())) {
                    problems.add(prefix + ".role-id is required for approle authentication");
                }
                if (isBlank(auth.getSecretId())) {
                    problems.add(prefix + ".secret-id is required for approle authentication");
                }
            }
        }
    }

    private void validateTls(SecretsSyncProperties.Tls tls, List<String> problems) {
        if (tls == null) {
            return;
        }
        if (isBlank(tls.getClientCert()) != isBlank(tls.getClientKey())) {
            problems.add("vault.tls.client-cert and vault.tls.client-key must be set together");
        }
        requireReadableFile("vault.tls.ca-cert", tls.getCaCert(), problems);
        requireReadableFile("vault.tls.client-cert", tls.getClientCert(), problems);
        requireReadableFile("vault.tls.client-key", tls.getClientKey(), problems);
    }

    private void validateSecrets(SecretsSyncProperties properties, List<String> problems) {
        List<SecretsSyncProperties.Secret> secrets = properties.getSecrets();
        if (secrets == null || secrets.isEmpty()) {
            problems.add("at least one secret must be configured");
            return;
        }
        if (secrets.size() > MAX_SECRETS) {
            problems.add("too many secrets: " + secrets.size() + " (maximum " + MAX_SECRETS + ")");
        }

        Set<String> names = new HashSet<>();
        Map<String, String> pathOwners = new HashMap<>();
        for (int i = 0; i < secrets.size(); i++) {
            SecretsSyncProperties.Secret secret = secrets.get(i);
            String prefix = "secrets[" + i + "]";
            if (isBlank(secret.getName())) {
                problems.add(prefix + ".name is required");
            } else {
                prefix = "secret '" + secret.getName() + "'";
                if (!names.add(secret.getName())) {
                    problems.add(prefix + ": duplicate secret name");
                }
            }
            validateSecret(prefix, secret, properties.getVault(), problems);

            for (SecretsSyncProperties.File file : secret.getFiles()) {
                if (file.getPath() == null) {
                    continue;
                }
                String owner = pathOwners.putIfAbsent(file.getPath(), prefix);
                if (owner != null) {
                    problems.add(prefix + ": file " + file.getPath() + " is also written by " + owner);
                }
            }
        }
    }

    private void validateSecret(String prefix, SecretsSyncProperties.Secret secret,
                                SecretsSyncProperties.Vault vault, List<String> problems) {
        if (isBlank(secret.getKey())) {
            problems.add(prefix + ": key is required");
        }
        if (isBlank(secret.getMountPath())) {
            problems.add(prefix + ": mount-path is required");
        }
        try {
            KvVersion.parse(secret.getKvVersion());
        } catch (IllegalArgumentException e) {
            problems.add(prefix + ": " + e.getMessage());
        }

        Duration refresh = secret.getRefreshInterval();
        if (refresh == null || refresh.compareTo(MIN_REFRESH_INTERVAL) < 0) {
            problems.add(prefix + ": refresh-interval must be at least " + MIN_REFRESH_INTERVAL.toSeconds()
                    + "s, got " + refresh);
        }

        String credentials = secret.getCredentials();
        if (!isBlank(credentials) && !SecretStoreSpec.DEFAULT_CONTEXT.equals(credentials)
                && !vault.getCredentials().containsKey(credentials)) {
            problems.add(prefix + ": unknown credentials '" + credentials + "'");
        }

        if (secret.getFiles().isEmpty()) {
            problems.add(prefix + ": at least one file is required");
        }
        if (secret.getTemplates().size() != secret.getFiles().size()) {
            problems.add(String.format("%s: template count (%d) does not match file count (%d)",
                    prefix, secret.getTemplates().size(), secret.getFiles().size()));
        }
        secret.getTemplates().forEach((name, text) -> {
            try {
                TemplateEngine.parseFieldReferences(name, text == null ? "" : text);
            } catch (TemplateException e) {
                problems.add(prefix + ": " + e.getMessage());
            }
        });

        for (SecretsSyncProperties.File file : secret.getFiles()) {
            validateFile(prefix, file, problems);
        }
    }

    private void validateFile(String prefix, SecretsSyncProperties.File file, List<String> problems) {
        try {
            SecureFileWriter.validatePath(file.getPath());
        } catch (FileWriteException e) {
            problems.add(prefix + ": file " + file.getPath() + ": " + e.getMessage());
        }
        try {
            FileMode.parse(file.getMode());
        } catch (FileWriteException e) {
            problems.add(prefix + ": file " + file.getPath() + ": " + e.getMessage());
        }
        if (file.getOwner() != null && file.getOwner() < 0) {
            problems.add(prefix + ": file " + file.getPath() + ": owner must not be negative");
        }
        if (file.getGroup() != null && file.getGroup() < 0) {
            problems.add(prefix + ": file " + file.getPath() + ": group must not be negative");
        }
    }

    private void validateTuning(SecretsSyncProperties properties, List<String> problems) {
        try {
            properties.getRetry().toSettings();
        } catch (IllegalArgumentException e) {
            problems.add("retry: " + e.getMessage());
        }
        try {
            properties.getCircuitBreaker().toSettings();
        } catch (IllegalArgumentException e) {
            problems.add("circuit-breaker: " + e.getMessage());
        }
        if (properties.getScheduler().getPoolSize() < 1) {
            problems.add("scheduler.pool-size must be at least 1");
        }
        requirePositive("scheduler.shutdown-timeout", properties.getScheduler().getShutdownTimeout(), problems);
    }

    private static void requirePositive(String name, Duration value, List<String> problems) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(name + " must be positive");
        }
    }

    private static void requireReadableFile(String name, String path, List<String> problems) {
        if (isBlank(path)) {
            return;
        }
        try {
            if (!Files.isReadable(Path.of(path))) {
                problems.add(name + ": file not found or not readable: " + path);
            }
        } catch (InvalidPathException e) {
            problems.add(name + ": invalid path: " + e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
