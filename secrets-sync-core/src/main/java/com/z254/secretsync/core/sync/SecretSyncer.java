package com.z254.secretsync.core.sync;

import com.z254.secretsync.core.model.CredentialSet;
import com.z254.secretsync.core.model.OutputFile;
import com.z254.secretsync.core.model.SecretSpec;
import com.z254.secretsync.core.model.SecretStoreSpec;
import com.z254.secretsync.core.template.TemplateEngine;
import com.z254.secretsync.core.template.TemplateException;
import com.z254.secretsync.core.vault.RetrySettings;
import com.z254.secretsync.core.vault.SecretFetchException;
import com.z254.secretsync.core.vault.SecretFetcher;
import com.z254.secretsync.core.vault.VaultAuthenticationException;
import com.z254.secretsync.core.vault.VaultClient;
import com.z254.secretsync.core.vault.VaultClientPool;
import com.z254.secretsync.core.writer.FileMode;
import com.z254.secretsync.core.writer.FileWriteException;
import com.z254.secretsync.core.writer.SecureFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one synchronization of a secret: resolve the client for its credential context,
 * fetch the fields, render the templates and write the output files.
 * <p>
 * Templates are paired with files by position: the i-th file receives the i-th template
 * in name order. Every file mode is validated before the first write.
 */
public class SecretSyncer {

    private static final Logger log = LoggerFactory.getLogger(SecretSyncer.class);

    private final SecretStoreSpec store;
    private final VaultClientPool clientPool;
    private final SecretFetcher fetcher;
    private final SecureFileWriter writer;
    private final RetrySettings retrySettings;

    public SecretSyncer(SecretStoreSpec store, VaultClientPool clientPool, SecretFetcher fetcher,
                        SecureFileWriter writer, RetrySettings retrySettings) {
        this.store = store;
        this.clientPool = clientPool;
        this.fetcher = fetcher;
        this.writer = writer;
        this.retrySettings = retrySettings;
    }

    /**
     * @throws SyncException if any stage fails; files written before the failure stay
     */
    public void sync(SecretSpec secret) {
        String contextName = SecretStoreSpec.contextNameFor(secret);
        CredentialSet credentials = store.credentialsFor(contextName)
                .orElseThrow(() -> new SyncException(secret.name(),
                        "unknown credentials '" + contextName + "'"));

        VaultClient client;
        try {
            client = clientPool.resolve(contextName, credentials);
        } catch (VaultAuthenticationException e) {
            throw new SyncException(secret.name(), "authentication failed: " + e.getMessage(), e);
        }

        String namespace = store.namespaceFor(secret);
        Map<String, Object> fields;
        try {
            fields = fetcher.fetch(client, secret.mountPath(), secret.key(), secret.kvVersion(),
                    namespace, retrySettings);
        } catch (SecretFetchException e) {
            throw new SyncException(secret.name(), "fetch failed: " + e.getMessage(), e);
        }

        List<String> rendered = render(secret, fields);
        List<FileMode> modes = parseModes(secret);

        List<OutputFile> files = secret.files();
        for (int i = 0; i < files.size(); i++) {
            OutputFile file = files.get(i);
            try {
                writer.write(file.path(), modes.get(i), file.owner(), file.group(),
                        rendered.get(i).getBytes(StandardCharsets.UTF_8));
            } catch (FileWriteException e) {
                throw new SyncException(secret.name(), "write failed: " + e.getMessage(), e);
            }
        }

        log.debug("Synced secret {} to {} file(s) using context '{}'", secret.name(), files.size(), contextName);
    }

    private List<String> render(SecretSpec secret, Map<String, Object> fields) {
        TemplateEngine engine = new TemplateEngine();
        try {
            secret.templates().forEach(engine::register);
        } catch (TemplateException e) {
            throw new SyncException(secret.name(), "invalid template: " + e.getMessage(), e);
        }

        if (engine.size() != secret.files().size()) {
            throw new SyncException(secret.name(), String.format(
                    "template count (%d) does not match file count (%d)", engine.size(), secret.files().size()));
        }

        Map<String, String> byName = engine.renderAll(fields);
        List<String> rendered = new ArrayList<>(byName.size());
        for (String name : secret.sortedTemplateNames()) {
            rendered.add(byName.get(name));
        }
        return rendered;
    }

    private static List<FileMode> parseModes(SecretSpec secret) {
        List<FileMode> modes = new ArrayList<>(secret.files().size());
        for (OutputFile file : secret.files()) {
            try {
                modes.add(FileMode.parse(file.mode()));
            } catch (FileWriteException e) {
                throw new SyncException(secret.name(),
                        "invalid mode for " + file.path() + ": " + e.getMessage(), e);
            }
        }
        return modes;
    }
}
