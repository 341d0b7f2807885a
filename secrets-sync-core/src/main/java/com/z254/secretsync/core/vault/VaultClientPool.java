package com.z254.secretsync.core.vault;

import com.z254.secretsync.core.model.CredentialSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caches one authenticated {@link VaultClient} per credential context name.
 * <p>
 * Login happens outside any lock; when two threads race on the same context both may
 * authenticate, and the first client stored wins. Failed logins are not cached, so the
 * next resolution tries again. The pool performs no retries of its own.
 */
public class VaultClientPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VaultClientPool.class);

    private final VaultClientFactory clientFactory;
    private final ConcurrentMap<String, VaultClient> clients = new ConcurrentHashMap<>();

    public VaultClientPool(VaultClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    /**
     * Return the cached client for {@code contextName}, creating and logging in a new one
     * with {@code credentials} on a miss.
     *
     * @throws VaultAuthenticationException if the login fails
     */
    public VaultClient resolve(String contextName, CredentialSet credentials) {
        VaultClient cached = clients.get(contextName);
        if (cached != null) {
            return cached;
        }
        if (credentials == null) {
            throw new VaultAuthenticationException("no credentials for context '" + contextName + "'");
        }

        VaultAuthentication authentication = VaultAuthentication.from(credentials);
        VaultClient client = clientFactory.create(contextName);
        client.authenticate(authentication);

        VaultClient existing = clients.putIfAbsent(contextName, client);
        if (existing != null) {
            log.debug("Discarding duplicate client for context '{}'", contextName);
            return existing;
        }
        log.info("Created Vault client for context '{}'", contextName);
        return client;
    }

    public int size() {
        return clients.size();
    }

    @Override
    public void close() {
        clients.clear();
    }
}
