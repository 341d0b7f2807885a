package com.z254.secretsync.core.vault;

import com.z254.secretsync.core.model.CredentialSet;

/**
 * How a client proves its identity to the store. Chosen once, when a client is built.
 */
public sealed interface VaultAuthentication
        permits VaultAuthentication.Token, VaultAuthentication.AppRole {

    /**
     * Log {@code client} in and return the session token it must send from now on.
     *
     * @throws VaultAuthenticationException if the store rejects the credentials
     */
    String authenticate(VaultClient client);

    /**
     * Map configuration credentials to the matching variant.
     *
     * @throws VaultAuthenticationException if a required field is missing
     */
    static VaultAuthentication from(CredentialSet credentials) {
        return switch (credentials.method()) {
            case TOKEN -> new Token(credentials.token());
            case APPROLE -> new AppRole(credentials.roleId(), credentials.secretId());
        };
    }

    /**
     * A pre-issued token, verified with a self lookup.
     */
    record Token(String token) implements VaultAuthentication {

        public Token {
            if (token == null || token.isBlank()) {
                throw new VaultAuthenticationException("token is required for token authentication");
            }
        }

        @Override
        public String authenticate(VaultClient client) {
            client.lookupSelf(token);
            return token;
        }

        @Override
        public String toString() {
            return "Token[****]";
        }
    }

    /**
     * Role/secret identifier pair exchanged for a session token.
     */
    record AppRole(String roleId, String secretId) implements VaultAuthentication {

        public AppRole {
            if (roleId == null || roleId.isBlank()) {
                throw new VaultAuthenticationException("roleId is required for approle authentication");
            }
            if (secretId == null || secretId.isBlank()) {
                throw new VaultAuthenticationException("secretId is required for approle authentication");
            }
        }

        @Override
        public String authenticate(VaultClient client) {
            return client.loginAppRole(roleId, secretId);
        }

        @Override
        public String toString() {
            return "AppRole[roleId=" + roleId + "]";
        }
    }
}
