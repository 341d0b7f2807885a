package com.z254.secretsync.core.model;

import java.util.Objects;

/**
 * A bundle of authentication parameters for the secret store.
 * <p>
 * Only the fields relevant to {@link #method()} are used: {@code token} for
 * {@link AuthMethod#TOKEN}, {@code roleId}/{@code secretId} for {@link AuthMethod#APPROLE}.
 */
public record CredentialSet(AuthMethod method, String token, String roleId, String secretId) {

    public CredentialSet {
        Objects.requireNonNull(method, "method must not be null");
    }

    public static CredentialSet token(String token) {
        return new CredentialSet(AuthMethod.TOKEN, token, null, null);
    }

    public static CredentialSet appRole(String roleId, String secretId) {
        return new CredentialSet(AuthMethod.APPROLE, null, roleId, secretId);
    }

    @Override
    public String toString() {
        return "CredentialSet[method=" + method + "]";
    }
}
