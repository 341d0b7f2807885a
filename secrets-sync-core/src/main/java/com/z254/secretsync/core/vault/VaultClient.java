package com.z254.secretsync.core.vault;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.secretsync.core.model.KvVersion;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Minimal HTTP client for the Vault / OpenBao v1 API.
 * <p>
 * One instance exists per credential context. It holds the session token obtained at
 * creation and the circuit breaker guarding its reads. Non-2xx responses are turned into
 * {@link SecretFetchException}s here instead of by {@link RestTemplate}.
 */
public class VaultClient {

    private static final Logger log = LoggerFactory.getLogger(VaultClient.class);

    static final String TOKEN_HEADER = "X-Vault-Token";
    static final String NAMESPACE_HEADER = "X-Vault-Namespace";

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final String contextName;
    private final String address;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    private volatile String token;

    public VaultClient(String contextName, String address, RestTemplate restTemplate,
                       ObjectMapper objectMapper, CircuitBreaker circuitBreaker) {
        this.contextName = contextName;
        this.address = stripTrailingSlash(address);
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.circuitBreaker = circuitBreaker;
        this.restTemplate.setErrorHandler(new PassThroughErrorHandler());
    }

    public String contextName() {
        return contextName;
    }

    public CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    boolean isAuthenticated() {
        return token != null;
    }

    /**
     * Log in with the given method and keep the resulting session token.
     *
     * @throws VaultAuthenticationException if the store rejects the login or is unreachable
     */
    public void authenticate(VaultAuthentication authentication) {
        this.token = authentication.authenticate(this);
        log.info("Authenticated Vault client for context '{}' using {}", contextName, authentication);
    }

    /**
     * Verify a token with {@code GET auth/token/lookup-self}.
     */
    void lookupSelf(String candidate) {
        VaultResponse response;
        try {
            response = exchange(HttpMethod.GET, "auth/token/lookup-self", candidate, null, null);
        } catch (SecretFetchException | RestClientException e) {
            throw new VaultAuthenticationException("token lookup failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new VaultAuthenticationException("token lookup failed with status " + response.status());
        }
    }

    /**
     * Exchange an AppRole role/secret pair for a client token.
     */
    String loginAppRole(String roleId, String secretId) {
        VaultResponse response;
        try {
            response = exchange(HttpMethod.POST, "auth/approle/login", null, null,
                    Map.of("role_id", roleId, "secret_id", secretId));
        } catch (SecretFetchException | RestClientException e) {
            throw new VaultAuthenticationException("approle login failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            throw new VaultAuthenticationException("approle login failed with status " + response.status());
        }
        String clientToken = response.body().path("auth").path("client_token").asText("");
        if (clientToken.isEmpty()) {
            throw new VaultAuthenticationException("approle login returned no client token");
        }
        return clientToken;
    }

    /**
     * Read the fields of a KV secret. A single network attempt; retries and the breaker
     * are applied by {@link SecretFetcher}.
     *
     * @param namespace namespace header value; {@code null} or empty sends none
     * @throws SecretProtocolException if the secret is missing or has no data object
     * @throws SecretFetchException    on network failures and other non-2xx responses
     */
    public Map<String, Object> readSecret(String mountPath, String key, KvVersion kvVersion, String namespace) {
        String path = secretPath(mountPath, key, kvVersion);
        VaultResponse response;
        try {
            response = exchange(HttpMethod.GET, path, token, namespace, null);
        } catch (RestClientException e) {
            throw new SecretFetchException("failed to read secret at " + path + ": " + e.getMessage(), e);
        }

        if (response.status() == 404) {
            throw new SecretProtocolException("secret not found at path " + path, 404);
        }
        if (!response.isSuccessful()) {
            throw new SecretFetchException("reading secret at " + path + " failed with status "
                    + response.status(), response.status(), null);
        }

        JsonNode data = response.body().path("data");
        if (kvVersion == KvVersion.V2) {
            data = data.path("data");
        }
        if (!data.isObject()) {
            throw new SecretProtocolException("no secret data found at path " + path);
        }
        return objectMapper.convertValue(data, FIELD_MAP);
    }

    static String secretPath(String mountPath, String key, KvVersion kvVersion) {
        String mount = trimSlashes(mountPath);
        String trimmedKey = trimSlashes(key);
        return kvVersion == KvVersion.V2
                ? mount + "/data/" + trimmedKey
                : mount + "/" + trimmedKey;
    }

    private VaultResponse exchange(HttpMethod method, String path, String sessionToken,
                                   String namespace, Object body) {
        String url = address + "/v1/" + path;
        return restTemplate.execute(url, method, request -> {
            HttpHeaders headers = request.getHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (sessionToken != null) {
                headers.set(TOKEN_HEADER, sessionToken);
            }
            if (namespace != null && !namespace.isEmpty()) {
                headers.set(NAMESPACE_HEADER, namespace);
            }
            if (body != null) {
                headers.setContentType(MediaType.APPLICATION_JSON);
                request.getBody().write(objectMapper.writeValueAsBytes(body));
            }
        }, this::extract);
    }

    private VaultResponse extract(ClientHttpResponse response) throws IOException {
        int status = response.getStatusCode().value();
        byte[] bytes = BoundedBodyReader.read(response.getBody(), BoundedBodyReader.MAX_RESPONSE_BYTES);
        JsonNode body;
        if (bytes.length == 0) {
            body = objectMapper.createObjectNode();
        } else {
            try {
                body = objectMapper.readTree(bytes);
            } catch (IOException e) {
                if (status >= 200 && status < 300) {
                    throw new SecretProtocolException("response body is not valid JSON", e);
                }
                body = objectMapper.createObjectNode();
            }
        }
        return new VaultResponse(status, body);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }

    private record VaultResponse(int status, JsonNode body) {

        boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }

    /**
     * Lets every response reach the extractor so status handling stays in one place.
     */
    private static final class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // hasError never reports an error
        }
    }
}
