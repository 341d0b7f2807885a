package com.z254.secretsync.core.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.secretsync.core.model.SecretStoreSpec;
import com.z254.secretsync.core.model.SecretStoreSpec.TlsSettings;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ssl.SslBundle;
import org.springframework.boot.ssl.pem.PemSslStoreBundle;
import org.springframework.boot.ssl.pem.PemSslStoreDetails;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import javax.net.ssl.SSLContext;
import java.net.http.HttpClient;
import java.nio.file.Path;

/**
 * Builds unauthenticated {@link VaultClient}s for a secret store: HTTP transport with the
 * configured timeouts and TLS material, plus a fresh circuit breaker per client.
 */
public class VaultClientFactory {

    private static final Logger log = LoggerFactory.getLogger(VaultClientFactory.class);

    private final SecretStoreSpec store;
    private final BreakerSettings breakerSettings;
    private final BreakerStateListener stateListener;
    private final ObjectMapper objectMapper;
    private final SSLContext sslContext;

    public VaultClientFactory(SecretStoreSpec store, BreakerSettings breakerSettings,
                              BreakerStateListener stateListener) {
        this(store, breakerSettings, stateListener, new ObjectMapper());
    }

    public VaultClientFactory(SecretStoreSpec store, BreakerSettings breakerSettings,
                              BreakerStateListener stateListener, ObjectMapper objectMapper) {
        this.store = store;
        this.breakerSettings = breakerSettings;
        this.stateListener = stateListener != null ? stateListener : BreakerStateListener.NO_OP;
        this.objectMapper = objectMapper;
        this.sslContext = createSslContext(store.tls());
    }

    /**
     * Create a client for the given credential context. The client is not yet logged in.
     */
    public VaultClient create(String contextName) {
        return new VaultClient(contextName, store.address(), createRestTemplate(),
                objectMapper, createCircuitBreaker(contextName));
    }

    /**
     * Transport for one client. Overridable so tests can bind a mock server.
     */
    protected RestTemplate createRestTemplate() {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(store.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER);
        if (sslContext != null) {
            builder.sslContext(sslContext);
        }
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(builder.build());
        requestFactory.setReadTimeout(store.readTimeout());
        return new RestTemplate(requestFactory);
    }

    CircuitBreaker createCircuitBreaker(String contextName) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
                .slidingWindowSize(breakerSettings.intervalSeconds())
                .minimumNumberOfCalls(breakerSettings.minimumRequests())
                .failureRateThreshold(breakerSettings.failureRateThresholdPercent())
                .waitDurationInOpenState(breakerSettings.timeout())
                .permittedNumberOfCallsInHalfOpenState(breakerSettings.maxRequests())
                .ignoreExceptions(SecretProtocolException.class, FetchCancelledException.class)
                .build();

        CircuitBreaker breaker = CircuitBreaker.of("vault-" + contextName, config);
        breaker.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State from = event.getStateTransition().getFromState();
            CircuitBreaker.State to = event.getStateTransition().getToState();
            log.warn("Circuit breaker for context '{}' changed state: {} -> {}", contextName, from, to);
            stateListener.onStateChange(contextName, from, to);
        });
        stateListener.onCreated(contextName, breaker.getState());
        return breaker;
    }

    private static SSLContext createSslContext(TlsSettings tls) {
        if (tls == null || (tls.caCert() == null && !tls.hasClientCertificate())) {
            return null;
        }
        PemSslStoreDetails trustStore = tls.caCert() != null
                ? PemSslStoreDetails.forCertificate(location(tls.caCert()))
                : null;
        PemSslStoreDetails keyStore = tls.hasClientCertificate()
                ? PemSslStoreDetails.forCertificate(location(tls.clientCert()))
                        .withPrivateKey(location(tls.clientKey()))
                : null;
        try {
            SSLContext context = SslBundle.of(new PemSslStoreBundle(keyStore, trustStore)).createSslContext();
            log.info("Configured Vault TLS (custom CA: {}, client certificate: {})",
                    tls.caCert() != null, tls.hasClientCertificate());
            return context;
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to load Vault TLS material: " + e.getMessage(), e);
        }
    }

    private static String location(Path path) {
        return "file:" + path.toAbsolutePath();
    }
}
