package com.z254.secretsync.core.vault;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.secretsync.core.model.KvVersion;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for {@link VaultClient} against a mocked Vault HTTP API.
 */
@DisplayName("VaultClient Tests")
class VaultClientTest {

    private static final String ADDRESS = "http://vault.test:8200";

    private MockRestServiceServer server;
    private VaultClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new VaultClient("default", ADDRESS + "/", restTemplate, new ObjectMapper(),
                CircuitBreaker.ofDefaults("test"));
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("should verify a token with lookup-self and use it for reads")
        void shouldAuthenticateWithToken() {
            server.expect(requestTo(ADDRESS + "/v1/auth/token/lookup-self"))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(header(VaultClient.TOKEN_HEADER, "root-token"))
                    .andRespond(withSuccess("{\"data\":{\"id\":\"root-token\"}}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(ADDRESS + "/v1/secret/data/app"))
                    .andExpect(header(VaultClient.TOKEN_HEADER, "root-token"))
                    .andRespond(withSuccess("{\"data\":{\"data\":{\"k\":\"v\"}}}", MediaType.APPLICATION_JSON));

            client.authenticate(new VaultAuthentication.Token("root-token"));
            Map<String, Object> fields = client.readSecret("secret", "app", KvVersion.V2, null);

            assertThat(client.isAuthenticated()).isTrue();
            assertThat(fields).containsEntry("k", "v");
            server.verify();
        }

        @Test
        @DisplayName("should reject a token the store does not accept")
        void shouldRejectInvalidToken() {
            server.expect(requestTo(ADDRESS + "/v1/auth/token/lookup-self"))
                    .andRespond(withStatus(HttpStatus.FORBIDDEN));

            assertThatThrownBy(() -> client.authenticate(new VaultAuthentication.Token("bad")))
                    .isInstanceOf(VaultAuthenticationException.class)
                    .hasMessageContaining("403");
            assertThat(client.isAuthenticated()).isFalse();
        }

        @Test
        @DisplayName("should exchange AppRole credentials for a client token")
        void shouldLoginWithAppRole() {
            server.expect(requestTo(ADDRESS + "/v1/auth/approle/login"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(headerDoesNotExist(VaultClient.TOKEN_HEADER))
                    .andExpect(jsonPath("$.role_id").value("my-role"))
                    .andExpect(jsonPath("$.secret_id").value("my-secret"))
                    .andRespond(withSuccess("{\"auth\":{\"client_token\":\"s.issued\"}}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(ADDRESS + "/v1/secret/data/app"))
                    .andExpect(header(VaultClient.TOKEN_HEADER, "s.issued"))
                    .andRespond(withSuccess("{\"data\":{\"data\":{}}}", MediaType.APPLICATION_JSON));

            client.authenticate(new VaultAuthentication.AppRole("my-role", "my-secret"));
            client.readSecret("secret", "app", KvVersion.V2, null);

            server.verify();
        }

        @Test
        @DisplayName("should fail AppRole login without a client token")
        void shouldFailAppRoleWithoutToken() {
            server.expect(requestTo(ADDRESS + "/v1/auth/approle/login"))
                    .andRespond(withSuccess("{\"auth\":{}}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.authenticate(new VaultAuthentication.AppRole("r", "s")))
                    .isInstanceOf(VaultAuthenticationException.class)
                    .hasMessageContaining("no client token");
        }

        @Test
        @DisplayName("should require the fields of each method")
        void shouldRequireFields() {
            assertThatThrownBy(() -> new VaultAuthentication.Token(""))
                    .isInstanceOf(VaultAuthenticationException.class);
            assertThatThrownBy(() -> new VaultAuthentication.AppRole("role", null))
                    .isInstanceOf(VaultAuthenticationException.class);
            assertThat(new VaultAuthentication.Token("hidden").toString()).doesNotContain("hidden");
        }
    }

    @Nested
    @DisplayName("Reading secrets")
    class ReadingSecrets {

        @Test
        @DisplayName("should unwrap KV v2 data and send the namespace header")
        void shouldReadKvV2() {
            server.expect(requestTo(ADDRESS + "/v1/secret/data/prod/db"))
                    .andExpect(header(VaultClient.NAMESPACE_HEADER, "team-a"))
                    .andRespond(withSuccess(
                            "{\"data\":{\"data\":{\"username\":\"app\",\"port\":5432},\"metadata\":{\"version\":3}}}",
                            MediaType.APPLICATION_JSON));

            Map<String, Object> fields = client.readSecret("secret", "prod/db", KvVersion.V2, "team-a");

            assertThat(fields).containsOnlyKeys("username", "port")
                    .containsEntry("username", "app")
                    .containsEntry("port", 5432);
        }

        @Test
        @DisplayName("should read KV v1 data directly and omit an empty namespace")
        void shouldReadKvV1() {
            server.expect(requestTo(ADDRESS + "/v1/kv/app"))
                    .andExpect(headerDoesNotExist(VaultClient.NAMESPACE_HEADER))
                    .andRespond(withSuccess("{\"data\":{\"api_key\":\"xyz\"}}", MediaType.APPLICATION_JSON));

            Map<String, Object> fields = client.readSecret("/kv/", "app", KvVersion.V1, "");

            assertThat(fields).containsExactlyEntriesOf(Map.of("api_key", "xyz"));
        }

        @Test
        @DisplayName("should treat 404 as a protocol error")
        void shouldTreatNotFoundAsProtocolError() {
            server.expect(requestTo(ADDRESS + "/v1/secret/data/missing"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND).body("{\"errors\":[]}")
                            .contentType(MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.readSecret("secret", "missing", KvVersion.V2, null))
                    .isInstanceOf(SecretProtocolException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should treat a response without a data object as a protocol error")
        void shouldRejectMissingData() {
            server.expect(requestTo(ADDRESS + "/v1/secret/data/app"))
                    .andRespond(withSuccess("{\"data\":{\"data\":null}}", MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.readSecret("secret", "app", KvVersion.V2, null))
                    .isInstanceOf(SecretProtocolException.class);
        }

        @Test
        @DisplayName("should report server errors as transient failures")
        void shouldReportServerErrors() {
            server.expect(requestTo(ADDRESS + "/v1/secret/data/app"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            assertThatThrownBy(() -> client.readSecret("secret", "app", KvVersion.V2, null))
                    .isExactlyInstanceOf(SecretFetchException.class)
                    .satisfies(e -> assertThat(((SecretFetchException) e).getStatusCode()).isEqualTo(503));
        }

        @Test
        @DisplayName("should abort reading bodies above the size ceiling")
        void shouldAbortOversizedBody() {
            byte[] body = new byte[BoundedBodyReader.MAX_RESPONSE_BYTES + 1];
            Arrays.fill(body, (byte) ' ');
            server.expect(requestTo(ADDRESS + "/v1/secret/data/huge"))
                    .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.readSecret("secret", "huge", KvVersion.V2, null))
                    .isInstanceOf(SecretProtocolException.class)
                    .hasMessageContaining("exceeds maximum size");
        }
    }

    @Test
    @DisplayName("should build KV paths per version")
    void shouldBuildPaths() {
        assertThat(VaultClient.secretPath("secret", "app/db", KvVersion.V2)).isEqualTo("secret/data/app/db");
        assertThat(VaultClient.secretPath("kv/", "/app", KvVersion.V1)).isEqualTo("kv/app");
    }
}
