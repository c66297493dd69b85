package maas.adapter.out.keymanager;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import maas.adapter.out.http.ClusterWebClients;
import maas.core.config.ExecutionConfig;
import maas.core.config.KeyManagerConfig;
import maas.core.config.ResiliencyConfig;
import maas.core.model.common.HostKind;
import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.common.UpstreamErrorException;
import maas.core.model.common.UpstreamUnreachableException;
import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TierInfo;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.Metrics;
import maas.core.service.tier.TierResolver;

@DisplayName("KeyManagerHttpClient")
@ExtendWith(MockitoExtension.class)
class KeyManagerHttpClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @Mock
    private ExecutionConfig executionConfig;

    @Mock
    private ExecutionContext executionContext;

    @Mock
    private KeyManagerConfig config;

    @Mock
    private ResiliencyConfig resiliency;

    @Mock
    private Metrics metrics;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private KeyManagerHttpClient client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(executionConfig.tlsVerify()).thenReturn(true);
        lenient().when(executionConfig.serviceAccountCaPath()).thenReturn("/nonexistent/ca.crt");
        lenient().when(executionContext.isManaged()).thenReturn(false);
        lenient().when(executionContext.resolveHost(HostKind.KEY_MANAGER)).thenReturn(wireMockServer.baseUrl());
        lenient().when(config.adminKey()).thenReturn(Optional.of("admin-secret"));
        lenient().when(resiliency.keyManagerTimeout()).thenReturn(Duration.ofSeconds(5));

        client = new KeyManagerHttpClient(
                new ClusterWebClients(vertx, executionConfig, executionContext),
                executionContext,
                config,
                resiliency,
                new KeyManagerResponseParser(new ObjectMapper()));
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    @Nested
    @DisplayName("fetchTeam")
    class FetchTeam {

        @Test
        @DisplayName("should read the team with the admin key")
        void shouldReadTeam() {
            wireMockServer.stubFor(get(urlEqualTo("/teams/research"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withBody("{\"team_id\":\"research\",\"team_name\":\"Research\",\"policy\":\"premium-policy\","
                                    + "\"usage\":120,\"limit\":5000,\"models\":[\"qwen3\",\"granite\"]}")));

            final var team = client.fetchTeam("research").await().atMost(TIMEOUT);

            assertEquals("premium-policy", team.policy());
            assertEquals("Research", team.teamName());
            assertEquals(120, team.usage());
            assertEquals(5000, team.limit());
            assertEquals(List.of("qwen3", "granite"), team.models());
            wireMockServer.verify(getRequestedFor(urlEqualTo("/teams/research"))
                    .withHeader("Authorization", equalTo("Bearer admin-secret")));
        }

        @Test
        @DisplayName("should encode team ids into the path")
        void shouldEncodeTeamId() {
            wireMockServer.stubFor(get(urlEqualTo("/teams/data%20science"))
                    .willReturn(aResponse().withStatus(200).withBody("{\"policy\":\"free-policy\"}")));

            final var team = client.fetchTeam("data science").await().atMost(TIMEOUT);

            assertEquals("data science", team.teamId());
            assertEquals(0, team.limit());
        }

        @Test
        @DisplayName("should reject a team without a policy")
        void shouldRejectTeamWithoutPolicy() {
            wireMockServer.stubFor(get(urlEqualTo("/teams/research"))
                    .willReturn(aResponse().withStatus(200).withBody("{\"team_id\":\"research\"}")));

            final var uni = client.fetchTeam("research");

            assertThrows(MalformedUpstreamDataException.class, () -> uni.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail with the status of an error response")
        void shouldFailOnErrorStatus() {
            wireMockServer.stubFor(get(urlEqualTo("/teams/research")).willReturn(aResponse().withStatus(500)));

            final var uni = client.fetchTeam("research");
            final var error = assertThrows(UpstreamErrorException.class, () -> uni.await().atMost(TIMEOUT));

            assertEquals(500, error.statusCode());
        }
    }

    @Nested
    @DisplayName("fetchUserKeys")
    class FetchUserKeys {

        @Test
        @DisplayName("should read keys and default their optional fields")
        void shouldReadKeys() {
            wireMockServer.stubFor(get(urlEqualTo("/users/alice/keys"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withBody("{\"keys\":[{\"secret_name\":\"apikey-alice-1\",\"alias\":\"Laptop\","
                                    + "\"created_at\":\"2025-01-02\",\"status\":\"active\",\"team_id\":\"research\","
                                    + "\"team_name\":\"Research\",\"policy\":\"premium-policy\"},"
                                    + "{\"secret_name\":\"apikey-alice-2\"}]}")));

            final var keys = client.fetchUserKeys("alice").await().atMost(TIMEOUT);

            assertEquals(2, keys.size());
            assertEquals(
                    new ApiKeySummary(
                            "apikey-alice-1", "Laptop", "2025-01-02", "active", "research", "Research", "premium-policy"),
                    keys.get(0));
            assertEquals("apikey-alice-2", keys.get(1).alias());
            assertEquals("active", keys.get(1).status());
        }

        @Test
        @DisplayName("should send no Authorization header without an admin key")
        void shouldOmitMissingAdminKey() {
            when(config.adminKey()).thenReturn(Optional.empty());
            wireMockServer.stubFor(
                    get(urlEqualTo("/users/alice/keys")).willReturn(aResponse().withStatus(200).withBody("{}")));

            final var keys = client.fetchUserKeys("alice").await().atMost(TIMEOUT);

            assertTrue(keys.isEmpty());
            wireMockServer.verify(getRequestedFor(urlEqualTo("/users/alice/keys")).withoutHeader("Authorization"));
        }
    }

    @Nested
    @DisplayName("with an address that has no scheme")
    class SchemelessAddress {

        private static final String ADDRESS = "key-manager.example.com:8080";

        @BeforeEach
        void pointAtSchemelessAddress() {
            when(executionContext.resolveHost(HostKind.KEY_MANAGER)).thenReturn(ADDRESS);
        }

        @Test
        @DisplayName("should report the team lookup as a failed Uni")
        void shouldFailTeamLookupLazily() {
            final var uni = client.fetchTeam("team-a");

            assertThrows(UpstreamUnreachableException.class, () -> uni.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report the key listing as a failed Uni")
        void shouldFailKeyListingLazily() {
            final var uni = client.fetchUserKeys("alice");

            assertThrows(UpstreamUnreachableException.class, () -> uni.await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should let the tier resolver fall back")
        void shouldResolveFallbackTier() {
            final var resolver = new TierResolver(client, config, metrics);

            final var tier = resolver.getTierInfo("team-a").await().atMost(TIMEOUT);

            assertEquals(TierInfo.fallback("team-a"), tier);
        }
    }
}
