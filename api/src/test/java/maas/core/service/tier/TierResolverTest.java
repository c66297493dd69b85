package maas.core.service.tier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import maas.core.config.KeyManagerConfig;
import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.common.UpstreamUnreachableException;
import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TeamRecord;
import maas.core.model.tier.TierInfo;
import maas.core.port.out.KeyManagerClient;
import maas.core.port.out.Metrics;

@DisplayName("TierResolver")
@ExtendWith(MockitoExtension.class)
class TierResolverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private KeyManagerClient keyManager;

    @Mock
    private KeyManagerConfig config;

    @Mock
    private Metrics metrics;

    private TierResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TierResolver(keyManager, config, metrics);
    }

    @Nested
    @DisplayName("getTierInfo")
    class GetTierInfo {

        @Test
        @DisplayName("should map the team record onto a tier")
        void shouldMapTeam() {
            when(keyManager.fetchTeam("research"))
                    .thenReturn(Uni.createFrom()
                            .item(new TeamRecord(
                                    "research", "Research", "premium-policy", 250, 10_000, List.of("qwen3", "granite"))));

            final var tier = resolver.getTierInfo("research").await().atMost(TIMEOUT);

            assertEquals("premium-policy", tier.policyName());
            assertEquals(250, tier.usage());
            assertEquals(10_000, tier.limit());
            assertEquals(List.of("qwen3", "granite"), List.copyOf(tier.allowedModels()));
            assertEquals("Research", tier.teamName());
            assertFalse(tier.isUnlimited());
            verify(metrics).recordUpstreamCall("key-manager", "success");
        }

        @Test
        @DisplayName("should ask for the default team when none is named")
        void shouldUseDefaultTeam() {
            when(config.defaultTeamId()).thenReturn("default");
            when(keyManager.fetchTeam("default"))
                    .thenReturn(Uni.createFrom()
                            .item(new TeamRecord("default", "Default", "free-policy", 0, 0, List.of())));

            final var tier = resolver.getTierInfo("  ").await().atMost(TIMEOUT);

            assertEquals("free-policy", tier.policyName());
            assertTrue(tier.isUnlimited());
        }

        @Test
        @DisplayName("should fall back when the key manager is unreachable")
        void shouldFallBackWhenUnreachable() {
            when(keyManager.fetchTeam("research"))
                    .thenReturn(Uni.createFrom().failure(new UpstreamUnreachableException("key-manager", "refused")));

            final var tier = resolver.getTierInfo("research").await().atMost(TIMEOUT);

            assertEquals(TierInfo.fallback("research"), tier);
            assertEquals("unlimited-policy", tier.policyName());
            assertEquals(100_000, tier.limit());
            assertEquals("Default Team", tier.teamName());
            assertEquals(Set.of(), tier.allowedModels());
            verify(metrics).recordUpstreamCall("key-manager", "unreachable");
        }

        @Test
        @DisplayName("should fall back when the key manager call cannot be built")
        void shouldFallBackWhenCallThrows() {
            when(keyManager.fetchTeam("research")).thenThrow(new IllegalArgumentException("unknown protocol"));

            final var tier = resolver.getTierInfo("research").await().atMost(TIMEOUT);

            assertEquals(TierInfo.fallback("research"), tier);
            verify(metrics).recordUpstreamCall("key-manager", "failure");
        }

        @Test
        @DisplayName("should fall back when the team has no policy")
        void shouldFallBackOnMalformedTeam() {
            when(keyManager.fetchTeam("research"))
                    .thenReturn(Uni.createFrom()
                            .failure(new MalformedUpstreamDataException("key-manager", "team has no policy")));

            final var tier = resolver.getTierInfo("research").await().atMost(TIMEOUT);

            assertEquals(TierInfo.FALLBACK_POLICY, tier.policyName());
            verify(metrics).recordUpstreamCall("key-manager", "malformed");
        }
    }

    @Nested
    @DisplayName("listUserKeys")
    class ListUserKeys {

        @Test
        @DisplayName("should return keys in key manager order")
        void shouldReturnKeys() {
            final var first = new ApiKeySummary(
                    "key-a", "Laptop", "2025-01-02", "active", "research", "Research", "premium-policy");
            final var second = new ApiKeySummary(
                    "key-b", "CI", "2025-02-03", "revoked", "research", "Research", "premium-policy");
            when(keyManager.fetchUserKeys("alice")).thenReturn(Uni.createFrom().item(List.of(first, second)));

            final var keys = resolver.listUserKeys("alice").await().atMost(TIMEOUT);

            assertEquals(List.of(first, second), keys);
        }

        @Test
        @DisplayName("should return no keys when the key manager fails")
        void shouldReturnEmptyOnFailure() {
            when(config.defaultUserId()).thenReturn("default");
            when(keyManager.fetchUserKeys("default"))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("socket closed")));

            final var keys = resolver.listUserKeys(null).await().atMost(TIMEOUT);

            assertTrue(keys.isEmpty());
            verify(metrics).recordUpstreamCall("key-manager", "failure");
        }

        @Test
        @DisplayName("should return no keys when the key manager call cannot be built")
        void shouldReturnEmptyWhenCallThrows() {
            when(keyManager.fetchUserKeys("alice")).thenThrow(new IllegalStateException("no key manager host"));

            final var keys = resolver.listUserKeys("alice").await().atMost(TIMEOUT);

            assertTrue(keys.isEmpty());
        }
    }
}
