package maas.core.service.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import maas.core.model.policy.AuthenticationItem;
import maas.core.model.policy.AuthorizationItem;
import maas.core.model.policy.PolicyItemType;
import maas.core.model.policy.PolicyType;
import maas.core.model.policy.Rate;
import maas.core.model.policy.RateLimitItem;
import maas.core.model.policy.ResponseItem;
import maas.core.model.policy.source.AuthPolicyResource;
import maas.core.model.policy.source.AuthenticationRule;
import maas.core.model.policy.source.AuthorizationRule;
import maas.core.model.policy.source.RateLimitDefinition;
import maas.core.model.policy.source.RateLimitPolicyResource;
import maas.core.model.policy.source.ResourceMetadata;

@DisplayName("PolicyNormalizer")
class PolicyNormalizerTest {

    private PolicyNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new PolicyNormalizer();
    }

    private static AuthPolicyResource authPolicy(String namespace, String name) {
        final var authentication = new LinkedHashMap<String, AuthenticationRule>();
        authentication.put("api-key-users", new AuthenticationRule("APIKEY", Map.of("apiKey", Map.of())));
        final var authorization = new LinkedHashMap<String, AuthorizationRule>();
        authorization.put(
                "allow-groups", new AuthorizationRule("allow { groups[_] == \"free\" }", Map.of()));
        final var response = new LinkedHashMap<String, Map<String, Object>>();
        response.put("identity-headers", Map.of("headers", Map.of()));
        return new AuthPolicyResource(
                new ResourceMetadata(namespace, name, "2025-01-01T00:00:00Z", "42"),
                Map.of("kind", "Gateway", "name", "inference-gateway"),
                authentication,
                authorization,
                response,
                Map.of("targetRef", Map.of("name", "inference-gateway")),
                Map.of("conditions", List.of()));
    }

    private static RateLimitPolicyResource rateLimitPolicy(String namespace, String name) {
        final var limits = new LinkedHashMap<String, RateLimitDefinition>();
        limits.put(
                "free-user-tokens",
                new RateLimitDefinition(
                        List.of(new Rate(100, "1m")),
                        List.of("auth.identity.tier == \"free\""),
                        List.of("auth.identity.userid"),
                        Map.of()));
        limits.put("premium-user-tokens", new RateLimitDefinition(List.of(), List.of(), List.of(), Map.of()));
        return new RateLimitPolicyResource(
                new ResourceMetadata(namespace, name, null, null), Map.of(), limits, Map.of(), Map.of());
    }

    @Nested
    @DisplayName("Output shape")
    class OutputShape {

        @Test
        @DisplayName("should list auth policies first, then rate-limit policies, in source order")
        void shouldPreserveFeedOrder() {
            final var policies = normalizer.normalize(
                    List.of(authPolicy("llm", "a1"), authPolicy("llm", "a2")),
                    List.of(rateLimitPolicy("llm", "r1")));

            assertEquals(3, policies.size());
            assertEquals(List.of("llm/a1", "llm/a2", "llm/r1"), policies.stream().map(p -> p.id()).toList());
            assertEquals(PolicyType.AUTH, policies.get(0).type());
            assertEquals(PolicyType.RATE_LIMIT, policies.get(2).type());
        }

        @Test
        @DisplayName("should default a missing namespace and name")
        void shouldDefaultIdentity() {
            final var policy = normalizer.normalizeRateLimitPolicy(new RateLimitPolicyResource(
                    ResourceMetadata.empty(), null, null, null, null));

            assertEquals("default/unknown", policy.id());
            assertEquals("default", policy.namespace());
            assertEquals("unknown", policy.name());
            assertEquals("", policy.createdAt());
            assertTrue(policy.items().isEmpty());
        }

        @Test
        @DisplayName("should produce equal output for equal input")
        void shouldBeIdempotent() {
            final var first = normalizer.normalize(List.of(authPolicy("llm", "a1")), List.of(rateLimitPolicy("llm", "r1")));
            final var second =
                    normalizer.normalize(List.of(authPolicy("llm", "a1")), List.of(rateLimitPolicy("llm", "r1")));

            assertEquals(first, second);
        }
    }

    @Nested
    @DisplayName("Auth policies")
    class AuthPolicies {

        @Test
        @DisplayName("should emit authentication, authorization and response items in order")
        void shouldEmitItemsInOrder() {
            final var policy = normalizer.normalizeAuthPolicy(authPolicy("llm", "gateway-auth"));

            assertEquals(
                    List.of(PolicyItemType.AUTHENTICATION, PolicyItemType.AUTHORIZATION, PolicyItemType.RESPONSE),
                    policy.items().stream().map(item -> item.type()).toList());
            assertEquals(
                    "AuthPolicy for inference-gateway with API key authentication and group-based authorization",
                    policy.description());
            assertEquals("42", policy.modifiedAt());
            assertTrue(policy.active());
        }

        @Test
        @DisplayName("should describe items from their rule bodies")
        void shouldDescribeItems() {
            final var items = normalizer.normalizeAuthPolicy(authPolicy("llm", "gateway-auth")).items();

            final var authentication = assertInstanceOf(AuthenticationItem.class, items.get(0));
            assertEquals("API Key authentication with APIKEY prefix", authentication.description());

            final var authorization = assertInstanceOf(AuthorizationItem.class, items.get(1));
            assertEquals(List.of("free"), authorization.allowedGroups());
            assertEquals("OPA policy allowing groups: free", authorization.description());

            final var response = assertInstanceOf(ResponseItem.class, items.get(2));
            assertEquals("Identity-Headers response filter", response.description());
        }

        @Test
        @DisplayName("should fall back to unknown prefix and target")
        void shouldUseUnknownFallbacks() {
            final var policy = normalizer.normalizeAuthPolicy(new AuthPolicyResource(
                    new ResourceMetadata("llm", "bare", null, null),
                    Map.of(),
                    Map.of("anonymous", new AuthenticationRule(null, Map.of())),
                    Map.of(),
                    Map.of(),
                    Map.of(),
                    Map.of()));

            assertEquals("API Key authentication with unknown prefix", policy.items().get(0).description());
            assertTrue(policy.description().startsWith("AuthPolicy for unknown "));
        }
    }

    @Nested
    @DisplayName("Rate-limit policies")
    class RateLimitPolicies {

        @Test
        @DisplayName("should carry rates, conditions and counters per limit")
        void shouldCarryLimitDetails() {
            final var policy = normalizer.normalizeRateLimitPolicy(rateLimitPolicy("llm", "token-limits"));

            assertEquals("Token-based rate limiting policy with per-user limits", policy.description());
            final var limited = assertInstanceOf(RateLimitItem.class, policy.items().get(0));
            assertEquals("free-user-tokens", limited.id());
            assertEquals(List.of(new Rate(100, "1m")), limited.rates());
            assertEquals(List.of("auth.identity.userid"), limited.counters());
            assertEquals("100 tokens per 1m (when: auth.identity.tier == \"free\")", limited.description());
        }

        @Test
        @DisplayName("should describe a limit without rates as unlimited")
        void shouldDescribeUnboundedLimit() {
            final var policy = normalizer.normalizeRateLimitPolicy(rateLimitPolicy("llm", "token-limits"));

            final var unbounded = assertInstanceOf(RateLimitItem.class, policy.items().get(1));
            assertTrue(unbounded.isUnbounded());
            assertEquals("unlimited", unbounded.description());
        }

        @Test
        @DisplayName("should join several rates")
        void shouldJoinRates() {
            assertEquals(
                    "10 tokens per 1s, 1000 tokens per 1h",
                    PolicyNormalizer.describeLimit(List.of(new Rate(10, "1s"), new Rate(1000, "1h")), List.of()));
        }

        @Test
        @DisplayName("should render an unknown limit as unknown")
        void shouldDescribeUnknownLimit() {
            assertEquals(
                    "unknown tokens per 1m, 5 tokens per 1h (when: tier == \"free\")",
                    PolicyNormalizer.describeLimit(
                            List.of(Rate.unknownLimit("1m"), new Rate(5, "1h")), List.of("tier == \"free\"")));
        }
    }

    @Test
    @DisplayName("should capitalize each word of a rule name")
    void shouldTitleCase() {
        assertEquals("Identity-Headers", PolicyNormalizer.titleCase("identity-headers"));
        assertEquals("X_Forwarded User", PolicyNormalizer.titleCase("x_forwarded user"));
        assertEquals("Success", PolicyNormalizer.titleCase("SUCCESS"));
    }
}
