package maas.core.service.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import maas.core.model.policy.AuthenticationItem;
import maas.core.model.policy.AuthorizationItem;
import maas.core.model.policy.Policy;
import maas.core.model.policy.PolicyItem;
import maas.core.model.policy.PolicyType;
import maas.core.model.policy.Rate;
import maas.core.model.policy.RateLimitItem;
import maas.core.model.policy.ResponseItem;
import maas.core.model.policy.source.AuthPolicyResource;
import maas.core.model.policy.source.RateLimitPolicyResource;
import maas.core.model.policy.source.ResourceMetadata;

/**
 * Turn policy-engine resources into the console's unified policy schema.
 *
 * <p>Normalization is a pure function of its input: the same resources always produce
 * equal policies, in the same order. Rule order inside a resource is preserved.
 */
@ApplicationScoped
public class PolicyNormalizer {

    static final String UNKNOWN_PREFIX = "unknown";
    static final String UNKNOWN_TARGET = "unknown";
    static final String UNKNOWN_LIMIT = "unknown";
    static final String RATE_LIMIT_DESCRIPTION = "Token-based rate limiting policy with per-user limits";

    /**
     * Normalize both feeds into one list: auth policies first, then rate-limit policies.
     *
     * @param authPolicies auth policy resources in source order
     * @param rateLimitPolicies rate-limit policy resources in source order
     * @return {@code authPolicies.size() + rateLimitPolicies.size()} policies
     */
    public List<Policy> normalize(
            List<AuthPolicyResource> authPolicies, List<RateLimitPolicyResource> rateLimitPolicies) {
        final var policies = new ArrayList<Policy>(authPolicies.size() + rateLimitPolicies.size());
        for (final var resource : authPolicies) {
            policies.add(normalizeAuthPolicy(resource));
        }
        for (final var resource : rateLimitPolicies) {
            policies.add(normalizeRateLimitPolicy(resource));
        }
        return List.copyOf(policies);
    }

    public Policy normalizeAuthPolicy(AuthPolicyResource resource) {
        final var items = new ArrayList<PolicyItem>();
        resource.authentication().forEach((name, rule) -> items.add(new AuthenticationItem(
                name, "API Key authentication with " + orUnknown(rule.credentialPrefix(), UNKNOWN_PREFIX) + " prefix",
                rule.config())));
        resource.authorization().forEach((name, rule) -> {
            final var groups = AllowedGroupsExtractor.extract(rule.rego());
            items.add(new AuthorizationItem(
                    name, "OPA policy allowing groups: " + String.join(", ", groups), groups, rule.config()));
        });
        resource.response()
                .forEach((name, body) -> items.add(new ResponseItem(name, titleCase(name) + " response filter", body)));

        final var target = resource.targetRef().get("name");
        final var description = "AuthPolicy for "
                + orUnknown(target == null ? null : target.toString(), UNKNOWN_TARGET)
                + " with API key authentication and group-based authorization";
        return build(
                resource.metadata(),
                description,
                PolicyType.AUTH,
                resource.targetRef(),
                items,
                resource.spec(),
                resource.status());
    }

    public Policy normalizeRateLimitPolicy(RateLimitPolicyResource resource) {
        final var items = new ArrayList<PolicyItem>();
        resource.limits().forEach((name, limit) -> items.add(new RateLimitItem(
                name,
                describeLimit(limit.rates(), limit.conditions()),
                limit.rates(),
                limit.conditions(),
                limit.counters(),
                limit.config())));
        return build(
                resource.metadata(),
                RATE_LIMIT_DESCRIPTION,
                PolicyType.RATE_LIMIT,
                resource.targetRef(),
                items,
                resource.spec(),
                resource.status());
    }

    private static Policy build(
            ResourceMetadata metadata,
            String description,
            PolicyType type,
            Map<String, Object> targetRef,
            List<PolicyItem> items,
            Map<String, Object> spec,
            Map<String, Object> status) {
        final var namespace = orUnknown(metadata.namespace(), Policy.DEFAULT_NAMESPACE);
        final var name = orUnknown(metadata.name(), Policy.UNKNOWN_NAME);
        return new Policy(
                Policy.identity(namespace, name),
                name,
                namespace,
                description,
                type,
                targetRef,
                metadata.creationTimestamp(),
                metadata.resourceVersion(),
                true,
                items,
                status,
                spec);
    }

    private static String limitText(Rate rate) {
        return rate.limit().isPresent() ? String.valueOf(rate.limit().getAsLong()) : UNKNOWN_LIMIT;
    }

    static String describeLimit(List<Rate> rates, List<String> conditions) {
        final var description = new StringBuilder();
        if (rates.isEmpty()) {
            description.append("unlimited");
        } else {
            description.append(rates.stream()
                    .map(rate -> limitText(rate) + " tokens per " + rate.window())
                    .collect(Collectors.joining(", ")));
        }
        if (!conditions.isEmpty()) {
            description.append(" (when: ").append(String.join(", ", conditions)).append(')');
        }
        return description.toString();
    }

    /**
     * Capitalize the first letter of every word, where any non-letter separates words.
     */
    static String titleCase(String name) {
        final var result = new StringBuilder(name.length());
        boolean startOfWord = true;
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }

    private static String orUnknown(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
