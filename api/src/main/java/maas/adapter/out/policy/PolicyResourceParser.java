package maas.adapter.out.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.policy.Rate;
import maas.core.model.policy.source.AuthPolicyResource;
import maas.core.model.policy.source.AuthenticationRule;
import maas.core.model.policy.source.AuthorizationRule;
import maas.core.model.policy.source.RateLimitDefinition;
import maas.core.model.policy.source.RateLimitPolicyResource;
import maas.core.model.policy.source.ResourceMetadata;

/**
 * Deserialize policy-engine list responses ({@code {items:[{metadata, spec, status}]}}).
 *
 * <p>Absent optional sections read as empty. A rate whose limit is not a number keeps an
 * unknown limit. A body that is not a list object, or a rule of the wrong shape, fails the
 * whole response with {@link MalformedUpstreamDataException}.
 * Object key order is preserved throughout.
 */
@ApplicationScoped
public class PolicyResourceParser {

    private static final Logger LOG = Logger.getLogger(PolicyResourceParser.class);

    static final String UPSTREAM = "policy-engine";
    static final String UNKNOWN_WINDOW = "unknown";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    @Inject
    public PolicyResourceParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<AuthPolicyResource> parseAuthPolicies(String body) {
        final var result = new ArrayList<AuthPolicyResource>();
        for (final var item : items(body)) {
            final var spec = item.path("spec");
            final var rules = spec.path("rules");

            final var authentication = new LinkedHashMap<String, AuthenticationRule>();
            rules.path("authentication").fields().forEachRemaining(rule -> {
                final var prefix =
                        rule.getValue().path("credentials").path("authorizationHeader").path("prefix");
                authentication.put(
                        rule.getKey(),
                        new AuthenticationRule(prefix.isTextual() ? prefix.asText() : null, toMap(rule.getValue())));
            });

            final var authorization = new LinkedHashMap<String, AuthorizationRule>();
            rules.path("authorization").fields().forEachRemaining(rule -> {
                final var rego = rule.getValue().path("opa").path("rego");
                authorization.put(
                        rule.getKey(),
                        new AuthorizationRule(rego.isTextual() ? rego.asText() : null, toMap(rule.getValue())));
            });

            final var response = new LinkedHashMap<String, Map<String, Object>>();
            rules.path("response")
                    .fields()
                    .forEachRemaining(rule -> response.put(rule.getKey(), toMap(rule.getValue())));

            result.add(new AuthPolicyResource(
                    metadata(item),
                    toMap(spec.path("targetRef")),
                    authentication,
                    authorization,
                    response,
                    toMap(spec),
                    toMap(item.path("status"))));
        }
        return result;
    }

    public List<RateLimitPolicyResource> parseRateLimitPolicies(String body) {
        final var result = new ArrayList<RateLimitPolicyResource>();
        for (final var item : items(body)) {
            final var spec = item.path("spec");
            final var limits = new LinkedHashMap<String, RateLimitDefinition>();
            spec.path("limits").fields().forEachRemaining(limit -> limits.put(
                    limit.getKey(), limitDefinition(limit.getKey(), limit.getValue())));
            result.add(new RateLimitPolicyResource(
                    metadata(item), toMap(spec.path("targetRef")), limits, toMap(spec), toMap(item.path("status"))));
        }
        return result;
    }

    private RateLimitDefinition limitDefinition(String name, JsonNode limit) {
        if (!limit.isObject()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Limit " + name + " is not an object");
        }
        final var rates = new ArrayList<Rate>();
        for (final var rate : limit.path("rates")) {
            final var window = rate.path("window");
            rates.add(new Rate(
                    limitValue(name, rate.path("limit")),
                    window.isTextual() && !window.asText().isBlank() ? window.asText() : UNKNOWN_WINDOW));
        }
        final var conditions = new ArrayList<String>();
        for (final var condition : limit.path("when")) {
            final var predicate = condition.path("predicate");
            if (predicate.isTextual() && !predicate.asText().isBlank()) {
                conditions.add(predicate.asText());
            }
        }
        final var counters = new ArrayList<String>();
        for (final var counter : limit.path("counters")) {
            if (counter.isTextual()) {
                counters.add(counter.asText());
            } else if (counter.path("expression").isTextual()) {
                counters.add(counter.path("expression").asText());
            }
        }
        return new RateLimitDefinition(rates, conditions, counters, toMap(limit));
    }

    private static OptionalLong limitValue(String name, JsonNode value) {
        if (value.isIntegralNumber()) {
            return OptionalLong.of(value.asLong());
        }
        if (value.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                LOG.debugf("Limit %s has a non-numeric rate: %s", name, value.asText());
                return OptionalLong.empty();
            }
        }
        LOG.debugf("Limit %s has a rate without a limit", name);
        return OptionalLong.empty();
    }

    private JsonNode items(String body) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Policy list is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Policy list is not a JSON object");
        }
        final var items = root.path("items");
        if (items.isMissingNode() || items.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!items.isArray()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Policy list items is not an array");
        }
        return items;
    }

    private static ResourceMetadata metadata(JsonNode item) {
        final var metadata = item.path("metadata");
        return new ResourceMetadata(
                text(metadata, "namespace"),
                text(metadata, "name"),
                text(metadata, "creationTimestamp"),
                text(metadata, "resourceVersion"));
    }

    private static String text(JsonNode node, String field) {
        final var value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }
}
