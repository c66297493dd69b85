package maas.adapter.out.keymanager;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TeamRecord;

/**
 * Read key-manager responses.
 *
 * <p>A team without a {@code policy} is malformed. Usage, limit and models are optional.
 */
@ApplicationScoped
public class KeyManagerResponseParser {

    static final String UPSTREAM = "key-manager";
    static final String DEFAULT_KEY_STATUS = "active";

    private final ObjectMapper objectMapper;

    @Inject
    public KeyManagerResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TeamRecord parseTeam(String body, String requestedTeamId) {
        final var root = read(body);
        final var policy = text(root, "policy", "");
        if (policy.isBlank()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Team " + requestedTeamId + " has no policy");
        }
        final var models = new ArrayList<String>();
        for (final var model : root.path("models")) {
            if (model.isTextual()) {
                models.add(model.asText());
            }
        }
        return new TeamRecord(
                text(root, "team_id", requestedTeamId),
                text(root, "team_name", ""),
                policy,
                count(root, "usage"),
                count(root, "limit"),
                models);
    }

    public List<ApiKeySummary> parseUserKeys(String body) {
        final var keys = read(body).path("keys");
        if (keys.isMissingNode() || keys.isNull()) {
            return List.of();
        }
        if (!keys.isArray()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "keys is not an array");
        }
        final var result = new ArrayList<ApiKeySummary>();
        for (final var key : keys) {
            final var secretName = text(key, "secret_name", "unknown");
            result.add(new ApiKeySummary(
                    secretName,
                    text(key, "alias", secretName),
                    text(key, "created_at", ""),
                    text(key, "status", DEFAULT_KEY_STATUS),
                    text(key, "team_id", ""),
                    text(key, "team_name", ""),
                    text(key, "policy", "")));
        }
        return List.copyOf(result);
    }

    private JsonNode read(String body) {
        try {
            final var root = objectMapper.readTree(body == null ? "" : body);
            if (root == null || !root.isObject()) {
                throw new MalformedUpstreamDataException(UPSTREAM, "Response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Response is not valid JSON", e);
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        final var value = node.path(field);
        return value.isValueNode() && !value.isNull() && !value.asText().isEmpty() ? value.asText() : fallback;
    }

    private static long count(JsonNode node, String field) {
        final var value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return 0;
        }
        if (!value.isNumber()) {
            throw new MalformedUpstreamDataException(UPSTREAM, field + " is not a number");
        }
        return Math.max(0, value.asLong());
    }
}
