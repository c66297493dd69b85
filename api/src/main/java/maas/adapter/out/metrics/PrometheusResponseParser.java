package maas.adapter.out.metrics;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import maas.core.model.common.MalformedUpstreamDataException;

/**
 * Read Prometheus instant-query responses.
 *
 * <p>Expected shape: {@code {"status":"success","data":{"result":[{"value":[ts,"1.0"]}]}}}.
 */
@ApplicationScoped
public class PrometheusResponseParser {

    static final String UPSTREAM = "metrics";
    static final String SUCCESS = "success";

    private final ObjectMapper objectMapper;

    @Inject
    public PrometheusResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Whether the response reports a successful query.
     */
    public boolean isSuccess(String body) {
        return SUCCESS.equals(read(body).path("status").asText(null));
    }

    /**
     * First sample value of the result set.
     *
     * @param body response body
     * @return the value, empty when the result set is empty
     * @throws MalformedUpstreamDataException when the body is not a successful query response
     */
    public Optional<Double> firstValue(String body) {
        final var root = read(body);
        if (!isSuccessStatus(root)) {
            throw new MalformedUpstreamDataException(
                    UPSTREAM, "Query status is " + root.path("status").asText("missing"));
        }
        final var result = root.path("data").path("result");
        if (!result.isArray()) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Query result is not an array");
        }
        if (result.isEmpty()) {
            return Optional.empty();
        }
        final var value = result.get(0).path("value");
        if (!value.isArray() || value.size() < 2) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Query sample has no value");
        }
        final var sample = value.get(1);
        if (sample.isNumber()) {
            return Optional.of(sample.asDouble());
        }
        try {
            return Optional.of(Double.parseDouble(sample.asText()));
        } catch (NumberFormatException e) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Query sample is not numeric: " + sample.asText(), e);
        }
    }

    private static boolean isSuccessStatus(JsonNode root) {
        return SUCCESS.equals(root.path("status").asText(null));
    }

    private JsonNode read(String body) {
        try {
            final var root = objectMapper.readTree(body == null ? "" : body);
            if (root == null || !root.isObject()) {
                throw new MalformedUpstreamDataException(UPSTREAM, "Query response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedUpstreamDataException(UPSTREAM, "Query response is not valid JSON", e);
        }
    }
}
