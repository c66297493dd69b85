package maas.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import maas.core.model.probe.ProbeResult;

/**
 * Outcome of a gateway call, with the request as sent and the response as received.
 *
 * <p>The response body is embedded as JSON when it parses, otherwise as a string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProbeResultDto(
        String message,
        String outcome,
        int statusCode,
        SentRequestDto request,
        ReceivedResponseDto response,
        long simulatorTotal) {

    public record SentRequestDto(String url, String method, Map<String, String> headers, Map<String, Object> body) {}

    public record ReceivedResponseDto(int status, Map<String, String> headers, JsonNode body) {}

    public static ProbeResultDto fromModel(ProbeResult result, ObjectMapper objectMapper) {
        return new ProbeResultDto(
                result.message(),
                result.outcome().name(),
                result.statusCode(),
                result.request()
                        .map(sent -> new SentRequestDto(sent.url(), sent.method(), sent.headers(), sent.body()))
                        .orElse(null),
                result.response()
                        .map(received -> new ReceivedResponseDto(
                                received.status(), received.headers(), body(received.body(), objectMapper)))
                        .orElse(null),
                result.simulatorTotal());
    }

    private static JsonNode body(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return TextNode.valueOf("");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }
}
