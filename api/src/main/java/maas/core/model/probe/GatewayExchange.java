package maas.core.model.probe;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response received from the gateway.
 *
 * @param statusCode HTTP status
 * @param headers response headers; lookups are case-insensitive
 * @param body response body as text, empty when none
 */
public record GatewayExchange(int statusCode, Map<String, String> headers, String body) {

    public GatewayExchange {
        final var copy = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? "" : body;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
