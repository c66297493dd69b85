package maas.core.model.probe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully prepared outbound gateway request.
 *
 * @param url absolute target URL
 * @param method HTTP method
 * @param headers headers to send, in insertion order
 * @param body JSON body as a map
 */
public record GatewayCall(String url, String method, Map<String, String> headers, Map<String, Object> body) {

    public GatewayCall {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }
}
