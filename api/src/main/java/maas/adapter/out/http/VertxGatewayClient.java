package maas.adapter.out.http;

import java.net.URI;
import java.util.Map;
import java.util.TreeMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;

import maas.adapter.out.telemetry.SpanAttributes;
import maas.core.config.ResiliencyConfig;
import maas.core.model.probe.GatewayCall;
import maas.core.model.probe.GatewayExchange;
import maas.core.port.out.GatewayClient;

/**
 * HTTP adapter sending gateway probe calls with Vert.x WebClient.
 *
 * <p>A {@code Host} header in the call becomes the request's virtual host, which the gateway
 * routes on. W3C Trace Context headers are propagated to the gateway.
 */
@ApplicationScoped
public class VertxGatewayClient implements GatewayClient {

    private static final TextMapSetter<HttpRequest<Buffer>> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);
    private static final String INSTRUMENTATION_SCOPE = "maas-console";

    private final ClusterWebClients webClients;
    private final ResiliencyConfig resiliency;
    private final Tracer tracer;
    private final TextMapPropagator propagator;

    @Inject
    public VertxGatewayClient(ClusterWebClients webClients, ResiliencyConfig resiliency, OpenTelemetry openTelemetry) {
        this.webClients = webClients;
        this.resiliency = resiliency;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
        this.propagator = openTelemetry.getPropagators().getTextMapPropagator();
    }

    /**
     * Send the call. A URL Vert.x cannot use fails the returned {@link Uni} instead of throwing.
     */
    @Override
    public Uni<GatewayExchange> send(GatewayCall call) {
        return Uni.createFrom().deferred(() -> exchange(call));
    }

    private Uni<GatewayExchange> exchange(GatewayCall call) {
        final var targetUri = URI.create(call.url());

        final var spanBuilder = tracer.spanBuilder("HTTP " + call.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, call.method())
                .setAttribute(SpanAttributes.HTTP_URL, call.url())
                .setAttribute(SpanAttributes.NET_PEER_NAME, String.valueOf(targetUri.getHost()))
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri));
        final var model = call.body().get("model");
        if (model != null) {
            spanBuilder.setAttribute(SpanAttributes.PROBE_MODEL, model.toString());
        }
        final var span = spanBuilder.startSpan();

        final HttpRequest<Buffer> request;
        try {
            request = webClients
                    .standard()
                    .requestAbs(HttpMethod.valueOf(call.method()), call.url())
                    .timeout(resiliency.probeTimeout().toMillis());
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            span.end();
            throw e;
        }
        for (final var header : call.headers().entrySet()) {
            if ("Host".equalsIgnoreCase(header.getKey())) {
                request.virtualHost(header.getValue());
                span.setAttribute(SpanAttributes.PROBE_ROUTE_HOST, header.getValue());
            } else {
                request.putHeader(header.getKey(), header.getValue());
            }
        }

        propagator.inject(Context.current().with(span), request, HEADER_SETTER);

        return request.sendJson(call.body())
                .map(VertxGatewayClient::toExchange)
                .invoke(exchange -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) exchange.statusCode());
                    if (exchange.statusCode() >= 400) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + exchange.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
                    span.recordException(error);
                    span.end();
                });
    }

    private static int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private static GatewayExchange toExchange(HttpResponse<Buffer> response) {
        final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (final var name : response.headers().names()) {
            headers.put(name, String.join(", ", response.headers().getAll(name)));
        }
        final var body = response.body() != null ? response.bodyAsString() : "";
        return new GatewayExchange(response.statusCode(), headers, body);
    }
}
