package maas.adapter.out.metrics;

import java.time.Duration;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;

import maas.adapter.out.environment.ClusterCredentials;
import maas.adapter.out.http.ClusterWebClients;
import maas.adapter.out.http.UpstreamCallFailures;
import maas.core.config.ResiliencyConfig;
import maas.core.model.common.UpstreamErrorException;
import maas.core.port.out.MetricsSource;

/**
 * Metrics source speaking the Prometheus HTTP query API ({@code GET /api/v1/query}).
 */
@ApplicationScoped
public class PrometheusMetricsSource implements MetricsSource {

    static final String QUERY_PATH = "/api/v1/query";
    static final String LIVENESS_QUERY = "up";
    private static final String UPSTREAM = "metrics";

    private final ClusterWebClients webClients;
    private final ClusterCredentials credentials;
    private final ResiliencyConfig resiliency;
    private final PrometheusResponseParser parser;

    @Inject
    public PrometheusMetricsSource(
            ClusterWebClients webClients,
            ClusterCredentials credentials,
            ResiliencyConfig resiliency,
            PrometheusResponseParser parser) {
        this.webClients = webClients;
        this.credentials = credentials;
        this.resiliency = resiliency;
        this.parser = parser;
    }

    @Override
    public Uni<Boolean> isLive(String host) {
        return query(host, LIVENESS_QUERY, resiliency.livenessTimeout())
                .map(response -> response.statusCode() == 200 && parser.isSuccess(response.bodyAsString()));
    }

    @Override
    public Uni<Optional<Double>> query(String host, String expression) {
        return query(host, expression, resiliency.queryTimeout()).map(response -> {
            if (response.statusCode() != 200) {
                throw new UpstreamErrorException(
                        UPSTREAM, response.statusCode(), "Query returned " + response.statusCode());
            }
            return parser.firstValue(response.bodyAsString());
        });
    }

    private Uni<HttpResponse<Buffer>> query(String host, String expression, Duration timeout) {
        final var url = host + QUERY_PATH;
        return credentials
                .bearerToken()
                .flatMap(token -> {
                    final var request = webClients
                            .cluster()
                            .getAbs(url)
                            .addQueryParam("query", expression)
                            .timeout(timeout.toMillis())
                            .putHeader("Accept", "application/json");
                    token.ifPresent(value -> request.putHeader("Authorization", "Bearer " + value));
                    return request.send();
                })
                .onFailure()
                .transform(error -> UpstreamCallFailures.translate(UPSTREAM, url, error));
    }
}
