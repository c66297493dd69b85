package maas.adapter.out.keymanager;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import org.jboss.logging.Logger;

import maas.adapter.out.http.ClusterWebClients;
import maas.adapter.out.http.UpstreamCallFailures;
import maas.core.config.KeyManagerConfig;
import maas.core.config.ResiliencyConfig;
import maas.core.model.common.HostKind;
import maas.core.model.common.UpstreamErrorException;
import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TeamRecord;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.KeyManagerClient;

/**
 * HTTP client for the key-management service.
 *
 * <p>Every call carries the configured admin key as a bearer token.
 */
@ApplicationScoped
public class KeyManagerHttpClient implements KeyManagerClient {

    private static final Logger LOG = Logger.getLogger(KeyManagerHttpClient.class);
    private static final String UPSTREAM = "key-manager";

    private final ClusterWebClients webClients;
    private final ExecutionContext executionContext;
    private final KeyManagerConfig config;
    private final ResiliencyConfig resiliency;
    private final KeyManagerResponseParser parser;

    @Inject
    public KeyManagerHttpClient(
            ClusterWebClients webClients,
            ExecutionContext executionContext,
            KeyManagerConfig config,
            ResiliencyConfig resiliency,
            KeyManagerResponseParser parser) {
        this.webClients = webClients;
        this.executionContext = executionContext;
        this.config = config;
        this.resiliency = resiliency;
        this.parser = parser;
    }

    @Override
    public Uni<TeamRecord> fetchTeam(String teamId) {
        return get("/teams/" + encode(teamId)).map(response -> parser.parseTeam(requireOk(response), teamId));
    }

    @Override
    public Uni<List<ApiKeySummary>> fetchUserKeys(String userId) {
        return get("/users/" + encode(userId) + "/keys").map(response -> parser.parseUserKeys(requireOk(response)));
    }

    private Uni<HttpResponse<Buffer>> get(String path) {
        return Uni.createFrom()
                .item(() -> executionContext.resolveHost(HostKind.KEY_MANAGER) + path)
                .flatMap(url -> Uni.createFrom()
                        .deferred(() -> {
                            LOG.debugf("Calling key manager: %s", url);
                            final var request = webClients
                                    .standard()
                                    .getAbs(url)
                                    .timeout(resiliency.keyManagerTimeout().toMillis())
                                    .putHeader("Content-Type", "application/json")
                                    .putHeader("Accept", "application/json");
                            config.adminKey().ifPresent(key -> request.putHeader("Authorization", "Bearer " + key));
                            return request.send();
                        })
                        .onFailure()
                        .transform(error -> UpstreamCallFailures.translate(UPSTREAM, url, error)));
    }

    private static String requireOk(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new UpstreamErrorException(
                    UPSTREAM, response.statusCode(), "Key manager returned " + response.statusCode());
        }
        return response.bodyAsString();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
