package maas.adapter.out.policy;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import org.jboss.logging.Logger;

import maas.adapter.out.environment.ClusterCredentials;
import maas.adapter.out.http.ClusterWebClients;
import maas.adapter.out.http.UpstreamCallFailures;
import maas.core.config.PolicyEngineConfig;
import maas.core.config.ResiliencyConfig;
import maas.core.model.common.HostKind;
import maas.core.model.common.UpstreamErrorException;
import maas.core.model.policy.source.AuthPolicyResource;
import maas.core.model.policy.source.RateLimitPolicyResource;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.PolicySource;

/**
 * Policy source backed by the Kubernetes API server.
 *
 * <p>In-cluster calls go to the local API endpoint with the service-account token; external
 * calls go to the public API endpoint with the configured bearer token. Both produce the same
 * resources.
 */
@ApplicationScoped
public class KubernetesPolicySource implements PolicySource {

    private static final Logger LOG = Logger.getLogger(KubernetesPolicySource.class);
    private static final String UPSTREAM = "policy-engine";

    private final ClusterWebClients webClients;
    private final ClusterCredentials credentials;
    private final ExecutionContext executionContext;
    private final PolicyEngineConfig config;
    private final ResiliencyConfig resiliency;
    private final PolicyResourceParser parser;

    @Inject
    public KubernetesPolicySource(
            ClusterWebClients webClients,
            ClusterCredentials credentials,
            ExecutionContext executionContext,
            PolicyEngineConfig config,
            ResiliencyConfig resiliency,
            PolicyResourceParser parser) {
        this.webClients = webClients;
        this.credentials = credentials;
        this.executionContext = executionContext;
        this.config = config;
        this.resiliency = resiliency;
        this.parser = parser;
    }

    @Override
    public Uni<Boolean> isApiGroupAvailable() {
        return get("/apis/" + config.apiGroup()).map(response -> {
            if (response.statusCode() == 200) {
                return true;
            }
            if (response.statusCode() == 404) {
                return false;
            }
            throw new UpstreamErrorException(
                    UPSTREAM, response.statusCode(), "API group discovery returned " + response.statusCode());
        });
    }

    @Override
    public Uni<List<AuthPolicyResource>> fetchAuthPolicies() {
        return get(resourcePath(config.authPolicyVersion(), config.authPolicyResource()))
                .map(response -> parser.parseAuthPolicies(requireOk(response, config.authPolicyResource())))
                .invoke(policies -> LOG.debugf("Fetched %d auth policies", policies.size()));
    }

    @Override
    public Uni<List<RateLimitPolicyResource>> fetchRateLimitPolicies() {
        return get(resourcePath(config.rateLimitPolicyVersion(), config.rateLimitPolicyResource()))
                .map(response -> parser.parseRateLimitPolicies(requireOk(response, config.rateLimitPolicyResource())))
                .invoke(policies -> LOG.debugf("Fetched %d rate-limit policies", policies.size()));
    }

    String resourcePath(String version, String resource) {
        final var path = new StringBuilder("/apis/")
                .append(config.apiGroup())
                .append('/')
                .append(version);
        config.namespace()
                .filter(namespace -> !namespace.isBlank())
                .ifPresent(namespace -> path.append("/namespaces/").append(namespace));
        return path.append('/').append(resource).toString();
    }

    private Uni<HttpResponse<Buffer>> get(String path) {
        return Uni.createFrom()
                .item(() -> executionContext.resolveHost(HostKind.POLICY_API) + path)
                .flatMap(url -> credentials
                        .bearerToken()
                        .flatMap(token -> {
                            final var request = webClients
                                    .cluster()
                                    .getAbs(url)
                                    .timeout(resiliency.policyEngineTimeout().toMillis())
                                    .putHeader("Accept", "application/json");
                            token.ifPresent(value -> request.putHeader("Authorization", "Bearer " + value));
                            return request.send();
                        })
                        .onFailure()
                        .transform(error -> UpstreamCallFailures.translate(UPSTREAM, url, error)));
    }

    private static String requireOk(HttpResponse<Buffer> response, String resource) {
        if (response.statusCode() != 200) {
            throw new UpstreamErrorException(
                    UPSTREAM, response.statusCode(), "Listing " + resource + " returned " + response.statusCode());
        }
        return response.bodyAsString();
    }
}
