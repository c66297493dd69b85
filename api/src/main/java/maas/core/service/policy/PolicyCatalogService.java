package maas.core.service.policy;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import maas.core.config.PolicyEngineConfig;
import maas.core.model.policy.Policy;
import maas.core.port.in.PolicyCatalog;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.Metrics;
import maas.core.port.out.PolicySource;
import maas.core.service.common.UpstreamFailures;

/**
 * List normalized policies from the policy engine.
 *
 * <p>The two feeds are fetched concurrently and fail independently: a feed that cannot be
 * read contributes nothing, the other feed's policies are still returned. Inside the cluster
 * the API group is checked first when discovery checks are enabled.
 */
@ApplicationScoped
public class PolicyCatalogService implements PolicyCatalog {

    private static final Logger LOG = Logger.getLogger(PolicyCatalogService.class);
    private static final String UPSTREAM = "policy-engine";

    private final PolicySource policySource;
    private final PolicyNormalizer normalizer;
    private final ExecutionContext executionContext;
    private final PolicyEngineConfig config;
    private final Metrics metrics;

    @Inject
    public PolicyCatalogService(
            PolicySource policySource,
            PolicyNormalizer normalizer,
            ExecutionContext executionContext,
            PolicyEngineConfig config,
            Metrics metrics) {
        this.policySource = policySource;
        this.normalizer = normalizer;
        this.executionContext = executionContext;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<List<Policy>> listPolicies() {
        return checkApiGroup().flatMap(available -> {
            if (!available) {
                LOG.warnf("Policy API group %s is not available, returning no policies", config.apiGroup());
                return Uni.createFrom().item(List.<Policy>of());
            }
            final var authPolicies = policySource
                    .fetchAuthPolicies()
                    .invoke(ignored -> metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.SUCCESS))
                    .onFailure()
                    .recoverWithItem(error -> emptyFeed("auth policies", error));
            final var rateLimitPolicies = policySource
                    .fetchRateLimitPolicies()
                    .invoke(ignored -> metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.SUCCESS))
                    .onFailure()
                    .recoverWithItem(error -> emptyFeed("rate-limit policies", error));
            return Uni.combine()
                    .all()
                    .unis(authPolicies, rateLimitPolicies)
                    .asTuple()
                    .map(feeds -> normalizer.normalize(feeds.getItem1(), feeds.getItem2()))
                    .invoke(policies -> LOG.debugf("Normalized %d policies", policies.size()));
        });
    }

    private Uni<Boolean> checkApiGroup() {
        if (!executionContext.isManaged() || !config.discoveryCheck()) {
            return Uni.createFrom().item(true);
        }
        return policySource.isApiGroupAvailable().onFailure().recoverWithItem(error -> {
            LOG.warnf("API group discovery failed: %s", error.getMessage());
            metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.label(error));
            return false;
        });
    }

    private <T> List<T> emptyFeed(String feed, Throwable error) {
        LOG.warnf("Unable to list %s: %s", feed, error.getMessage());
        metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.label(error));
        return List.of();
    }
}
