package maas.core.config;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the metrics backend.
 *
 * <p>Configuration prefix: {@code maas.metrics}
 *
 * <p>Hosts are tried in the listed order; the first one that answers the liveness query
 * serves every query of the cycle.
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * maas.metrics.external-hosts=https://prometheus-user-workload.apps.example.com
 * maas.metrics.queries.rate_limited=sum(envoy_ratelimited_total)
 * </pre>
 */
@ConfigMapping(prefix = "maas.metrics")
public interface MetricsConfig {

    /**
     * Candidate hosts inside the cluster, highest priority first.
     */
    @WithDefault("https://prometheus-user-workload.openshift-user-workload-monitoring.svc.cluster.local:9091,"
            + "https://prometheus-k8s.openshift-monitoring.svc.cluster.local:9091")
    List<String> internalHosts();

    /**
     * Candidate hosts reachable from outside the cluster, highest priority first.
     */
    Optional<List<String>> externalHosts();

    /**
     * Expression overrides keyed by query key (for example {@code accepted_requests}).
     */
    Map<String, String> queries();
}
