package maas.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the execution context.
 *
 * <p>Configuration prefix: {@code maas.execution}
 *
 * <p>Whether the process runs inside the managed cluster decides which hosts are used for
 * every upstream. When {@code managed} is not set it is detected from the presence of the
 * service-account token file.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code MAAS_EXECUTION_MANAGED} - Force in-cluster or external mode</li>
 *   <li>{@code MAAS_EXECUTION_LOCAL_DEVELOPMENT} - Allow zero-baseline metrics when no host answers</li>
 *   <li>{@code MAAS_EXECUTION_CLUSTER_TOKEN} - Bearer token for external cluster access</li>
 * </ul>
 */
@ConfigMapping(prefix = "maas.execution")
public interface ExecutionConfig {

    /**
     * Explicit in-cluster flag. Empty means detect.
     */
    Optional<Boolean> managed();

    /**
     * Local development mode.
     *
     * <p>When enabled, an unreachable metrics backend yields an all-zero baseline instead of
     * an error.
     *
     * @return true in local development (default: false)
     */
    @WithDefault("false")
    boolean localDevelopment();

    /**
     * Service-account token mounted into pods.
     *
     * @return token path
     */
    @WithDefault("/var/run/secrets/kubernetes.io/serviceaccount/token")
    String serviceAccountTokenPath();

    /**
     * Cluster CA bundle mounted into pods.
     *
     * @return CA path
     */
    @WithDefault("/var/run/secrets/kubernetes.io/serviceaccount/ca.crt")
    String serviceAccountCaPath();

    /**
     * Bearer token for the cluster API and metrics routes when running outside the cluster.
     *
     * <p>Obtained out of band (for example {@code oc whoami -t}) and passed in through the
     * environment.
     */
    Optional<String> clusterToken();

    /**
     * Verify TLS certificates of external endpoints.
     *
     * @return true to verify (default: true)
     */
    @WithDefault("true")
    boolean tlsVerify();
}
