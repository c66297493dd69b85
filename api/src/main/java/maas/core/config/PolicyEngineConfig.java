package maas.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the policy-engine resource API.
 *
 * <p>Configuration prefix: {@code maas.policy-engine}
 */
@ConfigMapping(prefix = "maas.policy-engine")
public interface PolicyEngineConfig {

    /**
     * API server address used inside the cluster.
     *
     * @return in-cluster URL (default: https://kubernetes.default.svc:443)
     */
    @WithDefault("https://kubernetes.default.svc:443")
    String internalUrl();

    /**
     * Public API server address used from outside the cluster.
     */
    Optional<String> externalUrl();

    /**
     * Restrict listing to one namespace. Empty lists across all namespaces.
     */
    Optional<String> namespace();

    /**
     * API group of the policy resources.
     *
     * @return API group (default: kuadrant.io)
     */
    @WithDefault("kuadrant.io")
    String apiGroup();

    /**
     * Version of the auth policy resource.
     *
     * @return version (default: v1)
     */
    @WithDefault("v1")
    String authPolicyVersion();

    /**
     * Plural resource name of auth policies.
     *
     * @return resource name (default: authpolicies)
     */
    @WithDefault("authpolicies")
    String authPolicyResource();

    /**
     * Version of the rate-limit policy resource.
     *
     * @return version (default: v1alpha1)
     */
    @WithDefault("v1alpha1")
    String rateLimitPolicyVersion();

    /**
     * Plural resource name of rate-limit policies.
     *
     * @return resource name (default: tokenratelimitpolicies)
     */
    @WithDefault("tokenratelimitpolicies")
    String rateLimitPolicyResource();

    /**
     * Check that the API group is served before listing policies (in-cluster only).
     *
     * @return true to check (default: true)
     */
    @WithDefault("true")
    boolean discoveryCheck();
}
