package maas.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import maas.core.model.policy.source.AuthPolicyResource;
import maas.core.model.policy.source.RateLimitPolicyResource;

/**
 * Port for reading policy-engine resources.
 *
 * <p>Failures surface as {@link maas.core.model.common.UpstreamException} subtypes.
 */
public interface PolicySource {

    /**
     * Check whether the policy API group is served.
     *
     * @return true when the group is available
     */
    Uni<Boolean> isApiGroupAvailable();

    /**
     * List authentication policies in source order.
     *
     * @return auth policy resources
     */
    Uni<List<AuthPolicyResource>> fetchAuthPolicies();

    /**
     * List rate-limit policies in source order.
     *
     * @return rate-limit policy resources
     */
    Uni<List<RateLimitPolicyResource>> fetchRateLimitPolicies();
}
