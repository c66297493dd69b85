package maas.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import maas.core.model.policy.Policy;

/**
 * Use case for listing normalized policies.
 */
public interface PolicyCatalog {

    /**
     * List every policy, auth policies first, each group in source order.
     *
     * <p>Never fails: an unreachable source contributes no policies.
     *
     * @return the normalized policies
     */
    Uni<List<Policy>> listPolicies();
}
