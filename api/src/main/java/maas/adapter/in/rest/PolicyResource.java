package maas.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import maas.adapter.in.dto.ApiResponse;
import maas.adapter.in.dto.PolicyDto;
import maas.core.port.in.PolicyCatalog;

/**
 * REST resource listing normalized policies.
 *
 * <p>An empty catalog is reported with {@code success=false} and an empty list, still with
 * status 200, so the console can tell "nothing configured or reachable" from a server error.
 */
@Path("/api/v1/policies")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class PolicyResource {

    static final String NO_POLICIES = "No policies found: the policy engine is unreachable or has no policies";

    private final PolicyCatalog policyCatalog;

    @Inject
    public PolicyResource(PolicyCatalog policyCatalog) {
        this.policyCatalog = policyCatalog;
    }

    @GET
    public Uni<ApiResponse<List<PolicyDto>>> listPolicies() {
        return policyCatalog.listPolicies().map(policies -> {
            final var dtos = policies.stream().map(PolicyDto::fromModel).toList();
            return dtos.isEmpty() ? ApiResponse.failure(NO_POLICIES, dtos) : ApiResponse.ok(dtos);
        });
    }
}
