package maas.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;

import maas.adapter.in.dto.ApiKeyDto;
import maas.adapter.in.dto.ApiResponse;
import maas.adapter.in.dto.ProbeResultDto;
import maas.adapter.in.dto.TierDto;
import maas.adapter.in.dto.TokenTestRequest;
import maas.core.model.probe.ProbeOutcome;
import maas.core.port.in.GatewayProbeUseCase;
import maas.core.port.in.TierLookup;

/**
 * REST resource for the key management page: issued keys, the team's tier and token tests.
 *
 * <p>A token test that reached the gateway answers 200 whatever the gateway said; the
 * classification is in the body. Only rejected input answers 400.
 */
@Path("/api/v1/tokens")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TokenResource {

    private final TierLookup tierLookup;
    private final GatewayProbeUseCase gatewayProbe;
    private final ObjectMapper objectMapper;

    @Inject
    public TokenResource(TierLookup tierLookup, GatewayProbeUseCase gatewayProbe, ObjectMapper objectMapper) {
        this.tierLookup = tierLookup;
        this.gatewayProbe = gatewayProbe;
        this.objectMapper = objectMapper;
    }

    @GET
    public Uni<ApiResponse<List<ApiKeyDto>>> listKeys(@QueryParam("userId") String userId) {
        return tierLookup
                .listUserKeys(userId)
                .map(keys -> ApiResponse.ok(keys.stream().map(ApiKeyDto::fromModel).toList()));
    }

    @GET
    @Path("/user/tier")
    public Uni<ApiResponse<TierDto>> tier(@QueryParam("teamId") String teamId) {
        return tierLookup.getTierInfo(teamId).map(tier -> ApiResponse.ok(TierDto.fromModel(tier)));
    }

    @POST
    @Path("/test")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> testToken(TokenTestRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        return gatewayProbe
                .probeGateway(request.model(), request.message(), request.token())
                .map(result -> {
                    final var dto = ProbeResultDto.fromModel(result, objectMapper);
                    if (result.success()) {
                        return Response.ok(ApiResponse.ok(dto)).build();
                    }
                    final var status = result.outcome() == ProbeOutcome.INVALID_INPUT
                            ? Response.Status.BAD_REQUEST
                            : Response.Status.OK;
                    return Response.status(status)
                            .entity(ApiResponse.failure(result.message(), dto))
                            .build();
                });
    }
}
