package maas.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import maas.adapter.in.dto.ApiResponse;
import maas.adapter.in.dto.ModelDto;
import maas.core.port.in.GatewayProbeUseCase;

@Path("/api/v1/models")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ModelResource {

    private final GatewayProbeUseCase gatewayProbe;

    @Inject
    public ModelResource(GatewayProbeUseCase gatewayProbe) {
        this.gatewayProbe = gatewayProbe;
    }

    @GET
    public ApiResponse<List<ModelDto>> listModels() {
        return ApiResponse.ok(gatewayProbe.listModels().stream().map(ModelDto::fromModel).toList());
    }
}
