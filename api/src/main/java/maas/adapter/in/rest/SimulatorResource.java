package maas.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import maas.adapter.in.dto.ApiResponse;
import maas.adapter.in.dto.ProbeResultDto;
import maas.adapter.in.dto.SimulatorChatRequest;
import maas.core.model.probe.ChatMessage;
import maas.core.model.probe.ProbeRequest;
import maas.core.port.in.GatewayProbeUseCase;

/**
 * REST resource behind the request simulator.
 *
 * <p>The caller's {@code Authorization} header is forwarded untouched, and the gateway's
 * status code is answered back so the simulator can show it.
 */
@Path("/api/v1/simulator")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SimulatorResource {

    private static final Logger LOG = Logger.getLogger(SimulatorResource.class);

    private final GatewayProbeUseCase gatewayProbe;
    private final ObjectMapper objectMapper;

    @Inject
    public SimulatorResource(GatewayProbeUseCase gatewayProbe, ObjectMapper objectMapper) {
        this.gatewayProbe = gatewayProbe;
        this.objectMapper = objectMapper;
    }

    @POST
    @Path("/chat/completions")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> chatCompletions(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, SimulatorChatRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        LOG.debugf("Simulator request: model=%s, tier=%s", request.model(), request.tier());

        final List<ChatMessage> messages = request.messages() == null
                ? List.of()
                : request.messages().stream()
                        .map(message -> new ChatMessage(
                                message.role() == null ? ChatMessage.USER : message.role(), message.content()))
                        .toList();
        return gatewayProbe
                .probe(ProbeRequest.simulation(request.model(), messages, authorization, request.maxTokens()))
                .map(result -> {
                    final var dto = ProbeResultDto.fromModel(result, objectMapper);
                    final var entity = result.success() ? ApiResponse.ok(dto) : ApiResponse.failure(result.message(), dto);
                    return Response.status(result.statusCode()).entity(entity).build();
                });
    }
}
