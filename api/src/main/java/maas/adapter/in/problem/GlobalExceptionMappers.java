package maas.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import maas.adapter.in.dto.ApiResponse;
import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.common.UpstreamErrorException;
import maas.core.model.common.UpstreamUnreachableException;

/**
 * Global exception mappers turning exceptions into the console's response envelope.
 *
 * <p>Stack traces never reach the client; unexpected failures answer with a generic message.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    static final String INTERNAL_ERROR = "Internal server error";

    @ServerExceptionMapper
    public Response mapUpstreamUnreachable(UpstreamUnreachableException e) {
        LOG.warnv("Upstream {0} unreachable: {1}", e.upstream(), e.getMessage());
        return toResponse(Response.Status.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapUpstreamError(UpstreamErrorException e) {
        LOG.warnv("Upstream {0} answered {1}: {2}", e.upstream(), e.statusCode(), e.getMessage());
        return toResponse(Response.Status.BAD_GATEWAY, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapMalformedUpstreamData(MalformedUpstreamDataException e) {
        LOG.warnv("Upstream {0} sent malformed data: {1}", e.upstream(), e.getMessage());
        return toResponse(Response.Status.BAD_GATEWAY, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(Response.Status.BAD_REQUEST, e.getMessage());
    }

    @ServerExceptionMapper
    public Response mapWebApplicationException(WebApplicationException e) {
        final var status = e.getResponse().getStatus();
        LOG.debugv("Request rejected with {0}: {1}", status, e.getMessage());
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(e.getMessage()))
                .build();
    }

    @ServerExceptionMapper
    public Response mapUnexpected(RuntimeException e) {
        LOG.error("Unexpected error", e);
        return toResponse(Response.Status.INTERNAL_SERVER_ERROR, INTERNAL_ERROR);
    }

    private Response toResponse(Response.Status status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ApiResponse.failure(message))
                .build();
    }
}
