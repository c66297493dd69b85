package maas.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import maas.adapter.in.dto.ApiResponse;
import maas.adapter.in.dto.MetricsDto;
import maas.adapter.in.dto.SimulatorCountersDto;
import maas.core.port.in.DashboardMetrics;

/**
 * REST resource for dashboard metrics.
 */
@Path("/api/v1/metrics")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class MetricsResource {

    private final DashboardMetrics dashboardMetrics;

    @Inject
    public MetricsResource(DashboardMetrics dashboardMetrics) {
        this.dashboardMetrics = dashboardMetrics;
    }

    /**
     * Current accounting snapshot.
     *
     * @return the snapshot, or 503 when no metrics host is reachable
     */
    @GET
    @Path("/dashboard")
    public Uni<ApiResponse<MetricsDto>> dashboard() {
        return dashboardMetrics.getMetricsSnapshot().map(snapshot -> ApiResponse.ok(MetricsDto.fromModel(snapshot)));
    }

    @GET
    @Path("/simulator")
    public ApiResponse<SimulatorCountersDto> simulator() {
        return ApiResponse.ok(SimulatorCountersDto.fromModel(dashboardMetrics.simulatorCounters()));
    }
}
