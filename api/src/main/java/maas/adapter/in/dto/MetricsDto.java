package maas.adapter.in.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import maas.core.model.metrics.MetricsOrigin;
import maas.core.model.metrics.MetricsSnapshot;

/**
 * Dashboard metrics as shown by the console.
 *
 * <p>{@code policyEnforcedRequests} mirrors {@code rejectedRequests}; both are derived.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricsDto(
        long totalRequests,
        long acceptedRequests,
        long rejectedRequests,
        long authFailedRequests,
        long rateLimitedRequests,
        long serverErrors,
        long policyEnforcedRequests,
        String source,
        String sourceHost,
        EngineStatusDto engineStatus,
        Map<String, Double> rawMetrics,
        SimulatorCountersDto simulator) {

    public record EngineStatusDto(boolean gatewayConnected, boolean authorizationConnected, boolean rateLimiterConnected) {}

    public static MetricsDto fromModel(MetricsSnapshot snapshot) {
        final var status = snapshot.engineStatus();
        return new MetricsDto(
                snapshot.totalRequests(),
                snapshot.acceptedRequests(),
                snapshot.rejectedRequests(),
                snapshot.authDeniedRequests(),
                snapshot.rateLimitedRequests(),
                snapshot.serverErrors(),
                snapshot.rejectedRequests(),
                snapshot.origin() == MetricsOrigin.CLUSTER ? "prometheus" : "local-fallback",
                snapshot.sourceHost().orElse(null),
                new EngineStatusDto(
                        status.gatewayConnected(), status.authorizationConnected(), status.rateLimiterConnected()),
                snapshot.rawMetrics(),
                snapshot.simulator().map(SimulatorCountersDto::fromModel).orElse(null));
    }
}
