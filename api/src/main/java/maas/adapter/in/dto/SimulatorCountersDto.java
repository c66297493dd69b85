package maas.adapter.in.dto;

import maas.core.model.probe.SimulatorCounterSnapshot;

public record SimulatorCountersDto(
        long totalRequests, long successfulRequests, long failedRequests, long authFailures, long rateLimits) {

    public static SimulatorCountersDto fromModel(SimulatorCounterSnapshot snapshot) {
        return new SimulatorCountersDto(
                snapshot.totalRequests(),
                snapshot.successfulRequests(),
                snapshot.failedRequests(),
                snapshot.authFailures(),
                snapshot.rateLimits());
    }
}
