package maas.core.model.probe;

/**
 * Point-in-time copy of the synthetic-traffic counters.
 *
 * @param totalRequests every probe call
 * @param successfulRequests calls answered with 2xx
 * @param failedRequests calls not answered with 2xx, including network failures
 * @param authFailures calls answered with 401
 * @param rateLimits calls answered with 429
 */
public record SimulatorCounterSnapshot(
        long totalRequests, long successfulRequests, long failedRequests, long authFailures, long rateLimits) {

    public static SimulatorCounterSnapshot zero() {
        return new SimulatorCounterSnapshot(0, 0, 0, 0, 0);
    }
}
