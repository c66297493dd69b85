package maas.core.model.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import maas.core.model.probe.SimulatorCounterSnapshot;

/**
 * One aggregation cycle's accounting view.
 *
 * <p>{@link #totalRequests()} and {@link #rejectedRequests()} are derived from the four
 * component counters and are never read from a query of their own.
 *
 * @param acceptedRequests requests answered with 2xx
 * @param rateLimitedRequests requests rejected with 429
 * @param authDeniedRequests requests rejected with 401 or 403
 * @param serverErrors requests answered with 5xx
 * @param origin where the counters came from
 * @param sourceHost the metrics host that answered, empty on fallback
 * @param engineStatus inferred component connectivity
 * @param rawMetrics every queried value keyed by {@link MetricQuery#key()}, in query order
 * @param simulator the synthetic-traffic counters blended into this snapshot, if any
 */
public record MetricsSnapshot(
        long acceptedRequests,
        long rateLimitedRequests,
        long authDeniedRequests,
        long serverErrors,
        MetricsOrigin origin,
        Optional<String> sourceHost,
        EngineStatus engineStatus,
        Map<String, Double> rawMetrics,
        Optional<SimulatorCounterSnapshot> simulator) {

    public MetricsSnapshot {
        requireNonNegative("acceptedRequests", acceptedRequests);
        requireNonNegative("rateLimitedRequests", rateLimitedRequests);
        requireNonNegative("authDeniedRequests", authDeniedRequests);
        requireNonNegative("serverErrors", serverErrors);
        if (origin == null) {
            throw new IllegalArgumentException("origin cannot be null");
        }
        sourceHost = sourceHost == null ? Optional.empty() : sourceHost;
        engineStatus = engineStatus == null ? new EngineStatus(false, false, false) : engineStatus;
        rawMetrics = rawMetrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawMetrics));
        simulator = simulator == null ? Optional.empty() : simulator;
    }

    public long totalRequests() {
        return acceptedRequests + rateLimitedRequests + authDeniedRequests + serverErrors;
    }

    public long rejectedRequests() {
        return rateLimitedRequests + authDeniedRequests + serverErrors;
    }

    private static void requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " cannot be negative: " + value);
        }
    }
}
