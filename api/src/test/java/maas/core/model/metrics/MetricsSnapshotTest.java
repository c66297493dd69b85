package maas.core.model.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsSnapshot")
class MetricsSnapshotTest {

    private static MetricsSnapshot snapshot(long accepted, long rateLimited, long authDenied, long serverErrors) {
        return new MetricsSnapshot(
                accepted,
                rateLimited,
                authDenied,
                serverErrors,
                MetricsOrigin.CLUSTER,
                Optional.of("https://prometheus"),
                new EngineStatus(true, true, true),
                Map.of("accepted_requests", (double) accepted),
                Optional.empty());
    }

    @Test
    @DisplayName("should derive totals from the four counters")
    void shouldDeriveTotals() {
        final var snapshot = snapshot(70, 10, 15, 5);

        assertEquals(100, snapshot.totalRequests());
        assertEquals(30, snapshot.rejectedRequests());
        assertEquals(snapshot.totalRequests(), snapshot.acceptedRequests() + snapshot.rejectedRequests());
    }

    @Test
    @DisplayName("should reject negative counters")
    void shouldRejectNegativeCounters() {
        assertThrows(IllegalArgumentException.class, () -> snapshot(-1, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> snapshot(0, 0, -3, 0));
    }

    @Test
    @DisplayName("should not expose a mutable raw metrics map")
    void shouldCopyRawMetrics() {
        final var snapshot = snapshot(1, 0, 0, 0);

        assertThrows(UnsupportedOperationException.class, () -> snapshot.rawMetrics().put("x", 1.0));
        assertTrue(snapshot.simulator().isEmpty());
    }
}
