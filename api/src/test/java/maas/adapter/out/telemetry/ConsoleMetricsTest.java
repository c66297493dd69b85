package maas.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import maas.config.TelemetryConfigMapping;
import maas.core.model.metrics.MetricsOrigin;
import maas.core.model.probe.ProbeOutcome;

@DisplayName("ConsoleMetrics")
@ExtendWith(MockitoExtension.class)
class ConsoleMetricsTest {

    @Mock
    private TelemetryConfigMapping config;

    @Mock
    private TelemetryConfigMapping.MetricsConfig metricsConfig;

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        lenient().when(config.metrics()).thenReturn(metricsConfig);
    }

    @Test
    @DisplayName("should record probes, upstream calls and snapshots when enabled")
    void shouldRecordWhenEnabled() {
        when(config.enabled()).thenReturn(true);
        when(metricsConfig.enabled()).thenReturn(true);
        final var metrics = new ConsoleMetrics(registry, config);

        metrics.recordProbe(ProbeOutcome.RATE_LIMITED, 120);
        metrics.recordProbe(ProbeOutcome.RATE_LIMITED, 80);
        metrics.recordUpstreamCall("key-manager", "unreachable");
        metrics.recordSnapshot(MetricsOrigin.LOCAL_FALLBACK);

        assertTrue(metrics.isEnabled());
        assertEquals(
                2.0,
                registry.get("maas.probe.requests")
                        .tag("outcome", "rate_limited")
                        .counter()
                        .count());
        assertEquals(
                2,
                registry.get("maas.probe.latency")
                        .tag("outcome", "rate_limited")
                        .timer()
                        .count());
        assertNotNull(registry.get("maas.upstream.requests")
                .tag("upstream", "key-manager")
                .tag("result", "unreachable")
                .counter());
        assertEquals(
                1.0,
                registry.get("maas.metrics.snapshots")
                        .tag("origin", "local_fallback")
                        .counter()
                        .count());
    }

    @Test
    @DisplayName("should record nothing when metrics are switched off")
    void shouldRecordNothingWhenDisabled() {
        when(config.enabled()).thenReturn(true);
        when(metricsConfig.enabled()).thenReturn(false);
        final var metrics = new ConsoleMetrics(registry, config);

        metrics.recordProbe(ProbeOutcome.SUCCESS, 10);
        metrics.recordUpstreamCall("metrics", "success");

        assertFalse(metrics.isEnabled());
        assertTrue(registry.getMeters().isEmpty());
    }
}
