package maas.adapter.out.telemetry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import maas.config.TelemetryConfigMapping;
import maas.core.model.metrics.MetricsOrigin;
import maas.core.model.probe.ProbeOutcome;
import maas.core.port.out.Metrics;

/**
 * Record console telemetry using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code maas.probe.requests} - Gateway probes by outcome</li>
 *   <li>{@code maas.probe.latency} - Gateway probe latency</li>
 *   <li>{@code maas.upstream.requests} - Upstream calls by upstream and result</li>
 *   <li>{@code maas.metrics.snapshots} - Dashboard snapshots by origin</li>
 * </ul>
 */
@ApplicationScoped
public class ConsoleMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public ConsoleMetrics(MeterRegistry registry, TelemetryConfigMapping config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordProbe(ProbeOutcome outcome, long latencyMs) {
        if (!enabled) {
            return;
        }

        Counter.builder("maas.probe.requests")
                .description("Gateway probe calls by outcome")
                .tag("outcome", label(outcome.name()))
                .register(registry)
                .increment();

        Timer.builder("maas.probe.latency")
                .description("Time to receive a response from the gateway")
                .tag("outcome", label(outcome.name()))
                .publishPercentiles(0.5, 0.9, 0.99)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordUpstreamCall(String upstream, String result) {
        if (!enabled) {
            return;
        }

        Counter.builder("maas.upstream.requests")
                .description("Calls to control-plane upstreams")
                .tag("upstream", upstream)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    @Override
    public void recordSnapshot(MetricsOrigin origin) {
        if (!enabled) {
            return;
        }

        Counter.builder("maas.metrics.snapshots")
                .description("Dashboard metrics snapshots produced")
                .tag("origin", label(origin.name()))
                .register(registry)
                .increment();
    }

    private static String label(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
