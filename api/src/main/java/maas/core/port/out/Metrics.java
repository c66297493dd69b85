package maas.core.port.out;

import maas.core.model.metrics.MetricsOrigin;
import maas.core.model.probe.ProbeOutcome;

/**
 * Port interface for recording console telemetry.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a gateway probe.
     *
     * @param outcome the classified outcome
     * @param latencyMs latency in milliseconds
     */
    void recordProbe(ProbeOutcome outcome, long latencyMs);

    /**
     * Record an outbound call to an upstream.
     *
     * @param upstream upstream name (policy-engine, metrics, key-manager)
     * @param result result label (success, unreachable, error, malformed)
     */
    void recordUpstreamCall(String upstream, String result);

    /**
     * Record a produced metrics snapshot.
     *
     * @param origin where the numbers came from
     */
    void recordSnapshot(MetricsOrigin origin);
}
