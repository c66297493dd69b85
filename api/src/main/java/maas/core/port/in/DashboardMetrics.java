package maas.core.port.in;

import io.smallrye.mutiny.Uni;

import maas.core.model.metrics.MetricsSnapshot;
import maas.core.model.probe.SimulatorCounterSnapshot;

/**
 * Use case backing the dashboard's metrics panels.
 */
public interface DashboardMetrics {

    /**
     * Build one snapshot from the first reachable metrics host.
     *
     * @return the snapshot, or a failure with
     *     {@link maas.core.model.common.UpstreamUnreachableException} when no host answers
     */
    Uni<MetricsSnapshot> getMetricsSnapshot();

    /**
     * Current values of the in-process probe counters.
     *
     * @return counter snapshot
     */
    SimulatorCounterSnapshot simulatorCounters();
}
