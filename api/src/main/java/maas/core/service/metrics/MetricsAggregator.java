package maas.core.service.metrics;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import maas.core.config.MetricsConfig;
import maas.core.model.common.HostKind;
import maas.core.model.common.UpstreamUnreachableException;
import maas.core.model.metrics.EngineStatus;
import maas.core.model.metrics.MetricQuery;
import maas.core.model.metrics.MetricsOrigin;
import maas.core.model.metrics.MetricsSnapshot;
import maas.core.model.probe.SimulatorCounterSnapshot;
import maas.core.port.in.DashboardMetrics;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.Metrics;
import maas.core.port.out.MetricsSource;
import maas.core.service.common.UpstreamFailures;
import maas.core.service.probe.SimulatorCounters;

/**
 * Build dashboard snapshots from the metrics backend.
 *
 * <p>Each cycle walks the candidate hosts in priority order and uses the first one whose
 * liveness query succeeds for every query of the cycle. Queries run concurrently and fail
 * independently: an error or an empty result counts as zero. Totals are never read from the
 * backend, they are derived from the four accounting counters.
 *
 * <p>Outside the managed cluster the console's own probe counters are added on top, since
 * calls made from a workstation do not show up in cluster metrics.
 */
@ApplicationScoped
public class MetricsAggregator implements DashboardMetrics {

    private static final Logger LOG = Logger.getLogger(MetricsAggregator.class);
    private static final String UPSTREAM = "metrics";
    static final double FALLBACK_LIMITER_STATUS = 1.0;

    private final ExecutionContext executionContext;
    private final MetricsSource metricsSource;
    private final MetricsConfig config;
    private final SimulatorCounters simulatorCounters;
    private final Metrics metrics;

    @Inject
    public MetricsAggregator(
            ExecutionContext executionContext,
            MetricsSource metricsSource,
            MetricsConfig config,
            SimulatorCounters simulatorCounters,
            Metrics metrics) {
        this.executionContext = executionContext;
        this.metricsSource = metricsSource;
        this.config = config;
        this.simulatorCounters = simulatorCounters;
        this.metrics = metrics;
    }

    @Override
    public Uni<MetricsSnapshot> getMetricsSnapshot() {
        final var candidates = executionContext.candidateHosts(HostKind.METRICS);
        return selectHost(candidates, 0)
                .flatMap(host -> {
                    if (host.isPresent()) {
                        return queryAll(host.get()).map(values -> toSnapshot(values, MetricsOrigin.CLUSTER, host));
                    }
                    if (executionContext.isLocalDevelopment()) {
                        LOG.infof("No metrics host reachable out of %d, using local baseline", candidates.size());
                        return Uni.createFrom()
                                .item(toSnapshot(baseline(), MetricsOrigin.LOCAL_FALLBACK, Optional.empty()));
                    }
                    metrics.recordUpstreamCall(UPSTREAM, "unreachable");
                    return Uni.createFrom()
                            .failure(new UpstreamUnreachableException(
                                    UPSTREAM,
                                    "Unable to retrieve metrics: none of " + candidates.size()
                                            + " metrics hosts answered"));
                })
                .invoke(snapshot -> metrics.recordSnapshot(snapshot.origin()));
    }

    @Override
    public SimulatorCounterSnapshot simulatorCounters() {
        return simulatorCounters.snapshot();
    }

    private Uni<Optional<String>> selectHost(List<String> candidates, int index) {
        if (index >= candidates.size()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var host = candidates.get(index);
        return metricsSource
                .isLive(host)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Metrics host %s failed liveness: %s", host, error.getMessage());
                    return false;
                })
                .flatMap(live -> {
                    if (live) {
                        LOG.debugf("Using metrics host %s", host);
                        return Uni.createFrom().item(Optional.of(host));
                    }
                    return selectHost(candidates, index + 1);
                });
    }

    private Uni<Map<MetricQuery, Double>> queryAll(String host) {
        final var overrides = config.queries();
        final List<Uni<Map.Entry<MetricQuery, Double>>> queries = Arrays.stream(MetricQuery.values())
                .map(query -> metricsSource
                        .query(host, query.expression(overrides))
                        .map(value -> value.orElse(0.0))
                        .onFailure()
                        .recoverWithItem(error -> {
                            LOG.debugf("Query %s failed on %s: %s", query.key(), host, error.getMessage());
                            metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.label(error));
                            return 0.0;
                        })
                        .map(value -> Map.entry(query, value)))
                .toList();
        return Uni.join().all(queries).andFailFast().map(entries -> {
            final var values = new EnumMap<MetricQuery, Double>(MetricQuery.class);
            entries.forEach(entry -> values.put(entry.getKey(), entry.getValue()));
            return values;
        });
    }

    private static Map<MetricQuery, Double> baseline() {
        final var values = new EnumMap<MetricQuery, Double>(MetricQuery.class);
        for (final var query : MetricQuery.values()) {
            values.put(query, 0.0);
        }
        values.put(MetricQuery.LIMITER_UP, FALLBACK_LIMITER_STATUS);
        return values;
    }

    private MetricsSnapshot toSnapshot(Map<MetricQuery, Double> values, MetricsOrigin origin, Optional<String> host) {
        long accepted = asCount(values.get(MetricQuery.ACCEPTED));
        long rateLimited = asCount(values.get(MetricQuery.RATE_LIMITED));
        long authDenied = asCount(values.get(MetricQuery.AUTH_DENIED));
        final long serverErrors = asCount(values.get(MetricQuery.SERVER_ERRORS));

        Optional<SimulatorCounterSnapshot> blended = Optional.empty();
        if (!executionContext.isManaged()) {
            final var counters = simulatorCounters.snapshot();
            accepted += counters.successfulRequests();
            rateLimited += counters.rateLimits();
            authDenied += counters.authFailures();
            blended = Optional.of(counters);
        }

        final var raw = new LinkedHashMap<String, Double>();
        values.forEach((query, value) -> raw.put(query.key(), value));
        final double limiterStatus = values.getOrDefault(MetricQuery.LIMITER_UP, 0.0);

        return new MetricsSnapshot(
                accepted,
                rateLimited,
                authDenied,
                serverErrors,
                origin,
                host,
                new EngineStatus(true, true, limiterStatus > 0),
                raw,
                blended);
    }

    /**
     * Counters are truncated toward zero; negative or non-finite samples count as zero.
     */
    static long asCount(Double value) {
        if (value == null || !Double.isFinite(value) || value <= 0) {
            return 0;
        }
        return value.longValue();
    }
}
