package maas.core.model.metrics;

/**
 * Where the counters of a snapshot came from.
 */
public enum MetricsOrigin {
    /** A metrics host answered and was queried. */
    CLUSTER,

    /** No host answered and local development allowed an all-zero baseline. */
    LOCAL_FALLBACK
}
