package maas.core.model.metrics;

import java.util.Map;

/**
 * The named queries issued against the metrics backend on every aggregation cycle.
 *
 * <p>The four accounting counters ({@link #ACCEPTED}, {@link #RATE_LIMITED}, {@link #AUTH_DENIED},
 * {@link #SERVER_ERRORS}) read disjoint response-code sets of the same proxy metric so that
 * summing them never counts a request twice. The ingress counters are context only and never
 * feed the totals.
 */
public enum MetricQuery {
    ACCEPTED("accepted_requests", "sum(istio_requests_total{namespace=\"llm\",response_code=~\"2..\"})"),
    RATE_LIMITED("rate_limited", "sum(istio_requests_total{namespace=\"llm\",response_code=\"429\"})"),
    AUTH_DENIED("auth_denied", "sum(istio_requests_total{namespace=\"llm\",response_code=~\"401|403\"})"),
    SERVER_ERRORS("server_errors", "sum(istio_requests_total{namespace=\"llm\",response_code=~\"5..\"})"),
    INGRESS_2XX("cluster_ingress_2xx_total", "sum(haproxy_backend_http_responses_total{code=\"2xx\"})"),
    INGRESS_4XX("cluster_ingress_4xx_total", "sum(haproxy_backend_http_responses_total{code=\"4xx\"})"),
    INGRESS_5XX("cluster_ingress_5xx_total", "sum(haproxy_backend_http_responses_total{code=\"5xx\"})"),
    INGRESS_4XX_1H("cluster_4xx_1h", "sum(increase(haproxy_backend_http_responses_total{code=\"4xx\"}[1h]))"),
    INGRESS_4XX_RECENT(
            "cluster_4xx_recent", "sum(increase(haproxy_backend_http_responses_total{code=\"4xx\"}[10m]))"),
    LIMITER_UP("limitador_status", "sum(limitador_up{namespace=\"kuadrant-system\"})"),
    HTTP_REQUEST_RATE("http_requests", "sum(rate(http_requests_total[5m]))");

    private final String key;
    private final String defaultExpression;

    MetricQuery(String key, String defaultExpression) {
        this.key = key;
        this.defaultExpression = defaultExpression;
    }

    /**
     * Stable key under which the value appears in raw metrics.
     */
    public String key() {
        return key;
    }

    public String defaultExpression() {
        return defaultExpression;
    }

    /**
     * Resolve the expression to issue, preferring an override keyed by {@link #key()}.
     *
     * @param overrides configured expression overrides (may be empty)
     * @return the expression to send
     */
    public String expression(Map<String, String> overrides) {
        final var override = overrides.get(key);
        return override == null || override.isBlank() ? defaultExpression : override;
    }
}
