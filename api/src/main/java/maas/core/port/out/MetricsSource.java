package maas.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for a Prometheus-compatible query endpoint.
 */
public interface MetricsSource {

    /**
     * Run the liveness query against a host.
     *
     * @param host candidate base URL
     * @return true when the host answered with a successful query status
     */
    Uni<Boolean> isLive(String host);

    /**
     * Run an instant query and take the first sample value.
     *
     * @param host base URL of the selected host
     * @param expression query expression
     * @return the value, empty when the result set is empty
     */
    Uni<Optional<Double>> query(String host, String expression);
}
