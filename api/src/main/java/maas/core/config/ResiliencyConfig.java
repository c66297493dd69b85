package maas.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for outbound timeouts.
 *
 * <p>Configuration prefix: {@code maas.resiliency}
 *
 * <p>Every outbound call is bounded by one of these timeouts. A timed-out call counts as a
 * failure and is not retried.
 */
@ConfigMapping(prefix = "maas.resiliency")
public interface ResiliencyConfig {

    /**
     * Liveness query against a metrics host.
     *
     * @return timeout (default: 3 seconds)
     */
    @WithDefault("PT3S")
    Duration livenessTimeout();

    /**
     * Data query against the selected metrics host.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration queryTimeout();

    /**
     * Policy-engine resource listing.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration policyEngineTimeout();

    /**
     * Key-manager call.
     *
     * @return timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration keyManagerTimeout();

    /**
     * Live gateway probe call.
     *
     * @return timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration probeTimeout();
}
