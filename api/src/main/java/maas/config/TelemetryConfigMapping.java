package maas.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Telemetry is disabled by default and must be switched on explicitly.
 *
 * <p>Example configuration:
 * <pre>{@code
 * maas.telemetry.enabled=true
 * maas.telemetry.metrics.enabled=true
 * }</pre>
 *
 * <p>Tracing itself is controlled by the Quarkus OpenTelemetry extension
 * ({@code quarkus.otel.sdk.disabled}).
 */
@ConfigMapping(prefix = "maas.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Enable metrics collection with Micrometer.
         * Requires maas.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
