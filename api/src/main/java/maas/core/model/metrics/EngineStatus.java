package maas.core.model.metrics;

/**
 * Connectivity of the policy-engine components as inferred from a snapshot.
 *
 * @param gatewayConnected proxy counters were available
 * @param authorizationConnected authorization counters were available
 * @param rateLimiterConnected the rate-limiter liveness series was positive
 */
public record EngineStatus(boolean gatewayConnected, boolean authorizationConnected, boolean rateLimiterConnected) {}
