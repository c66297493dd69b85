package maas.adapter.out.environment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import maas.core.config.ExecutionConfig;
import maas.core.config.GatewayConfig;
import maas.core.config.KeyManagerConfig;
import maas.core.config.MetricsConfig;
import maas.core.config.PolicyEngineConfig;
import maas.core.model.common.HostKind;
import maas.core.port.out.ExecutionContext;

/**
 * Execution context decided once at startup.
 *
 * <p>An explicit {@code maas.execution.managed} wins. Otherwise the process counts as
 * in-cluster when the service-account token file is mounted.
 */
@ApplicationScoped
public class ClusterExecutionContext implements ExecutionContext {

    private static final Logger LOG = Logger.getLogger(ClusterExecutionContext.class);

    private final ExecutionConfig executionConfig;
    private final PolicyEngineConfig policyEngineConfig;
    private final MetricsConfig metricsConfig;
    private final KeyManagerConfig keyManagerConfig;
    private final GatewayConfig gatewayConfig;
    private final boolean managed;

    @Inject
    public ClusterExecutionContext(
            ExecutionConfig executionConfig,
            PolicyEngineConfig policyEngineConfig,
            MetricsConfig metricsConfig,
            KeyManagerConfig keyManagerConfig,
            GatewayConfig gatewayConfig) {
        this.executionConfig = executionConfig;
        this.policyEngineConfig = policyEngineConfig;
        this.metricsConfig = metricsConfig;
        this.keyManagerConfig = keyManagerConfig;
        this.gatewayConfig = gatewayConfig;
        this.managed = executionConfig
                .managed()
                .orElseGet(() -> Files.exists(Path.of(executionConfig.serviceAccountTokenPath())));
        LOG.infof(
                "Execution context: %s%s",
                managed ? "in-cluster" : "external",
                executionConfig.localDevelopment() ? " (local development)" : "");
    }

    @Override
    public boolean isManaged() {
        return managed;
    }

    @Override
    public boolean isLocalDevelopment() {
        return executionConfig.localDevelopment();
    }

    @Override
    public String resolveHost(HostKind kind) {
        return switch (kind) {
            case POLICY_API -> managed
                    ? trim(policyEngineConfig.internalUrl())
                    : trim(policyEngineConfig
                            .externalUrl()
                            .orElseThrow(() -> new IllegalStateException(
                                    "maas.policy-engine.external-url is required outside the cluster")));
            case METRICS -> candidateHosts(HostKind.METRICS).stream()
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No metrics hosts configured"));
            case KEY_MANAGER -> managed
                    ? trim(keyManagerConfig.internalUrl())
                    : trim(keyManagerConfig.externalUrl().orElse(keyManagerConfig.internalUrl()));
            case GATEWAY -> trim(managed ? gatewayConfig.internalUrl() : gatewayConfig.externalUrl());
        };
    }

    @Override
    public List<String> candidateHosts(HostKind kind) {
        if (kind != HostKind.METRICS) {
            return List.of(resolveHost(kind));
        }
        final var hosts = managed
                ? metricsConfig.internalHosts()
                : metricsConfig.externalHosts().orElse(List.of());
        return hosts.stream()
                .filter(host -> !host.isBlank())
                .map(ClusterExecutionContext::trim)
                .toList();
    }

    private static String trim(String url) {
        var result = url.trim();
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
