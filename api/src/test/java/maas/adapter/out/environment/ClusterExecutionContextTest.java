package maas.adapter.out.environment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import maas.core.config.ExecutionConfig;
import maas.core.config.GatewayConfig;
import maas.core.config.KeyManagerConfig;
import maas.core.config.MetricsConfig;
import maas.core.config.PolicyEngineConfig;
import maas.core.model.common.HostKind;

@DisplayName("ClusterExecutionContext")
@ExtendWith(MockitoExtension.class)
class ClusterExecutionContextTest {

    @Mock
    private ExecutionConfig executionConfig;

    @Mock
    private PolicyEngineConfig policyEngineConfig;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private KeyManagerConfig keyManagerConfig;

    @Mock
    private GatewayConfig gatewayConfig;

    @BeforeEach
    void setUp() {
        lenient().when(executionConfig.serviceAccountTokenPath()).thenReturn("/nonexistent/token");
        lenient().when(policyEngineConfig.internalUrl()).thenReturn("https://kubernetes.default.svc:443");
        lenient().when(policyEngineConfig.externalUrl()).thenReturn(Optional.of("https://api.example.com:6443/"));
        lenient()
                .when(metricsConfig.internalHosts())
                .thenReturn(List.of("https://thanos-querier.openshift-monitoring.svc:9091", " "));
        lenient()
                .when(metricsConfig.externalHosts())
                .thenReturn(Optional.of(List.of("https://thanos.apps.example.com/", "http://localhost:9090")));
        lenient().when(keyManagerConfig.internalUrl()).thenReturn("http://key-manager.svc:8080");
        lenient().when(keyManagerConfig.externalUrl()).thenReturn(Optional.empty());
        lenient().when(gatewayConfig.internalUrl()).thenReturn("http://gateway.llm.svc");
        lenient().when(gatewayConfig.externalUrl()).thenReturn("http://localhost:8000");
    }

    private ClusterExecutionContext context() {
        return new ClusterExecutionContext(
                executionConfig, policyEngineConfig, metricsConfig, keyManagerConfig, gatewayConfig);
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("should honor an explicit setting")
        void shouldHonorExplicitSetting() {
            when(executionConfig.managed()).thenReturn(Optional.of(true));

            assertTrue(context().isManaged());
        }

        @Test
        @DisplayName("should detect the cluster from a mounted token")
        void shouldDetectMountedToken(@TempDir Path directory) throws IOException {
            final var token = Files.writeString(directory.resolve("token"), "sa-token");
            when(executionConfig.managed()).thenReturn(Optional.empty());
            when(executionConfig.serviceAccountTokenPath()).thenReturn(token.toString());

            assertTrue(context().isManaged());
        }

        @Test
        @DisplayName("should run externally without a mounted token")
        void shouldRunExternally() {
            when(executionConfig.managed()).thenReturn(Optional.empty());

            assertFalse(context().isManaged());
        }
    }

    @Nested
    @DisplayName("In the cluster")
    class InCluster {

        @BeforeEach
        void setUp() {
            when(executionConfig.managed()).thenReturn(Optional.of(true));
        }

        @Test
        @DisplayName("should use internal addresses")
        void shouldUseInternalAddresses() {
            final var context = context();

            assertEquals("https://kubernetes.default.svc:443", context.resolveHost(HostKind.POLICY_API));
            assertEquals("http://key-manager.svc:8080", context.resolveHost(HostKind.KEY_MANAGER));
            assertEquals("http://gateway.llm.svc", context.resolveHost(HostKind.GATEWAY));
        }

        @Test
        @DisplayName("should skip blank metrics hosts")
        void shouldSkipBlankHosts() {
            assertEquals(
                    List.of("https://thanos-querier.openshift-monitoring.svc:9091"),
                    context().candidateHosts(HostKind.METRICS));
        }
    }

    @Nested
    @DisplayName("Outside the cluster")
    class External {

        @BeforeEach
        void setUp() {
            when(executionConfig.managed()).thenReturn(Optional.of(false));
        }

        @Test
        @DisplayName("should use external addresses without trailing slashes")
        void shouldUseExternalAddresses() {
            final var context = context();

            assertEquals("https://api.example.com:6443", context.resolveHost(HostKind.POLICY_API));
            assertEquals("http://localhost:8000", context.resolveHost(HostKind.GATEWAY));
            assertEquals(
                    List.of("https://thanos.apps.example.com", "http://localhost:9090"),
                    context.candidateHosts(HostKind.METRICS));
            assertEquals("https://thanos.apps.example.com", context.resolveHost(HostKind.METRICS));
        }

        @Test
        @DisplayName("should fall back to the internal key manager address")
        void shouldFallBackForKeyManager() {
            assertEquals("http://key-manager.svc:8080", context().resolveHost(HostKind.KEY_MANAGER));
        }

        @Test
        @DisplayName("should require an external policy API address")
        void shouldRequirePolicyApiAddress() {
            when(policyEngineConfig.externalUrl()).thenReturn(Optional.empty());
            final var context = context();

            assertThrows(IllegalStateException.class, () -> context.resolveHost(HostKind.POLICY_API));
        }

        @Test
        @DisplayName("should have no metrics candidates when none are configured")
        void shouldHaveNoMetricsCandidates() {
            when(metricsConfig.externalHosts()).thenReturn(Optional.empty());

            assertTrue(context().candidateHosts(HostKind.METRICS).isEmpty());
        }
    }
}
