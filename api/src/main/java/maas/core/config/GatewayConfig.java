package maas.core.config;

import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for live calls through the inference gateway.
 *
 * <p>Configuration prefix: {@code maas.gateway}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * maas.gateway.external-url=https://gateway.apps.example.com
 * maas.gateway.credential-prefix=APIKEY
 * maas.gateway.models.vllm-simulator.description=VLLM Simulator Model
 * maas.gateway.models.vllm-simulator.host=simulator-llm.apps.example.com
 * </pre>
 */
@ConfigMapping(prefix = "maas.gateway")
public interface GatewayConfig {

    /**
     * Cluster-internal gateway service address.
     */
    @WithDefault("http://inference-gateway-istio.llm.svc.cluster.local")
    String internalUrl();

    /**
     * Public gateway address used from outside the cluster.
     */
    @WithDefault("http://localhost:8000")
    String externalUrl();

    /**
     * Path of the chat-completion endpoint.
     */
    @WithDefault("/v1/chat/completions")
    String chatPath();

    /**
     * Authorization scheme the auth policy expects in front of the key.
     *
     * @return prefix (default: APIKEY)
     */
    @WithDefault("APIKEY")
    String credentialPrefix();

    /**
     * Completion budget of probe calls.
     *
     * @return max tokens (default: 50)
     */
    @WithDefault("50")
    int maxTokens();

    /**
     * Model used when a probe does not name one.
     */
    @WithDefault("vllm-simulator")
    String defaultModel();

    /**
     * Response header carrying the policy engine's explanation of a denial.
     */
    @WithDefault("x-ext-auth-reason")
    String authReasonHeader();

    /**
     * Model catalog keyed by model name.
     */
    Map<String, ModelConfig> models();

    /**
     * Per-model settings.
     */
    interface ModelConfig {

        /**
         * Display text.
         */
        Optional<String> description();

        /**
         * Host header the gateway routes this model by, used outside the cluster.
         */
        Optional<String> host();
    }
}
