package maas.core.model.common;

/**
 * Kinds of upstream endpoints whose address depends on where the process runs.
 */
public enum HostKind {
    /** Kubernetes API server serving policy-engine resources. */
    POLICY_API,

    /** Prometheus-compatible query endpoints, in priority order. */
    METRICS,

    /** Key-management service issuing API keys and owning teams. */
    KEY_MANAGER,

    /** Inference gateway accepting chat-completion calls. */
    GATEWAY
}
