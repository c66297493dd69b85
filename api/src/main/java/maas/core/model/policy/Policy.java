package maas.core.model.policy;

import java.util.List;
import java.util.Map;

/**
 * A policy-engine object normalized into the schema the console renders.
 *
 * <p>{@code createdAt} and {@code modifiedAt} are opaque version markers copied from the
 * source metadata; they are not comparable as wall-clock times.
 *
 * @param id composite identity {@code namespace/name}
 * @param name policy name
 * @param namespace policy namespace
 * @param description derived description
 * @param type source kind
 * @param targetRef what the policy applies to (opaque)
 * @param createdAt creation marker
 * @param modifiedAt modification marker
 * @param active always true; deactivation is not modeled
 * @param items sub-rules in declaration order
 * @param status opaque status passthrough
 * @param rawSpec opaque spec passthrough
 */
public record Policy(
        String id,
        String name,
        String namespace,
        String description,
        PolicyType type,
        Map<String, Object> targetRef,
        String createdAt,
        String modifiedAt,
        boolean active,
        List<PolicyItem> items,
        Map<String, Object> status,
        Map<String, Object> rawSpec) {

    public static final String DEFAULT_NAMESPACE = "default";
    public static final String UNKNOWN_NAME = "unknown";

    public Policy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy id cannot be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Policy type cannot be null");
        }
        targetRef = Maps.orderedCopy(targetRef);
        createdAt = createdAt == null ? "" : createdAt;
        modifiedAt = modifiedAt == null ? "" : modifiedAt;
        items = items == null ? List.of() : List.copyOf(items);
        status = Maps.orderedCopy(status);
        rawSpec = Maps.orderedCopy(rawSpec);
    }

    /**
     * Build the composite identity, applying the defaults for missing parts.
     *
     * @param namespace source namespace (may be null)
     * @param name source name (may be null)
     * @return {@code namespace/name}
     */
    public static String identity(String namespace, String name) {
        return orDefault(namespace, DEFAULT_NAMESPACE) + "/" + orDefault(name, UNKNOWN_NAME);
    }

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
