package maas.core.model.policy.source;

import java.util.Map;

import maas.core.model.policy.Maps;

/**
 * Raw rate-limit policy as read from the policy engine.
 *
 * @param metadata resource metadata
 * @param targetRef spec.targetRef
 * @param limits spec.limits in source order
 * @param spec the whole spec, for passthrough
 * @param status the whole status, for passthrough
 */
public record RateLimitPolicyResource(
        ResourceMetadata metadata,
        Map<String, Object> targetRef,
        Map<String, RateLimitDefinition> limits,
        Map<String, Object> spec,
        Map<String, Object> status) {

    public RateLimitPolicyResource {
        metadata = metadata == null ? ResourceMetadata.empty() : metadata;
        targetRef = Maps.orderedCopy(targetRef);
        limits = Maps.orderedCopy(limits);
        spec = Maps.orderedCopy(spec);
        status = Maps.orderedCopy(status);
    }
}
