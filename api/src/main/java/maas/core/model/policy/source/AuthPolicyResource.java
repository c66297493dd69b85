package maas.core.model.policy.source;

import java.util.Map;

import maas.core.model.policy.Maps;

/**
 * Raw authentication/authorization policy as read from the policy engine.
 *
 * <p>Rule maps keep the key order of the source document.
 *
 * @param metadata resource metadata
 * @param targetRef spec.targetRef
 * @param authentication spec.rules.authentication
 * @param authorization spec.rules.authorization
 * @param response spec.rules.response
 * @param spec the whole spec, for passthrough
 * @param status the whole status, for passthrough
 */
public record AuthPolicyResource(
        ResourceMetadata metadata,
        Map<String, Object> targetRef,
        Map<String, AuthenticationRule> authentication,
        Map<String, AuthorizationRule> authorization,
        Map<String, Map<String, Object>> response,
        Map<String, Object> spec,
        Map<String, Object> status) {

    public AuthPolicyResource {
        metadata = metadata == null ? ResourceMetadata.empty() : metadata;
        targetRef = Maps.orderedCopy(targetRef);
        authentication = Maps.orderedCopy(authentication);
        authorization = Maps.orderedCopy(authorization);
        response = Maps.orderedCopy(response);
        spec = Maps.orderedCopy(spec);
        status = Maps.orderedCopy(status);
    }
}
