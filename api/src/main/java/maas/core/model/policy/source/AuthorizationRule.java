package maas.core.model.policy.source;

import java.util.Map;

import maas.core.model.policy.Maps;

/**
 * Raw authorization rule.
 *
 * @param rego embedded rule-engine source, or null when the rule is not an OPA rule
 * @param config the rule body as received
 */
public record AuthorizationRule(String rego, Map<String, Object> config) {

    public AuthorizationRule {
        config = Maps.orderedCopy(config);
    }
}
