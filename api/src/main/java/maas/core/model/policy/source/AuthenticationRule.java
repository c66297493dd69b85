package maas.core.model.policy.source;

import java.util.Map;

import maas.core.model.policy.Maps;

/**
 * Raw authentication rule.
 *
 * @param credentialPrefix configured authorization-header prefix, or null when absent
 * @param config the rule body as received
 */
public record AuthenticationRule(String credentialPrefix, Map<String, Object> config) {

    public AuthenticationRule {
        config = Maps.orderedCopy(config);
    }
}
