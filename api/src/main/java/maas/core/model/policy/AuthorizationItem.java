package maas.core.model.policy;

import java.util.List;
import java.util.Map;

/**
 * Authorization rule of an auth policy.
 *
 * @param id rule name
 * @param description derived description
 * @param allowedGroups group names found in the rule expression, in match order
 * @param config opaque rule body
 */
public record AuthorizationItem(String id, String description, List<String> allowedGroups, Map<String, Object> config)
        implements PolicyItem {

    public AuthorizationItem {
        allowedGroups = allowedGroups == null ? List.of() : List.copyOf(allowedGroups);
        config = Maps.orderedCopy(config);
    }

    @Override
    public PolicyItemType type() {
        return PolicyItemType.AUTHORIZATION;
    }
}
