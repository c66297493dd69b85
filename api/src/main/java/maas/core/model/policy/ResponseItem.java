package maas.core.model.policy;

import java.util.Map;

/**
 * Response-filter rule of an auth policy.
 *
 * @param id rule name
 * @param description derived description
 * @param config opaque rule body
 */
public record ResponseItem(String id, String description, Map<String, Object> config) implements PolicyItem {

    public ResponseItem {
        config = Maps.orderedCopy(config);
    }

    @Override
    public PolicyItemType type() {
        return PolicyItemType.RESPONSE;
    }
}
