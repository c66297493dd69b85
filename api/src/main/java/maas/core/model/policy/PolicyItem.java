package maas.core.model.policy;

import java.util.Map;

/**
 * One sub-rule of a normalized policy.
 *
 * <p>Items keep the declaration order of the rule maps they were read from.
 */
public sealed interface PolicyItem permits AuthenticationItem, AuthorizationItem, ResponseItem, RateLimitItem {

    /**
     * Rule name as declared in the source object.
     */
    String id();

    PolicyItemType type();

    /**
     * Human-readable summary derived from the rule body.
     */
    String description();

    /**
     * Opaque rule body, passed through for detail views.
     */
    Map<String, Object> config();
}
