package maas.core.model.policy;

/**
 * Kind of sub-rule inside a policy.
 */
public enum PolicyItemType {
    AUTHENTICATION("authentication"),
    AUTHORIZATION("authorization"),
    RESPONSE("response"),
    RATE_LIMIT("rate-limit");

    private final String value;

    PolicyItemType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
