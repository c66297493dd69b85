package maas.core.model.policy;

/**
 * Kind of policy-engine object a normalized {@link Policy} was built from.
 */
public enum PolicyType {
    AUTH("auth"),
    RATE_LIMIT("rate-limit");

    private final String value;

    PolicyType(String value) {
        this.value = value;
    }

    /**
     * Wire value used by the console.
     *
     * @return the lowercase wire value
     */
    public String value() {
        return value;
    }
}
