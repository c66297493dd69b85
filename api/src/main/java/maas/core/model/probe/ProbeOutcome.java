package maas.core.model.probe;

/**
 * Classification of a gateway probe call. Classification is by HTTP status only.
 */
public enum ProbeOutcome {
    SUCCESS,
    /** 401: credential missing, invalid or unknown to the policy engine. */
    AUTH_DENIED,
    /** 403: credential valid but not authorized for the model or tier. */
    FORBIDDEN,
    /** 429: the tier's rate limit was exceeded. */
    RATE_LIMITED,
    /** 5xx from the gateway or model backend. */
    SERVER_ERROR,
    /** Any other non-2xx status. */
    REQUEST_FAILED,
    /** No response at all: connect failure, DNS, timeout. */
    NETWORK_ERROR,
    /** Rejected before any network call. */
    INVALID_INPUT;

    public static ProbeOutcome fromStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return SUCCESS;
        }
        if (statusCode == 401) {
            return AUTH_DENIED;
        }
        if (statusCode == 403) {
            return FORBIDDEN;
        }
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode >= 500 && statusCode < 600) {
            return SERVER_ERROR;
        }
        return REQUEST_FAILED;
    }

    /**
     * Whether the outcome is an expected policy-engine rejection rather than a fault.
     */
    public boolean isPolicyDenial() {
        return this == AUTH_DENIED || this == FORBIDDEN || this == RATE_LIMITED;
    }
}
