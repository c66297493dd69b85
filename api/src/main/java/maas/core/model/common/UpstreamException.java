package maas.core.model.common;

/**
 * Base type for failures talking to an upstream collaborator (policy engine,
 * metrics backend, key manager, gateway).
 *
 * <p>The {@code upstream} name identifies the collaborator for logging and metrics.
 */
public abstract class UpstreamException extends RuntimeException {

    private final String upstream;

    protected UpstreamException(String upstream, String message) {
        super(message);
        this.upstream = upstream;
    }

    protected UpstreamException(String upstream, String message, Throwable cause) {
        super(message, cause);
        this.upstream = upstream;
    }

    public String upstream() {
        return upstream;
    }
}
