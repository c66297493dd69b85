package maas.core.model.common;

/**
 * No candidate host of an upstream answered.
 */
public class UpstreamUnreachableException extends UpstreamException {

    public UpstreamUnreachableException(String upstream, String message) {
        super(upstream, message);
    }

    public UpstreamUnreachableException(String upstream, String message, Throwable cause) {
        super(upstream, message, cause);
    }
}
