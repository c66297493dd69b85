package maas.core.model.common;

/**
 * An upstream answered, but with a non-success status.
 */
public class UpstreamErrorException extends UpstreamException {

    private final int statusCode;

    public UpstreamErrorException(String upstream, int statusCode, String message) {
        super(upstream, message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
