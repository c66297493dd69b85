package maas.core.model.common;

/**
 * An upstream response body could not be read into the expected shape.
 */
public class MalformedUpstreamDataException extends UpstreamException {

    public MalformedUpstreamDataException(String upstream, String message) {
        super(upstream, message);
    }

    public MalformedUpstreamDataException(String upstream, String message, Throwable cause) {
        super(upstream, message, cause);
    }
}
