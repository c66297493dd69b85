package maas.adapter.out.http;

import maas.core.model.common.UpstreamException;
import maas.core.model.common.UpstreamUnreachableException;

/**
 * Translate transport failures into the upstream exception taxonomy.
 */
public final class UpstreamCallFailures {

    private UpstreamCallFailures() {}

    /**
     * Keep upstream exceptions as they are; anything else means no usable response arrived.
     */
    public static Throwable translate(String upstream, String url, Throwable error) {
        if (error instanceof UpstreamException) {
            return error;
        }
        final var detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new UpstreamUnreachableException(upstream, "Unable to reach " + url + ": " + detail, error);
    }
}
