package maas.core.service.common;

import maas.core.model.common.MalformedUpstreamDataException;
import maas.core.model.common.UpstreamErrorException;
import maas.core.model.common.UpstreamUnreachableException;

/**
 * Labels for upstream failures, as recorded in telemetry and logs.
 */
public final class UpstreamFailures {

    public static final String SUCCESS = "success";

    private UpstreamFailures() {}

    public static String label(Throwable error) {
        if (error instanceof UpstreamUnreachableException) {
            return "unreachable";
        }
        if (error instanceof UpstreamErrorException) {
            return "error";
        }
        if (error instanceof MalformedUpstreamDataException) {
            return "malformed";
        }
        return "failure";
    }
}
