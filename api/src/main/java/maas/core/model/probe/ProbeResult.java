package maas.core.model.probe;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a gateway probe with the diagnostics the console shows.
 *
 * @param success true only for 2xx
 * @param outcome classification
 * @param statusCode gateway status; 503 for network failures and 400 for invalid input
 * @param message human-readable summary, including any policy-engine explanation
 * @param request what was sent, absent for invalid input
 * @param response what came back, absent when nothing did
 * @param simulatorTotal value of the total-requests counter after this call
 */
public record ProbeResult(
        boolean success,
        ProbeOutcome outcome,
        int statusCode,
        String message,
        Optional<SentRequest> request,
        Optional<ReceivedResponse> response,
        long simulatorTotal) {

    /**
     * Request as sent; the credential in {@code headers} is masked.
     */
    public record SentRequest(String url, String method, Map<String, String> headers, Map<String, Object> body) {}

    /**
     * Response as received.
     */
    public record ReceivedResponse(int status, Map<String, String> headers, String body) {}

    public static ProbeResult invalidInput(String message, long simulatorTotal) {
        return new ProbeResult(
                false, ProbeOutcome.INVALID_INPUT, 400, message, Optional.empty(), Optional.empty(), simulatorTotal);
    }
}
