package maas.core.model.probe;

import java.util.List;

/**
 * A live call to issue through the gateway.
 *
 * @param model model name; blank selects the configured default model
 * @param messages chat messages to send
 * @param credential caller credential, with or without a scheme prefix
 * @param maxTokens completion budget; null selects the configured default
 * @param normalizeCredential strip {@code Bearer }/{@code APIKEY } and apply the policy prefix
 */
public record ProbeRequest(
        String model, List<ChatMessage> messages, String credential, Integer maxTokens, boolean normalizeCredential) {

    public ProbeRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /**
     * Single-message token test, as issued from the key management page.
     */
    public static ProbeRequest tokenTest(String model, String message, String credential) {
        final List<ChatMessage> messages = message == null ? List.of() : List.of(ChatMessage.user(message));
        return new ProbeRequest(model, messages, credential, null, true);
    }

    /**
     * Simulator call forwarding the caller's Authorization header untouched.
     */
    public static ProbeRequest simulation(
            String model, List<ChatMessage> messages, String authorizationHeader, Integer maxTokens) {
        return new ProbeRequest(model, messages, authorizationHeader, maxTokens, false);
    }
}
