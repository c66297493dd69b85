package maas.core.model.probe;

/**
 * A chat-completion message.
 *
 * @param role message role, usually {@code user}
 * @param content message text
 */
public record ChatMessage(String role, String content) {

    public static final String USER = "user";

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }
}
