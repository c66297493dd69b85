package maas.adapter.in.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for simulator chat requests.
 *
 * @param model     model to call
 * @param messages  chat history, sent as is
 * @param maxTokens completion budget (optional)
 * @param tier      tier the console is simulating, used for logging only
 */
public record SimulatorChatRequest(
        String model,
        List<ChatMessageDto> messages,
        @JsonProperty("max_tokens") Integer maxTokens,
        String tier) {

    public record ChatMessageDto(String role, String content) {}
}
