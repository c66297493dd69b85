package maas.adapter.in.dto;

/**
 * DTO for token test requests.
 *
 * @param token   API key, with or without a {@code Bearer}/{@code APIKEY} prefix (required)
 * @param model   model to call (optional, defaults to the configured model)
 * @param message user message (required)
 */
public record TokenTestRequest(String token, String model, String message) {}
