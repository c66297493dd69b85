package maas.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every console response.
 *
 * @param success   whether the operation succeeded
 * @param data      payload, omitted when absent
 * @param error     error message, omitted on success
 * @param timestamp ISO-8601 time the response was built
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String error, String timestamp) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, Instant.now().toString());
    }

    public static <T> ApiResponse<T> failure(String error) {
        return new ApiResponse<>(false, null, error, Instant.now().toString());
    }

    public static <T> ApiResponse<T> failure(String error, T data) {
        return new ApiResponse<>(false, data, error, Instant.now().toString());
    }
}
