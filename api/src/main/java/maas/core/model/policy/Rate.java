package maas.core.model.policy;

import java.util.OptionalLong;

/**
 * A single rate entry of a limit.
 *
 * @param limit number of tokens allowed per window, empty when the source value was not a number
 * @param window duration string such as {@code 1m} or {@code 1h}
 */
public record Rate(OptionalLong limit, String window) {

    public Rate {
        if (limit == null) {
            limit = OptionalLong.empty();
        }
        if (window == null || window.isBlank()) {
            throw new IllegalArgumentException("Rate window cannot be blank");
        }
    }

    public Rate(long limit, String window) {
        this(OptionalLong.of(limit), window);
    }

    public static Rate unknownLimit(String window) {
        return new Rate(OptionalLong.empty(), window);
    }
}
