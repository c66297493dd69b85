package maas.core.model.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order-preserving immutable copies for the opaque maps carried by policy records.
 *
 * <p>{@link Map#copyOf} is not used because it neither keeps iteration order nor allows null values.
 */
public final class Maps {

    private Maps() {}

    public static <V> Map<String, V> orderedCopy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
