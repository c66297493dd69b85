package maas.core.model.probe;

import java.util.Optional;

/**
 * A model offered through the gateway.
 *
 * @param name model name sent in the request body
 * @param description display text
 * @param host externally routed host name the gateway expects for this model, if any
 */
public record ModelDescriptor(String name, String description, Optional<String> host) {

    public ModelDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Model name cannot be blank");
        }
        description = description == null ? "" : description;
        host = host == null ? Optional.empty() : host;
    }
}
