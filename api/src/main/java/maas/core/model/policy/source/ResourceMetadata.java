package maas.core.model.policy.source;

/**
 * Metadata block shared by every policy-engine resource. All fields may be null.
 *
 * @param namespace resource namespace
 * @param name resource name
 * @param creationTimestamp creation marker
 * @param resourceVersion version marker
 */
public record ResourceMetadata(String namespace, String name, String creationTimestamp, String resourceVersion) {

    public static ResourceMetadata empty() {
        return new ResourceMetadata(null, null, null, null);
    }
}
