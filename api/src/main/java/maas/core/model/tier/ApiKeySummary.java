package maas.core.model.tier;

/**
 * API key metadata listed for a user. The secret value itself is never carried.
 *
 * @param secretName name of the secret holding the key
 * @param alias display alias
 * @param createdAt creation marker as reported
 * @param status key status
 * @param teamId owning team
 * @param teamName owning team name
 * @param policy tier policy of the key
 */
public record ApiKeySummary(
        String secretName,
        String alias,
        String createdAt,
        String status,
        String teamId,
        String teamName,
        String policy) {}
