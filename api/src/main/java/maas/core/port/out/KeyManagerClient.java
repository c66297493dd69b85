package maas.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TeamRecord;

/**
 * Port for the key-management service.
 */
public interface KeyManagerClient {

    /**
     * Fetch a team with its policy tier.
     *
     * @param teamId team identifier
     * @return the team record
     */
    Uni<TeamRecord> fetchTeam(String teamId);

    /**
     * Fetch the API keys issued to a user.
     *
     * @param userId user identifier
     * @return keys in the order the key manager returned them
     */
    Uni<List<ApiKeySummary>> fetchUserKeys(String userId);
}
