package maas.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TierInfo;

/**
 * Use case resolving teams to policy tiers and listing issued keys.
 *
 * <p>Both operations always complete with an item.
 */
public interface TierLookup {

    /**
     * Resolve a team to its tier, or to the fallback tier on any failure.
     *
     * @param teamId team identifier, blank for the configured default
     * @return the tier
     */
    Uni<TierInfo> getTierInfo(String teamId);

    /**
     * List a user's keys, or nothing on any failure.
     *
     * @param userId user identifier, blank for the configured default
     * @return the keys
     */
    Uni<List<ApiKeySummary>> listUserKeys(String userId);
}
