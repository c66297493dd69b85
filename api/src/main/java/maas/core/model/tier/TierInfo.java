package maas.core.model.tier;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The policy tier a team is bound to. Resolved fresh on every request.
 *
 * @param policyName name of the tier policy
 * @param usage current consumption
 * @param limit consumption ceiling; 0 means unlimited
 * @param allowedModels model identifiers the tier may call, in source order
 * @param teamId team identifier
 * @param teamName team display name
 */
public record TierInfo(
        String policyName, long usage, long limit, Set<String> allowedModels, String teamId, String teamName) {

    public static final String FALLBACK_POLICY = "unlimited-policy";
    public static final long FALLBACK_LIMIT = 100_000L;
    public static final String FALLBACK_TEAM_NAME = "Default Team";

    public TierInfo {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("policyName cannot be blank");
        }
        if (usage < 0 || limit < 0) {
            throw new IllegalArgumentException("usage and limit must be non-negative");
        }
        allowedModels = allowedModels == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedModels));
        teamId = teamId == null ? "" : teamId;
        teamName = teamName == null ? "" : teamName;
    }

    /**
     * Tier reported when the key manager cannot be consulted.
     *
     * @param teamId the team that was asked for
     * @return the fallback tier
     */
    public static TierInfo fallback(String teamId) {
        return new TierInfo(FALLBACK_POLICY, 0, FALLBACK_LIMIT, Set.of(), teamId, FALLBACK_TEAM_NAME);
    }

    public boolean isUnlimited() {
        return limit == 0;
    }
}
