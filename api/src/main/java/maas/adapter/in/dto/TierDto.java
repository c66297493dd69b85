package maas.adapter.in.dto;

import java.util.List;

import maas.core.model.tier.TierInfo;

/**
 * Tier of the current team.
 *
 * @param name   tier name, the same as the policy name
 * @param limit  token limit, 0 for unlimited
 * @param models models the tier may call, in order
 */
public record TierDto(
        String name, String policy, long usage, long limit, List<String> models, String teamId, String teamName) {

    public static TierDto fromModel(TierInfo tier) {
        return new TierDto(
                tier.policyName(),
                tier.policyName(),
                tier.usage(),
                tier.limit(),
                List.copyOf(tier.allowedModels()),
                tier.teamId(),
                tier.teamName());
    }
}
