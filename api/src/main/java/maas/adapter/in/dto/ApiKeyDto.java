package maas.adapter.in.dto;

import maas.core.model.tier.ApiKeySummary;

public record ApiKeyDto(
        String name, String displayName, String created, String status, String teamId, String teamName, String policy) {

    public static ApiKeyDto fromModel(ApiKeySummary key) {
        return new ApiKeyDto(
                key.secretName(),
                key.alias(),
                key.createdAt(),
                key.status(),
                key.teamId(),
                key.teamName(),
                key.policy());
    }
}
