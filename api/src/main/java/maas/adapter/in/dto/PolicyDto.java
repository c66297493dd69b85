package maas.adapter.in.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import maas.core.model.policy.Policy;

public record PolicyDto(
        String id,
        String name,
        String description,
        String type,
        String namespace,
        Map<String, Object> targetRef,
        String created,
        String modified,
        @JsonProperty("isActive") boolean isActive,
        List<PolicyItemDto> items,
        Map<String, Object> status,
        Map<String, Object> fullSpec) {

    public static PolicyDto fromModel(Policy policy) {
        return new PolicyDto(
                policy.id(),
                policy.name(),
                policy.description(),
                policy.type().value(),
                policy.namespace(),
                policy.targetRef(),
                policy.createdAt(),
                policy.modifiedAt(),
                policy.active(),
                policy.items().stream().map(PolicyItemDto::fromModel).toList(),
                policy.status(),
                policy.rawSpec());
    }
}
