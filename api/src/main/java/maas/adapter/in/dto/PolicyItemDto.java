package maas.adapter.in.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import maas.core.model.policy.AuthorizationItem;
import maas.core.model.policy.PolicyItem;
import maas.core.model.policy.RateLimitItem;

/**
 * One rule of a policy. Type-specific fields are omitted for other item types.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyItemDto(
        String id,
        String type,
        String description,
        Map<String, Object> config,
        List<String> allowedGroups,
        List<RateDto> rates,
        List<String> conditions,
        List<String> counters) {

    public record RateDto(Long limit, String window) {}

    public static PolicyItemDto fromModel(PolicyItem item) {
        List<String> allowedGroups = null;
        List<RateDto> rates = null;
        List<String> conditions = null;
        List<String> counters = null;
        if (item instanceof AuthorizationItem authorization) {
            allowedGroups = authorization.allowedGroups();
        } else if (item instanceof RateLimitItem rateLimit) {
            rates = rateLimit.rates().stream()
                    .map(rate -> new RateDto(
                            rate.limit().isPresent() ? rate.limit().getAsLong() : null, rate.window()))
                    .toList();
            conditions = rateLimit.conditions();
            counters = rateLimit.counters();
        }
        return new PolicyItemDto(
                item.id(),
                item.type().value(),
                item.description(),
                item.config(),
                allowedGroups,
                rates,
                conditions,
                counters);
    }
}
