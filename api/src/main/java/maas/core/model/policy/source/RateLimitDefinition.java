package maas.core.model.policy.source;

import java.util.List;
import java.util.Map;

import maas.core.model.policy.Maps;
import maas.core.model.policy.Rate;

/**
 * Raw named limit of a rate-limit policy.
 *
 * @param rates rate entries
 * @param conditions predicate strings taken from {@code when[].predicate}
 * @param counters counter keys
 * @param config the limit body as received
 */
public record RateLimitDefinition(List<Rate> rates, List<String> conditions, List<String> counters, Map<String, Object> config) {

    public RateLimitDefinition {
        rates = rates == null ? List.of() : List.copyOf(rates);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        counters = counters == null ? List.of() : List.copyOf(counters);
        config = Maps.orderedCopy(config);
    }
}
