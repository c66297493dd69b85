package maas.core.model.policy;

import java.util.List;
import java.util.Map;

/**
 * One named limit of a rate-limit policy.
 *
 * <p>An empty {@code rates} list means the limit is unbounded.
 *
 * @param limitName limit name, unique within its policy
 * @param description derived description
 * @param rates rate entries in declaration order
 * @param conditions predicate strings in declaration order
 * @param counters counter keys in declaration order
 * @param config opaque limit body
 */
public record RateLimitItem(
        String limitName,
        String description,
        List<Rate> rates,
        List<String> conditions,
        List<String> counters,
        Map<String, Object> config)
        implements PolicyItem {

    public RateLimitItem {
        rates = rates == null ? List.of() : List.copyOf(rates);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        counters = counters == null ? List.of() : List.copyOf(counters);
        config = Maps.orderedCopy(config);
    }

    @Override
    public String id() {
        return limitName;
    }

    @Override
    public PolicyItemType type() {
        return PolicyItemType.RATE_LIMIT;
    }

    public boolean isUnbounded() {
        return rates.isEmpty();
    }
}
