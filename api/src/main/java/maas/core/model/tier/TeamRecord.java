package maas.core.model.tier;

import java.util.List;

/**
 * Team as returned by the key manager, with absent values already defaulted.
 *
 * @param teamId team identifier
 * @param teamName team display name
 * @param policy tier policy name
 * @param usage consumption, 0 when absent
 * @param limit ceiling, 0 when absent
 * @param models allowed models, empty when absent
 */
public record TeamRecord(String teamId, String teamName, String policy, long usage, long limit, List<String> models) {

    public TeamRecord {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
