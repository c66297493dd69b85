package maas.core.service.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Best-effort scan of an OPA rego body for group allow-list comparisons.
 *
 * <p>Only literal comparisons of the form {@code groups[_] == "name"} are recognized. The
 * rego is never parsed, so groups granted through other constructs (sets, helper rules,
 * negations) are not reported.
 */
public final class AllowedGroupsExtractor {

    private static final Pattern GROUP_COMPARISON = Pattern.compile("groups\\[_\\]\\s*==\\s*\"([^\"]+)\"");

    private AllowedGroupsExtractor() {}

    /**
     * Extract every compared group name in order of appearance.
     *
     * @param rego the policy body (may be null)
     * @return group names, empty when none are found
     */
    public static List<String> extract(String rego) {
        if (rego == null || rego.isEmpty()) {
            return List.of();
        }
        final var matcher = GROUP_COMPARISON.matcher(rego);
        final var groups = new ArrayList<String>();
        while (matcher.find()) {
            groups.add(matcher.group(1));
        }
        return List.copyOf(groups);
    }
}
