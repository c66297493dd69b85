package maas.core.service.tier;

import java.util.LinkedHashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import maas.core.config.KeyManagerConfig;
import maas.core.model.tier.ApiKeySummary;
import maas.core.model.tier.TeamRecord;
import maas.core.model.tier.TierInfo;
import maas.core.port.in.TierLookup;
import maas.core.port.out.KeyManagerClient;
import maas.core.port.out.Metrics;
import maas.core.service.common.UpstreamFailures;

/**
 * Resolve teams to policy tiers through the key manager.
 *
 * <p>Tiers are fetched on every call. Failures never reach the caller: a tier lookup falls
 * back to {@link TierInfo#fallback(String)} and a key listing to an empty list, both logged.
 */
@ApplicationScoped
public class TierResolver implements TierLookup {

    private static final Logger LOG = Logger.getLogger(TierResolver.class);
    private static final String UPSTREAM = "key-manager";

    private final KeyManagerClient keyManager;
    private final KeyManagerConfig config;
    private final Metrics metrics;

    @Inject
    public TierResolver(KeyManagerClient keyManager, KeyManagerConfig config, Metrics metrics) {
        this.keyManager = keyManager;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<TierInfo> getTierInfo(String teamId) {
        final var team = isBlank(teamId) ? config.defaultTeamId() : teamId;
        return Uni.createFrom()
                .deferred(() -> keyManager.fetchTeam(team))
                .map(TierResolver::toTier)
                .invoke(ignored -> metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.SUCCESS))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Unable to resolve tier for team %s, using fallback: %s", team, error.getMessage());
                    metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.label(error));
                    return TierInfo.fallback(team);
                });
    }

    @Override
    public Uni<List<ApiKeySummary>> listUserKeys(String userId) {
        final var user = isBlank(userId) ? config.defaultUserId() : userId;
        return Uni.createFrom()
                .deferred(() -> keyManager.fetchUserKeys(user))
                .invoke(keys -> {
                    LOG.debugf("User %s has %d keys", user, keys.size());
                    metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.SUCCESS);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Unable to list keys for user %s: %s", user, error.getMessage());
                    metrics.recordUpstreamCall(UPSTREAM, UpstreamFailures.label(error));
                    return List.of();
                });
    }

    static TierInfo toTier(TeamRecord team) {
        return new TierInfo(
                team.policy(),
                Math.max(0, team.usage()),
                Math.max(0, team.limit()),
                new LinkedHashSet<>(team.models()),
                team.teamId(),
                team.teamName());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
