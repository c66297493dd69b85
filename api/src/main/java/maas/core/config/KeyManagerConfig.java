package maas.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the key-management service.
 *
 * <p>Configuration prefix: {@code maas.key-manager}
 */
@ConfigMapping(prefix = "maas.key-manager")
public interface KeyManagerConfig {

    /**
     * Key manager address used inside the cluster.
     */
    @WithDefault("http://key-manager.platform-services.svc.cluster.local:8080")
    String internalUrl();

    /**
     * Key manager route used from outside the cluster. Falls back to the internal URL.
     */
    Optional<String> externalUrl();

    /**
     * Admin credential sent as a bearer token on every call.
     */
    Optional<String> adminKey();

    /**
     * Team resolved when the console does not name one.
     *
     * @return team id (default: default)
     */
    @WithDefault("default")
    String defaultTeamId();

    /**
     * User whose keys are listed when the console does not name one.
     *
     * @return user id (default: default)
     */
    @WithDefault("default")
    String defaultUserId();
}
