package maas.adapter.out.environment;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;

import maas.core.config.ExecutionConfig;
import maas.core.port.out.ExecutionContext;

/**
 * Bearer token for the cluster API server and the metrics routes.
 *
 * <p>In-cluster the mounted service-account token is read on every call, so rotated tokens
 * are picked up. Outside the cluster the token comes from configuration.
 */
@ApplicationScoped
public class ClusterCredentials {

    private final Vertx vertx;
    private final ExecutionConfig config;
    private final ExecutionContext executionContext;

    @Inject
    public ClusterCredentials(Vertx vertx, ExecutionConfig config, ExecutionContext executionContext) {
        this.vertx = vertx;
        this.config = config;
        this.executionContext = executionContext;
    }

    /**
     * Resolve the bearer token.
     *
     * @return the token, empty when none is configured outside the cluster
     */
    public Uni<Optional<String>> bearerToken() {
        if (!executionContext.isManaged()) {
            return Uni.createFrom().item(config.clusterToken().filter(token -> !token.isBlank()));
        }
        final var path = config.serviceAccountTokenPath();
        return vertx.fileSystem()
                .readFile(path)
                .map(buffer -> Optional.of(buffer.toString().trim()))
                .onFailure()
                .transform(error -> new IllegalStateException("Unable to read service-account token " + path, error));
    }
}
