package maas.adapter.out.http;

import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.core.net.PemTrustOptions;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import maas.core.config.ExecutionConfig;
import maas.core.port.out.ExecutionContext;

/**
 * Shared Vert.x web clients for outbound calls.
 *
 * <p>{@link #cluster()} talks to the API server and the monitoring stack; inside the cluster
 * it trusts the mounted cluster CA. {@link #standard()} is used for the key manager and the
 * gateway. Both skip certificate checks when {@code maas.execution.tls-verify=false}.
 */
@ApplicationScoped
public class ClusterWebClients {

    private static final Logger LOG = Logger.getLogger(ClusterWebClients.class);

    private final WebClient clusterClient;
    private final WebClient standardClient;

    @Inject
    public ClusterWebClients(Vertx vertx, ExecutionConfig config, ExecutionContext executionContext) {
        final var clusterOptions = baseOptions(config);
        final var caPath = config.serviceAccountCaPath();
        if (config.tlsVerify() && executionContext.isManaged() && Files.isReadable(Path.of(caPath))) {
            LOG.debugf("Trusting cluster CA from %s", caPath);
            clusterOptions.setPemTrustOptions(new PemTrustOptions().addCertPath(caPath));
        }
        this.clusterClient = WebClient.create(vertx, clusterOptions);
        this.standardClient = WebClient.create(vertx, baseOptions(config));
    }

    public WebClient cluster() {
        return clusterClient;
    }

    public WebClient standard() {
        return standardClient;
    }

    private static WebClientOptions baseOptions(ExecutionConfig config) {
        final var options = new WebClientOptions().setFollowRedirects(false);
        if (!config.tlsVerify()) {
            options.setTrustAll(true).setVerifyHost(false);
        }
        return options;
    }
}
