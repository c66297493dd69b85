package maas.core.port.out;

import io.smallrye.mutiny.Uni;

import maas.core.model.probe.GatewayCall;
import maas.core.model.probe.GatewayExchange;

/**
 * Port for sending one call through the inference gateway.
 *
 * <p>Any HTTP status is a successful exchange. The returned {@code Uni} fails only when no
 * response was received.
 */
public interface GatewayClient {

    Uni<GatewayExchange> send(GatewayCall call);
}
