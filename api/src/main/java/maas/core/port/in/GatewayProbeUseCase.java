package maas.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import maas.core.model.probe.ModelDescriptor;
import maas.core.model.probe.ProbeRequest;
import maas.core.model.probe.ProbeResult;

/**
 * Use case for live calls through the inference gateway.
 */
public interface GatewayProbeUseCase {

    /**
     * Send a single-message test call with a normalized credential.
     *
     * @param model model name, blank for the configured default
     * @param message user message
     * @param credential API key, with or without a scheme prefix
     * @return the classified result
     */
    Uni<ProbeResult> probeGateway(String model, String message, String credential);

    /**
     * Send a prepared call. Classification and counters are shared with {@link #probeGateway}.
     *
     * @param request the call to make
     * @return the classified result
     */
    Uni<ProbeResult> probe(ProbeRequest request);

    /**
     * Configured model catalog.
     *
     * @return models in configuration order
     */
    List<ModelDescriptor> listModels();
}
