package maas.core.service.probe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import maas.core.config.GatewayConfig;
import maas.core.model.common.HostKind;
import maas.core.model.probe.GatewayCall;
import maas.core.model.probe.GatewayExchange;
import maas.core.model.probe.ModelDescriptor;
import maas.core.model.probe.ProbeOutcome;
import maas.core.model.probe.ProbeRequest;
import maas.core.model.probe.ProbeResult;
import maas.core.port.in.GatewayProbeUseCase;
import maas.core.port.out.ExecutionContext;
import maas.core.port.out.GatewayClient;
import maas.core.port.out.Metrics;

/**
 * Make live chat-completion calls through the inference gateway and classify the outcome.
 *
 * <p>Classification looks at the HTTP status only. Every call that reaches the network is
 * counted exactly once in {@link SimulatorCounters}; input rejected up front is not.
 *
 * <p>Inside the cluster calls go to the gateway service directly. From outside, they go to
 * the public gateway address with a {@code Host} header chosen by model, since the gateway
 * routes by host name.
 */
@ApplicationScoped
public class GatewayProbeService implements GatewayProbeUseCase {

    private static final Logger LOG = Logger.getLogger(GatewayProbeService.class);

    static final String METHOD = "POST";
    static final int NETWORK_ERROR_STATUS = 503;
    private static final List<String> SCHEMES = List.of("Bearer", "APIKEY");

    private final GatewayClient gatewayClient;
    private final ExecutionContext executionContext;
    private final GatewayConfig config;
    private final SimulatorCounters counters;
    private final Metrics metrics;
    private final ObjectMapper objectMapper;

    @Inject
    public GatewayProbeService(
            GatewayClient gatewayClient,
            ExecutionContext executionContext,
            GatewayConfig config,
            SimulatorCounters counters,
            Metrics metrics,
            ObjectMapper objectMapper) {
        this.gatewayClient = gatewayClient;
        this.executionContext = executionContext;
        this.config = config;
        this.counters = counters;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public Uni<ProbeResult> probeGateway(String model, String message, String credential) {
        return probe(ProbeRequest.tokenTest(model, message, credential));
    }

    @Override
    public Uni<ProbeResult> probe(ProbeRequest request) {
        final var invalid = validate(request);
        if (invalid.isPresent()) {
            LOG.debugf("Rejected gateway probe: %s", invalid.get());
            return Uni.createFrom().item(ProbeResult.invalidInput(invalid.get(), counters.totalRequests()));
        }

        final var model = isBlank(request.model()) ? config.defaultModel() : request.model();
        final var authorization = request.normalizeCredential()
                ? config.credentialPrefix() + " " + stripScheme(request.credential())
                : request.credential();
        final var call = buildCall(request, model, authorization);
        final var sent = new ProbeResult.SentRequest(call.url(), call.method(), masked(call.headers()), call.body());
        final long startTime = System.nanoTime();

        return Uni.createFrom()
                .deferred(() -> gatewayClient.send(call))
                .map(exchange -> classify(exchange, sent, authorization))
                .onFailure()
                .recoverWithItem(error -> networkFailure(error, sent))
                .invoke(result -> metrics.recordProbe(result.outcome(), (System.nanoTime() - startTime) / 1_000_000));
    }

    @Override
    public List<ModelDescriptor> listModels() {
        final var models = new ArrayList<ModelDescriptor>();
        config.models()
                .forEach((name, model) -> models.add(
                        new ModelDescriptor(name, model.description().orElse(name), model.host())));
        models.sort(Comparator.comparing(ModelDescriptor::name));
        return List.copyOf(models);
    }

    private Optional<String> validate(ProbeRequest request) {
        if (isBlank(request.credential())) {
            return Optional.of("API key is required");
        }
        if (request.normalizeCredential() && isBlank(stripScheme(request.credential()))) {
            return Optional.of("API key is required");
        }
        if (request.messages().isEmpty()
                || request.messages().stream().allMatch(message -> isBlank(message.content()))) {
            return Optional.of("Message is required");
        }
        if (request.maxTokens() != null && request.maxTokens() <= 0) {
            return Optional.of("max_tokens must be positive");
        }
        return Optional.empty();
    }

    private GatewayCall buildCall(ProbeRequest request, String model, String authorization) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put("Content-Type", "application/json");
        headers.put("Authorization", authorization);
        if (!executionContext.isManaged()) {
            hostFor(model).ifPresent(host -> headers.put("Host", host));
        }

        final var messages = request.messages().stream()
                .map(message -> {
                    final var entry = new LinkedHashMap<String, Object>();
                    entry.put("role", message.role());
                    entry.put("content", message.content());
                    return (Map<String, Object>) entry;
                })
                .toList();
        final var body = new LinkedHashMap<String, Object>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : config.maxTokens());

        final var url = executionContext.resolveHost(HostKind.GATEWAY) + config.chatPath();
        return new GatewayCall(url, METHOD, headers, body);
    }

    private Optional<String> hostFor(String model) {
        final var configured = config.models().get(model);
        return configured == null ? Optional.empty() : configured.host();
    }

    private ProbeResult classify(GatewayExchange exchange, ProbeResult.SentRequest sent, String authorization) {
        final var outcome = ProbeOutcome.fromStatus(exchange.statusCode());
        final long total = counters.record(outcome);
        var message = describe(outcome, exchange.statusCode(), authorization);
        if (outcome.isPolicyDenial()) {
            message += authReason(exchange);
        }
        if (outcome == ProbeOutcome.SUCCESS) {
            LOG.debugf("Gateway probe to %s succeeded (total %d)", sent.url(), total);
        } else {
            LOG.infof("Gateway probe to %s returned %d: %s", sent.url(), exchange.statusCode(), outcome);
        }
        return new ProbeResult(
                outcome == ProbeOutcome.SUCCESS,
                outcome,
                exchange.statusCode(),
                message,
                Optional.of(sent),
                Optional.of(new ProbeResult.ReceivedResponse(
                        exchange.statusCode(), exchange.headers(), exchange.body())),
                total);
    }

    private ProbeResult networkFailure(Throwable error, ProbeResult.SentRequest sent) {
        final long total = counters.record(ProbeOutcome.NETWORK_ERROR);
        LOG.warnf("Gateway probe to %s failed without a response: %s", sent.url(), error.getMessage());
        final var detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ProbeResult(
                false,
                ProbeOutcome.NETWORK_ERROR,
                NETWORK_ERROR_STATUS,
                "Network error: unable to connect to " + sent.url(),
                Optional.of(sent),
                Optional.of(new ProbeResult.ReceivedResponse(
                        NETWORK_ERROR_STATUS, Map.of(), "Network error: " + detail)),
                total);
    }

    private static String describe(ProbeOutcome outcome, int status, String authorization) {
        return switch (outcome) {
            case SUCCESS -> "Token test successful";
            case AUTH_DENIED -> "Authentication failed: API key '" + maskKey(stripScheme(authorization))
                    + "' is invalid or unknown to the policy engine";
            case FORBIDDEN -> "Authorization failed: API key is valid but not authorized for this model or tier";
            case RATE_LIMITED -> "Rate limited: API key has exceeded its rate limits";
            case SERVER_ERROR -> "Server error: gateway returned " + status;
            default -> "Request failed: gateway returned " + status;
        };
    }

    private String authReason(GatewayExchange exchange) {
        final var reason = exchange.header(config.authReasonHeader());
        if (reason.isEmpty() || reason.get().isBlank()) {
            return "";
        }
        try {
            return " | Auth details: "
                    + objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(reason.get());
        } catch (IOException e) {
            return " | Auth reason: " + reason.get();
        }
    }

    static String stripScheme(String credential) {
        final var trimmed = credential.trim();
        for (final var scheme : SCHEMES) {
            if (trimmed.equals(scheme)) {
                return "";
            }
            if (trimmed.startsWith(scheme + " ")) {
                return trimmed.substring(scheme.length()).trim();
            }
        }
        return trimmed;
    }

    private static Map<String, String> masked(Map<String, String> headers) {
        final var copy = new LinkedHashMap<String, String>(headers);
        copy.computeIfPresent("Authorization", (name, value) -> maskAuthorization(value));
        return copy;
    }

    static String maskAuthorization(String value) {
        final int space = value.indexOf(' ');
        if (space < 0) {
            return maskKey(value);
        }
        return value.substring(0, space + 1) + maskKey(value.substring(space + 1));
    }

    static String maskKey(String key) {
        if (key.length() <= 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
