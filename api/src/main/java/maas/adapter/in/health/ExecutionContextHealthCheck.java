package maas.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import maas.core.model.common.HostKind;
import maas.core.port.out.ExecutionContext;

/**
 * Readiness check reporting the execution mode and the metrics candidates in use.
 *
 * <p>Always UP: upstream outages degrade individual responses, not readiness.
 */
@Readiness
@ApplicationScoped
public class ExecutionContextHealthCheck implements HealthCheck {

    private final ExecutionContext executionContext;

    @Inject
    public ExecutionContextHealthCheck(ExecutionContext executionContext) {
        this.executionContext = executionContext;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("execution-context")
                .withData("mode", executionContext.isManaged() ? "in-cluster" : "external")
                .withData("localDevelopment", executionContext.isLocalDevelopment())
                .withData("metricsCandidates", executionContext.candidateHosts(HostKind.METRICS).size())
                .up()
                .build();
    }
}
