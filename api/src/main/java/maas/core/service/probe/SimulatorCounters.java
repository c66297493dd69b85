package maas.core.service.probe;

import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;

import maas.core.model.probe.ProbeOutcome;
import maas.core.model.probe.SimulatorCounterSnapshot;

/**
 * In-process counters of calls made through the gateway by this console.
 *
 * <p>Each field is updated atomically; a snapshot reads them one after another and may
 * observe a call that is counted in {@code totalRequests} but not yet in its outcome field.
 * Counters live for the lifetime of the process.
 */
@ApplicationScoped
public class SimulatorCounters {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulRequests = new AtomicLong();
    private final AtomicLong failedRequests = new AtomicLong();
    private final AtomicLong authFailures = new AtomicLong();
    private final AtomicLong rateLimits = new AtomicLong();

    /**
     * Count one call that reached the network.
     *
     * @param outcome the classified outcome
     * @return the new total
     */
    public long record(ProbeOutcome outcome) {
        if (outcome == ProbeOutcome.INVALID_INPUT) {
            throw new IllegalArgumentException("Rejected input is not a gateway call");
        }
        if (outcome == ProbeOutcome.SUCCESS) {
            successfulRequests.incrementAndGet();
        } else {
            failedRequests.incrementAndGet();
            if (outcome == ProbeOutcome.AUTH_DENIED) {
                authFailures.incrementAndGet();
            } else if (outcome == ProbeOutcome.RATE_LIMITED) {
                rateLimits.incrementAndGet();
            }
        }
        return totalRequests.incrementAndGet();
    }

    public long totalRequests() {
        return totalRequests.get();
    }

    public SimulatorCounterSnapshot snapshot() {
        return new SimulatorCounterSnapshot(
                totalRequests.get(),
                successfulRequests.get(),
                failedRequests.get(),
                authFailures.get(),
                rateLimits.get());
    }
}
