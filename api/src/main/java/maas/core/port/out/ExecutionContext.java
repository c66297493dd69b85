package maas.core.port.out;

import java.util.List;

import maas.core.model.common.HostKind;

/**
 * Port describing where the process runs and which upstream addresses follow from that.
 *
 * <p>Every component asks this port instead of inspecting the environment itself, so one
 * place decides between in-cluster and external addresses.
 */
public interface ExecutionContext {

    /**
     * Whether the process runs inside the managed cluster.
     *
     * @return true in-cluster
     */
    boolean isManaged();

    /**
     * Whether an unreachable metrics backend may be replaced by a zero baseline.
     *
     * @return true in local development
     */
    boolean isLocalDevelopment();

    /**
     * Resolve the single base address of an upstream for the current mode.
     *
     * @param kind the upstream
     * @return base URL without trailing slash
     */
    String resolveHost(HostKind kind);

    /**
     * Candidate addresses of an upstream in priority order.
     *
     * @param kind the upstream
     * @return ordered candidates, possibly empty
     */
    List<String> candidateHosts(HostKind kind);
}
