package org.kube.solving.core;

/**
 * Public solve contract.
 *
 * <p>Implementations validate input deterministically and throw reason-coded runtime
 * exceptions for contract failures. A response always carries a solution that has been
 * checked by replay; there are no partial answers.</p>
 */
public interface SolverService {
    /**
     * Solves the configuration reached from the solved cube by the request's scramble.
     *
     * @param request scramble in external symbols.
     * @return verified solution and per-phase telemetry.
     */
    SolveResponse solve(SolveRequest request);
}
