package org.kube.solving.core;

import org.kube.core.state.Configuration;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.SearchBudget;

/**
 * One defect class eliminated by conjugating a switcher or flipper per defective slot.
 */
interface ReductionPhase {
    /**
     * Stable phase name used in telemetry and error messages.
     */
    String name();

    /**
     * Computes the move that removes this phase's defects from {@code state}.
     *
     * <p>Phases must not disturb what earlier phases repaired.</p>
     *
     * @param state configuration left by the earlier phases.
     * @param search connector search used to relocate the switcher.
     * @param budget depth bounds for connector queries.
     * @return phase move, resulting configuration and telemetry.
     * @throws SolveCoreException when a required connector cannot be found.
     */
    PhaseResult reduce(Configuration state, ConnectorSearch search, SearchBudget budget);
}
