package org.kube.solving.core;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-phase telemetry snapshot.
 */
@Value
@Builder
public class PhaseTelemetry {

    /**
     * Phase name, for example {@code CORNER_POSITION}.
     */
    String phaseName;

    /**
     * Quarter turns contributed by the phase.
     */
    int turnCount;

    /**
     * Slots the phase repaired.
     */
    int repairs;

    /**
     * Connector searches run, fallbacks included.
     */
    int connectorSearches;

    /**
     * Candidates generated across those searches.
     */
    long generatedCandidates;
}
