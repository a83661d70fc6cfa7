package org.kube.solving.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Client-facing solve response.
 *
 * <p>Replaying the scramble followed by {@code solutionTokens} yields the solved cube.
 * An already solved scramble gets an empty solution.</p>
 */
@Value
@Builder
public class SolveResponse {
    /** Number of scramble turns that were replayed. */
    int scrambleLength;
    /** Total quarter turns in the solution. */
    int turnCount;
    /** Candidates generated by all connector searches. */
    long generatedCandidates;
    /** Telemetry per reduction phase, in execution order. */
    @Singular("phase")
    List<PhaseTelemetry> phases;
    /** Solution in external symbols, first turn first. */
    @Singular("solutionToken")
    List<String> solutionTokens;
}
