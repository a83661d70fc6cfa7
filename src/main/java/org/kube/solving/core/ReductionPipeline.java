package org.kube.solving.core;

import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.state.Configuration;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.SearchBudget;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the reduction phases strictly in order, feeding each phase the configuration left
 * by the previous one.
 *
 * <p>The composed solution is {@code phase4 * phase3 * phase2 * phase1}: phase 1's turns
 * come first in the token list.</p>
 */
final class ReductionPipeline {
    private final List<ReductionPhase> phases;

    /**
     * Creates the standard four-phase pipeline.
     */
    ReductionPipeline() {
        this(List.of(
                new CornerPositionPhase(),
                new CornerOrientationPhase(),
                new EdgePositionPhase(),
                new EdgeOrientationPhase()
        ));
    }

    ReductionPipeline(List<ReductionPhase> phases) {
        this.phases = List.copyOf(Objects.requireNonNull(phases, "phases"));
    }

    List<ReductionPhase> phases() {
        return phases;
    }

    /**
     * Reduces {@code start} phase by phase.
     *
     * @throws SolveCoreException when a phase cannot complete.
     */
    PipelineResult run(Configuration start, ConnectorSearch search, SearchBudget budget) {
        Configuration state = Objects.requireNonNull(start, "start");
        Move solution = MoveAlgebra.identity();
        List<PhaseTelemetry> telemetry = new ArrayList<>(phases.size());
        for (ReductionPhase phase : phases) {
            PhaseResult result = phase.reduce(state, search, budget);
            state = result.state();
            solution = MoveAlgebra.compose(result.move(), solution);
            telemetry.add(result.telemetry());
        }
        return new PipelineResult(solution, state, List.copyOf(telemetry));
    }

    /**
     * Composed pipeline output.
     *
     * @param solution full solution move.
     * @param finalState configuration after the last phase.
     * @param phases per-phase telemetry in execution order.
     */
    record PipelineResult(Move solution, Configuration finalState, List<PhaseTelemetry> phases) {
    }
}
