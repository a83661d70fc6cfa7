package org.kube.solving.core;

import org.kube.core.algebra.Move;
import org.kube.core.state.Configuration;

/**
 * Internal output of one reduction phase.
 *
 * @param move move composed by the phase; the identity when nothing needed repair.
 * @param state configuration after the move.
 * @param telemetry counters for the phase.
 */
record PhaseResult(Move move, Configuration state, PhaseTelemetry telemetry) {
}
