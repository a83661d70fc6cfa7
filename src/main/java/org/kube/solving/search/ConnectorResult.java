package org.kube.solving.search;

import org.kube.core.algebra.Move;

/**
 * Outcome of one connector search.
 *
 * @param found whether a qualifying candidate was reached within the bound.
 * @param move the connecting move, or {@code null} when not found.
 * @param depth depth of the hit, or the bound when exhausted.
 * @param generatedCandidates candidates materialized, identity included.
 */
public record ConnectorResult(boolean found, Move move, int depth, long generatedCandidates) {

    /**
     * Creates the result for a qualifying candidate.
     */
    static ConnectorResult hit(Move move, int depth, long generatedCandidates) {
        return new ConnectorResult(true, move, depth, generatedCandidates);
    }

    /**
     * Creates the not-found sentinel for a search that ran out of depth.
     */
    static ConnectorResult exhausted(int maxMoves, long generatedCandidates) {
        return new ConnectorResult(false, null, maxMoves, generatedCandidates);
    }

    /**
     * Returns the connecting move of a successful search.
     *
     * @throws IllegalStateException when the search was exhausted.
     */
    public Move requireMove() {
        if (!found) {
            throw new IllegalStateException("connector search exhausted at depth " + depth);
        }
        return move;
    }
}
