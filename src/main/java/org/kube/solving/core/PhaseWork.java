package org.kube.solving.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.state.Configuration;
import org.kube.solving.search.ConnectorQuery;
import org.kube.solving.search.ConnectorResult;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.SearchBudget;

/**
 * Running state of one phase: the configuration being repaired, the move composed so far
 * and the search counters.
 */
final class PhaseWork {
    private static final Logger log = LogManager.getLogger(PhaseWork.class);

    private final String phaseName;
    private final ConnectorSearch search;
    private final SearchBudget budget;
    private Configuration state;
    private Move move = MoveAlgebra.identity();
    private int repairs;
    private int connectorSearches;
    private long generatedCandidates;

    PhaseWork(String phaseName, Configuration state, ConnectorSearch search, SearchBudget budget) {
        this.phaseName = phaseName;
        this.state = state;
        this.search = search;
        this.budget = budget;
    }

    Configuration state() {
        return state;
    }

    /**
     * Runs one connector query under the family's depth bound; exhaustion is returned, not thrown.
     */
    ConnectorResult tryConnect(ConnectorQuery query) {
        ConnectorResult result = search.search(query, budget.maxMovesFor(query.family()));
        connectorSearches++;
        generatedCandidates += result.generatedCandidates();
        return result;
    }

    /**
     * Runs one connector query that must succeed.
     *
     * @throws SolveCoreException with {@link SolveCore#REASON_SEARCH_EXHAUSTED} when it does not.
     */
    Move connect(ConnectorQuery query) {
        ConnectorResult result = tryConnect(query);
        if (!result.found()) {
            log.warn("{} connector search exhausted at depth {} for {}", phaseName, result.depth(), query);
            throw SolveCoreException.inPhase(
                    SolveCore.REASON_SEARCH_EXHAUSTED,
                    phaseName,
                    "no connector within " + result.depth() + " moves for " + query
            );
        }
        return result.move();
    }

    /**
     * Applies one repair move to the running configuration and appends it to the phase move.
     */
    void apply(Move repair) {
        state = state.apply(repair);
        move = MoveAlgebra.compose(repair, move);
        repairs++;
    }

    PhaseResult finish() {
        PhaseTelemetry telemetry = PhaseTelemetry.builder()
                .phaseName(phaseName)
                .turnCount(move.length())
                .repairs(repairs)
                .connectorSearches(connectorSearches)
                .generatedCandidates(generatedCandidates)
                .build();
        log.debug("{} done repairs={} turns={} searches={} generated={}",
                phaseName, repairs, move.length(), connectorSearches, generatedCandidates);
        return new PhaseResult(move, state, telemetry);
    }
}
