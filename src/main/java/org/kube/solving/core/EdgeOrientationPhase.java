package org.kube.solving.core;

import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.catalog.SwitcherCatalog;
import org.kube.core.state.Configuration;
import org.kube.solving.search.ConnectorQuery;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.CubieFamily;
import org.kube.solving.search.SearchBudget;

/**
 * Phase 4: flips edges 1..11 in place, pairing each flip with edge 0.
 */
final class EdgeOrientationPhase implements ReductionPhase {
    static final String NAME = "EDGE_ORIENTATION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult reduce(Configuration state, ConnectorSearch search, SearchBudget budget) {
        PhaseWork work = new PhaseWork(NAME, state, search, budget);
        for (int slot = 1; slot < Move.EDGE_COUNT; slot++) {
            if (work.state().edgeOri(slot) == 0) {
                continue;
            }
            Move connector = work.connect(ConnectorQuery.strictPair(
                    CubieFamily.EDGE,
                    0,
                    SwitcherCatalog.EDGE_FLIPPER_PARTNER,
                    0,
                    slot
            ));
            work.apply(MoveAlgebra.conjugate(SwitcherCatalog.EDGE_FLIPPER, connector));
        }
        return work.finish();
    }
}
