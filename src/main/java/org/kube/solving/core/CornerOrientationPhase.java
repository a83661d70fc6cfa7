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
 * Phase 2: untwists corners 1..7 in place, pushing the compensating twist onto corner 0.
 *
 * <p>The conjugated flipper adds 1 to slot {@code i}, so a twist of 2 needs it once and a
 * twist of 1 needs it twice. Corner 0 ends untwisted because total corner twist is 0.</p>
 */
final class CornerOrientationPhase implements ReductionPhase {
    static final String NAME = "CORNER_ORIENTATION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult reduce(Configuration state, ConnectorSearch search, SearchBudget budget) {
        PhaseWork work = new PhaseWork(NAME, state, search, budget);
        for (int slot = 1; slot < Move.CORNER_COUNT; slot++) {
            int twist = work.state().cornerOri(slot);
            if (twist == 0) {
                continue;
            }
            Move connector = work.connect(ConnectorQuery.strictPair(
                    CubieFamily.CORNER,
                    0,
                    SwitcherCatalog.CORNER_FLIPPER_PARTNER,
                    0,
                    slot
            ));
            Move flip = MoveAlgebra.conjugate(SwitcherCatalog.CORNER_FLIPPER, connector);
            work.apply(twist == 2 ? flip : MoveAlgebra.power(flip, 2));
        }
        return work.finish();
    }
}
