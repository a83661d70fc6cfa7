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
 * Phase 1: places every corner cubie in its home slot, ignoring twist.
 *
 * <p>Slots are repaired in increasing order. For a wrong slot {@code i} the cubie that
 * belongs there sits in some later slot {@code j}; a connector bringing the switcher's
 * pair onto {@code {i, j}} turns the corner switcher into a swap of {@code i} and {@code j}.</p>
 */
final class CornerPositionPhase implements ReductionPhase {
    static final String NAME = "CORNER_POSITION";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult reduce(Configuration state, ConnectorSearch search, SearchBudget budget) {
        PhaseWork work = new PhaseWork(NAME, state, search, budget);
        for (int slot = 0; slot < Move.CORNER_COUNT; slot++) {
            Configuration current = work.state();
            if (current.cornerPos(slot) == slot) {
                continue;
            }
            int holder = current.cornerSlotOf(slot);
            Move connector = work.connect(ConnectorQuery.permissivePair(
                    CubieFamily.CORNER,
                    SwitcherCatalog.CORNER_SWITCHER_FIRST,
                    SwitcherCatalog.CORNER_SWITCHER_SECOND,
                    slot,
                    holder
            ));
            work.apply(MoveAlgebra.conjugate(SwitcherCatalog.CORNER_SWITCHER, connector));
        }
        return work.finish();
    }
}
