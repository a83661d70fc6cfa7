package org.kube.solving.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.catalog.EdgeSwitcher;
import org.kube.core.catalog.SwitcherCatalog;
import org.kube.core.state.Configuration;
import org.kube.solving.search.ConnectorQuery;
import org.kube.solving.search.ConnectorResult;
import org.kube.solving.search.ConnectorSearch;
import org.kube.solving.search.CubieFamily;
import org.kube.solving.search.SearchBudget;

import java.util.List;

/**
 * Phase 3: places edge cubies 0..9 with edge 3-cycles; edges 10 and 11 follow by parity.
 *
 * <p>Each switcher only reaches slots its zone can be carried to within the edge search
 * bound, so switchers are tried in catalog order and the first one with a connector wins.
 * The connector must keep the cycle's third cubie after the slot being repaired so that
 * repaired slots stay untouched.</p>
 */
final class EdgePositionPhase implements ReductionPhase {
    static final String NAME = "EDGE_POSITION";
    static final int REPAIRED_SLOTS = 10;

    private static final Logger log = LogManager.getLogger(EdgePositionPhase.class);

    private final List<EdgeSwitcher> switchers;

    EdgePositionPhase() {
        this(SwitcherCatalog.EDGE_SWITCHERS);
    }

    EdgePositionPhase(List<EdgeSwitcher> switchers) {
        this.switchers = List.copyOf(switchers);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult reduce(Configuration state, ConnectorSearch search, SearchBudget budget) {
        PhaseWork work = new PhaseWork(NAME, state, search, budget);
        for (int slot = 0; slot < REPAIRED_SLOTS; slot++) {
            Configuration current = work.state();
            if (current.edgePos(slot) == slot) {
                continue;
            }
            int holder = current.edgeSlotOf(slot);
            work.apply(relocatedSwitcher(work, slot, holder));
        }
        return work.finish();
    }

    private Move relocatedSwitcher(PhaseWork work, int slot, int holder) {
        for (int index = 0; index < switchers.size(); index++) {
            EdgeSwitcher switcher = switchers.get(index);
            ConnectorResult result = work.tryConnect(ConnectorQuery.zoneTriple(
                    CubieFamily.EDGE,
                    switcher.first(),
                    switcher.second(),
                    switcher.third(),
                    slot,
                    holder
            ));
            if (result.found()) {
                return MoveAlgebra.conjugate(switcher.move(), result.move());
            }
            log.debug("edge switcher {} has no connector for slot {} (cubie in slot {}), trying next",
                    index, slot, holder);
        }
        throw SolveCoreException.inPhase(
                SolveCore.REASON_SOLVE_FAILED,
                NAME,
                "no edge switcher reaches slot " + slot + " from slot " + holder
        );
    }
}
