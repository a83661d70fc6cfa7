package org.kube.core.catalog;

import lombok.experimental.UtilityClass;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.algebra.Turn;
import org.kube.core.id.TurnMapper;

import java.util.List;

/**
 * Switchers and flippers: moves with a small, known support, used by conjugation.
 *
 * <p>Written products read left to right in group notation, so the rightmost factor is
 * applied first.</p>
 */
@UtilityClass
public final class SwitcherCatalog {

    /** Corner slots exchanged by {@link #CORNER_SWITCHER}. */
    public static final int CORNER_SWITCHER_FIRST = 1;
    public static final int CORNER_SWITCHER_SECOND = 3;

    /** Corner slot twisted by {@link #CORNER_FLIPPER} together with slot 0. */
    public static final int CORNER_FLIPPER_PARTNER = 2;

    /** Edge slot flipped by {@link #EDGE_FLIPPER} together with slot 0. */
    public static final int EDGE_FLIPPER_PARTNER = 3;

    /**
     * {@code (F [U, L])^3}: swaps corner slots 1 and 3 without twisting any corner.
     * Edges are disturbed; later phases repair them.
     */
    public static final Move CORNER_SWITCHER = MoveAlgebra.power(
            MoveAlgebra.compose(generator(Turn.F), MoveAlgebra.commutator(generator(Turn.U), generator(Turn.L))),
            3
    );

    /**
     * {@code (f L)^3 (F l)^3}: fixes every corner in place, adds 2 to the twist of corner slot 0
     * and 1 to corner slot 2.
     */
    public static final Move CORNER_FLIPPER = MoveAlgebra.compose(
            MoveAlgebra.power(MoveAlgebra.compose(generator(Turn.F_PRIME), generator(Turn.L)), 3),
            MoveAlgebra.power(MoveAlgebra.compose(generator(Turn.F), generator(Turn.L_PRIME)), 3)
    );

    /**
     * Edge 3-cycles tried in order by the edge-position phase. Each leaves corners untouched.
     */
    public static final List<EdgeSwitcher> EDGE_SWITCHERS = List.of(
            new EdgeSwitcher(sequence("U U F b L L f B"), 0, 3, 11),
            new EdgeSwitcher(sequence("B B R l U U r L"), 5, 6, 7),
            new EdgeSwitcher(sequence("U U R l F F r L"), 4, 6, 7),
            new EdgeSwitcher(sequence("B B D u R R d U"), 2, 9, 10)
    );

    /**
     * Flips edge slots 0 and 3 and touches nothing else.
     */
    public static final Move EDGE_FLIPPER = sequence("b F D b F R b F U U f B R f B D f B L L");

    private static Move generator(Turn turn) {
        return FundamentalMoves.of(turn);
    }

    /**
     * Builds the product of the written symbols, leftmost factor outermost.
     */
    private static Move sequence(String notation) {
        List<Turn> turns = TurnMapper.standard().parse(notation);
        Move[] factors = new Move[turns.size()];
        for (int i = 0; i < factors.length; i++) {
            factors[i] = generator(turns.get(i));
        }
        return MoveAlgebra.product(factors);
    }
}
