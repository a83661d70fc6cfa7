package org.kube.core.state;

import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.algebra.Turn;
import org.kube.core.catalog.FundamentalMoves;
import org.kube.core.id.TurnMapper;

import java.util.List;
import java.util.Objects;

/**
 * Replays turn sequences into moves and configurations.
 *
 * <p>Stateless apart from the symbol mapper; safe to share between threads.</p>
 */
public final class StateModel {
    private final TurnMapper turnMapper;

    public StateModel() {
        this(TurnMapper.standard());
    }

    public StateModel(TurnMapper turnMapper) {
        this.turnMapper = Objects.requireNonNull(turnMapper, "turnMapper");
    }

    /**
     * Folds symbols into the move they spell, first symbol applied first.
     *
     * @throws TurnMapper.UnknownTokenException when a symbol is not a recognized quarter turn.
     */
    public Move replay(List<String> tokens) {
        return replayTurns(turnMapper.toTurns(tokens));
    }

    /**
     * Folds turns into the move they spell, first turn applied first.
     */
    public Move replayTurns(List<Turn> turns) {
        Objects.requireNonNull(turns, "turns");
        Move accumulated = MoveAlgebra.identity();
        for (Turn turn : turns) {
            accumulated = MoveAlgebra.compose(FundamentalMoves.of(turn), accumulated);
        }
        return accumulated;
    }

    /**
     * Returns the configuration reached from the solved state by {@code tokens}.
     *
     * @throws TurnMapper.UnknownTokenException when a symbol is not a recognized quarter turn.
     */
    public Configuration apply(List<String> tokens) {
        return Configuration.of(replay(tokens));
    }
}
