package org.kube.core.catalog;

import lombok.experimental.UtilityClass;
import org.kube.core.algebra.Direction;
import org.kube.core.algebra.Face;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.algebra.Turn;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The twelve quarter-turn generators and the authorized connector set built from them.
 *
 * <p>Each clockwise turn is defined by one 4-cycle of corner slots and one of edge slots.
 * For a cycle {@code (c0 c1 c2 c3)} the cubie in slot {@code c(k-1)} moves to slot
 * {@code ck}. The twist table entry {@code v} at position {@code k} gives the cubie landing
 * in {@code ck} an orientation delta of {@code -v}. Counter-clockwise turns are inverses.</p>
 *
 * <p>Tables are built once at class initialization and never change afterwards.</p>
 */
@UtilityClass
public final class FundamentalMoves {
    private static final Map<Turn, Move> GENERATORS = buildGenerators();
    private static final List<Move> AUTHORIZED = buildAuthorizedSet();

    /**
     * Returns the generator for one quarter turn.
     */
    public static Move of(Turn turn) {
        return GENERATORS.get(Objects.requireNonNull(turn, "turn"));
    }

    /**
     * Returns the connector search generating set: for each face in
     * {@code F, R, U, B, L, D} order, the clockwise quarter turn, the half turn and the
     * counter-clockwise quarter turn.
     */
    public static List<Move> authorizedSet() {
        return AUTHORIZED;
    }

    private static Map<Turn, Move> buildGenerators() {
        Map<Turn, Move> generators = new EnumMap<>(Turn.class);
        register(generators, Face.FRONT,
                new int[]{0, 2, 6, 4}, new int[]{4, 1, 6, 9}, new int[]{1, 2, 1, 2}, new int[]{1, 1, 1, 1});
        register(generators, Face.RIGHT,
                new int[]{4, 6, 7, 5}, new int[]{8, 9, 11, 10}, new int[]{1, 2, 1, 2}, new int[]{0, 0, 0, 0});
        register(generators, Face.UP,
                new int[]{6, 2, 3, 7}, new int[]{6, 3, 7, 11}, new int[]{0, 0, 0, 0}, new int[]{0, 0, 0, 0});
        register(generators, Face.BACK,
                new int[]{1, 5, 7, 3}, new int[]{7, 2, 5, 10}, new int[]{2, 1, 2, 1}, new int[]{1, 1, 1, 1});
        register(generators, Face.LEFT,
                new int[]{0, 1, 3, 2}, new int[]{0, 2, 3, 1}, new int[]{2, 1, 2, 1}, new int[]{0, 0, 0, 0});
        register(generators, Face.DOWN,
                new int[]{0, 4, 5, 1}, new int[]{0, 4, 8, 5}, new int[]{0, 0, 0, 0}, new int[]{0, 0, 0, 0});
        return generators;
    }

    private static void register(
            Map<Turn, Move> generators,
            Face face,
            int[] cornerCycle,
            int[] edgeCycle,
            int[] cornerTwists,
            int[] edgeFlips
    ) {
        Turn clockwise = Turn.of(face, Direction.CLOCKWISE);
        Move move = fromCycles(clockwise, cornerCycle, edgeCycle, cornerTwists, edgeFlips);
        generators.put(clockwise, move);
        generators.put(clockwise.inverse(), MoveAlgebra.inverse(move));
    }

    private static Move fromCycles(Turn turn, int[] cornerCycle, int[] edgeCycle, int[] cornerTwists, int[] edgeFlips) {
        int[] cornerPerm = identityPermutation(Move.CORNER_COUNT);
        int[] cornerTwist = new int[Move.CORNER_COUNT];
        int[] edgePerm = identityPermutation(Move.EDGE_COUNT);
        int[] edgeTwist = new int[Move.EDGE_COUNT];
        int cycleLength = cornerCycle.length;
        for (int k = 0; k < cycleLength; k++) {
            int previous = (k + cycleLength - 1) % cycleLength;
            cornerPerm[cornerCycle[k]] = cornerCycle[previous];
            cornerTwist[cornerCycle[k]] = -cornerTwists[k];
            edgePerm[edgeCycle[k]] = edgeCycle[previous];
            edgeTwist[edgeCycle[k]] = -edgeFlips[k];
        }
        return Move.of(cornerPerm, cornerTwist, edgePerm, edgeTwist, List.of(turn));
    }

    private static List<Move> buildAuthorizedSet() {
        List<Move> authorized = new ArrayList<>(Face.values().length * 3);
        for (Face face : Face.values()) {
            Move quarter = GENERATORS.get(Turn.of(face, Direction.CLOCKWISE));
            authorized.add(quarter);
            authorized.add(MoveAlgebra.power(quarter, 2));
            authorized.add(GENERATORS.get(Turn.of(face, Direction.COUNTER_CLOCKWISE)));
        }
        return List.copyOf(authorized);
    }

    private static int[] identityPermutation(int size) {
        int[] perm = new int[size];
        for (int i = 0; i < size; i++) {
            perm[i] = i;
        }
        return perm;
    }
}
