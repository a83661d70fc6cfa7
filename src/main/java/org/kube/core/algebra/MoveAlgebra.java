package org.kube.core.algebra;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Group operations on {@link Move} values.
 *
 * <p>Products use conventional group notation: {@code compose(a, b)} is {@code a * b},
 * meaning {@code b} is applied first and {@code a} second. Orientation deltas follow the
 * semidirect-product law, so the twist carried by {@code b} travels with its cubie to the
 * slot chosen by {@code a} before {@code a}'s own delta is added.</p>
 */
@UtilityClass
public final class MoveAlgebra {
    private static final Move IDENTITY = identityElement();

    /**
     * Returns the identity element with an empty turn sequence.
     */
    public static Move identity() {
        return IDENTITY;
    }

    /**
     * Returns {@code a * b}: apply {@code b}, then {@code a}.
     *
     * <p>The turn sequence of the result is {@code b.turns ++ a.turns}.</p>
     */
    public static Move compose(Move a, Move b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int[] aCornerPerm = a.cornerPermRef();
        int[] aCornerTwist = a.cornerTwistRef();
        int[] bCornerPerm = b.cornerPermRef();
        int[] bCornerTwist = b.cornerTwistRef();
        int[] cornerPerm = new int[Move.CORNER_COUNT];
        int[] cornerTwist = new int[Move.CORNER_COUNT];
        for (int i = 0; i < Move.CORNER_COUNT; i++) {
            int source = aCornerPerm[i];
            cornerPerm[i] = bCornerPerm[source];
            cornerTwist[i] = (bCornerTwist[source] + aCornerTwist[i]) % Move.CORNER_TWISTS;
        }

        int[] aEdgePerm = a.edgePermRef();
        int[] aEdgeTwist = a.edgeTwistRef();
        int[] bEdgePerm = b.edgePermRef();
        int[] bEdgeTwist = b.edgeTwistRef();
        int[] edgePerm = new int[Move.EDGE_COUNT];
        int[] edgeTwist = new int[Move.EDGE_COUNT];
        for (int i = 0; i < Move.EDGE_COUNT; i++) {
            int source = aEdgePerm[i];
            edgePerm[i] = bEdgePerm[source];
            edgeTwist[i] = (bEdgeTwist[source] + aEdgeTwist[i]) % Move.EDGE_FLIPS;
        }

        List<Turn> turns = new ArrayList<>(a.length() + b.length());
        turns.addAll(b.turns());
        turns.addAll(a.turns());
        return Move.wrap(cornerPerm, cornerTwist, edgePerm, edgeTwist, turns);
    }

    /**
     * Returns the product of {@code factors} in written order, so
     * {@code product(x, y, z)} is {@code x * y * z} and {@code z} is applied first.
     */
    public static Move product(Move... factors) {
        Move result = IDENTITY;
        for (Move factor : factors) {
            result = compose(result, factor);
        }
        return result;
    }

    /**
     * Returns the element undoing {@code a}.
     *
     * <p>The turn sequence is reversed with every turn replaced by its inverse.</p>
     */
    public static Move inverse(Move a) {
        Objects.requireNonNull(a, "a");
        int[] aCornerPerm = a.cornerPermRef();
        int[] aCornerTwist = a.cornerTwistRef();
        int[] cornerPerm = new int[Move.CORNER_COUNT];
        int[] cornerTwist = new int[Move.CORNER_COUNT];
        for (int i = 0; i < Move.CORNER_COUNT; i++) {
            int target = aCornerPerm[i];
            cornerPerm[target] = i;
            cornerTwist[target] = (Move.CORNER_TWISTS - aCornerTwist[i]) % Move.CORNER_TWISTS;
        }

        int[] aEdgePerm = a.edgePermRef();
        int[] aEdgeTwist = a.edgeTwistRef();
        int[] edgePerm = new int[Move.EDGE_COUNT];
        int[] edgeTwist = new int[Move.EDGE_COUNT];
        for (int i = 0; i < Move.EDGE_COUNT; i++) {
            int target = aEdgePerm[i];
            edgePerm[target] = i;
            edgeTwist[target] = aEdgeTwist[i];
        }

        List<Turn> source = a.turns();
        List<Turn> turns = new ArrayList<>(source.size());
        for (int i = source.size() - 1; i >= 0; i--) {
            turns.add(source.get(i).inverse());
        }
        return Move.wrap(cornerPerm, cornerTwist, edgePerm, edgeTwist, turns);
    }

    /**
     * Returns {@code a} raised to {@code n}.
     *
     * @param a base element.
     * @param n exponent, at least {@code -1}.
     * @return identity for {@code n = 0}, the inverse for {@code n = -1}, otherwise {@code a * ... * a}.
     * @throws IllegalArgumentException when {@code n < -1}.
     */
    public static Move power(Move a, int n) {
        Objects.requireNonNull(a, "a");
        if (n < -1) {
            throw new IllegalArgumentException("exponent must be >= -1, got " + n);
        }
        if (n == -1) {
            return inverse(a);
        }
        Move result = IDENTITY;
        for (int i = 0; i < n; i++) {
            result = compose(result, a);
        }
        return result;
    }

    /**
     * Returns {@code g * a * g^-1}, which moves the effect of {@code a} onto the cubies
     * that {@code g} brings into {@code a}'s support.
     */
    public static Move conjugate(Move a, Move g) {
        return compose(compose(g, a), inverse(g));
    }

    /**
     * Returns {@code b^-1 * a^-1 * b * a}.
     */
    public static Move commutator(Move a, Move b) {
        return compose(compose(inverse(b), inverse(a)), compose(b, a));
    }

    private static Move identityElement() {
        int[] cornerPerm = new int[Move.CORNER_COUNT];
        for (int i = 0; i < cornerPerm.length; i++) {
            cornerPerm[i] = i;
        }
        int[] edgePerm = new int[Move.EDGE_COUNT];
        for (int i = 0; i < edgePerm.length; i++) {
            edgePerm[i] = i;
        }
        return Move.wrap(cornerPerm, new int[Move.CORNER_COUNT], edgePerm, new int[Move.EDGE_COUNT], new ArrayList<>());
    }
}
