package org.kube.solving.search;

import org.kube.core.algebra.Move;

/**
 * Cubie family a connector query constrains. Only that family's permutation is tracked
 * while searching.
 */
public enum CubieFamily {
    CORNER(Move.CORNER_COUNT),
    EDGE(Move.EDGE_COUNT);

    private final int slotCount;

    CubieFamily(int slotCount) {
        this.slotCount = slotCount;
    }

    public int slotCount() {
        return slotCount;
    }

    /**
     * Returns the family's permutation of {@code move}.
     */
    int[] permutationOf(Move move) {
        return this == CORNER ? move.cornerPermutation() : move.edgePermutation();
    }
}
