package org.kube.core.algebra;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable cube transformation: an element of the cube group together with one
 * turn sequence that produces it.
 *
 * <p>A move acts on a configuration {@code x} by</p>
 * <pre>
 * y.position[i]    = x.position[perm[i]]
 * y.orientation[i] = x.orientation[perm[i]] + twist[i]   (mod 3 corners, mod 2 edges)
 * </pre>
 * <p>so {@code perm[i]} is the slot whose cubie lands in slot {@code i}, and {@code twist[i]}
 * is the orientation delta picked up by the cubie that lands in slot {@code i}.</p>
 *
 * <p>Equality covers the group element only. Two moves with different turn sequences
 * but the same action are equal; use {@link #sameTurns(Move)} to compare sequences.</p>
 */
public final class Move {
    public static final int CORNER_COUNT = 8;
    public static final int EDGE_COUNT = 12;
    public static final int CORNER_TWISTS = 3;
    public static final int EDGE_FLIPS = 2;

    private final int[] cornerPerm;
    private final int[] cornerTwist;
    private final int[] edgePerm;
    private final int[] edgeTwist;
    private final List<Turn> turns;

    private Move(int[] cornerPerm, int[] cornerTwist, int[] edgePerm, int[] edgeTwist, List<Turn> turns) {
        this.cornerPerm = cornerPerm;
        this.cornerTwist = cornerTwist;
        this.edgePerm = edgePerm;
        this.edgeTwist = edgeTwist;
        this.turns = turns;
    }

    /**
     * Creates a validated move from explicit tables.
     *
     * @param cornerPerm permutation of {@code 0..7}.
     * @param cornerTwist per-slot corner twist deltas, reduced mod 3.
     * @param edgePerm permutation of {@code 0..11}.
     * @param edgeTwist per-slot edge flip deltas, reduced mod 2.
     * @param turns turn sequence producing this element.
     * @return immutable move.
     * @throws IllegalArgumentException when a table has the wrong size or a permutation is not a bijection.
     */
    public static Move of(int[] cornerPerm, int[] cornerTwist, int[] edgePerm, int[] edgeTwist, List<Turn> turns) {
        requirePermutation(cornerPerm, CORNER_COUNT, "cornerPerm");
        requirePermutation(edgePerm, EDGE_COUNT, "edgePerm");
        requireLength(cornerTwist, CORNER_COUNT, "cornerTwist");
        requireLength(edgeTwist, EDGE_COUNT, "edgeTwist");
        Objects.requireNonNull(turns, "turns");
        int[] cornerTwistCopy = new int[CORNER_COUNT];
        for (int i = 0; i < CORNER_COUNT; i++) {
            cornerTwistCopy[i] = Math.floorMod(cornerTwist[i], CORNER_TWISTS);
        }
        int[] edgeTwistCopy = new int[EDGE_COUNT];
        for (int i = 0; i < EDGE_COUNT; i++) {
            edgeTwistCopy[i] = Math.floorMod(edgeTwist[i], EDGE_FLIPS);
        }
        return new Move(
                cornerPerm.clone(),
                cornerTwistCopy,
                edgePerm.clone(),
                edgeTwistCopy,
                List.copyOf(turns)
        );
    }

    /**
     * Wraps freshly computed tables without copying; callers hand over ownership.
     */
    static Move wrap(int[] cornerPerm, int[] cornerTwist, int[] edgePerm, int[] edgeTwist, List<Turn> turns) {
        return new Move(cornerPerm, cornerTwist, edgePerm, edgeTwist, Collections.unmodifiableList(turns));
    }

    public int cornerPerm(int slot) {
        return cornerPerm[slot];
    }

    public int cornerTwist(int slot) {
        return cornerTwist[slot];
    }

    public int edgePerm(int slot) {
        return edgePerm[slot];
    }

    public int edgeTwist(int slot) {
        return edgeTwist[slot];
    }

    public int[] cornerPermutation() {
        return cornerPerm.clone();
    }

    public int[] cornerTwists() {
        return cornerTwist.clone();
    }

    public int[] edgePermutation() {
        return edgePerm.clone();
    }

    public int[] edgeTwists() {
        return edgeTwist.clone();
    }

    /**
     * Returns the turn sequence, first applied turn first.
     */
    public List<Turn> turns() {
        return turns;
    }

    /**
     * Returns the turn sequence as notation symbols.
     */
    public List<String> tokens() {
        List<String> tokens = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            tokens.add(turn.symbol());
        }
        return tokens;
    }

    /**
     * Number of quarter turns in the recorded sequence.
     */
    public int length() {
        return turns.size();
    }

    /**
     * Returns whether this element leaves every cubie in place and unturned.
     */
    public boolean isIdentity() {
        for (int i = 0; i < CORNER_COUNT; i++) {
            if (cornerPerm[i] != i || cornerTwist[i] != 0) {
                return false;
            }
        }
        for (int i = 0; i < EDGE_COUNT; i++) {
            if (edgePerm[i] != i || edgeTwist[i] != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns whether both moves record the same turn sequence.
     */
    public boolean sameTurns(Move other) {
        return other != null && turns.equals(other.turns);
    }

    /**
     * Four-line rendering: corner positions, edge positions, corner twists, edge flips.
     */
    public String describe() {
        return Arrays.toString(cornerPerm) + '\n'
                + Arrays.toString(edgePerm) + '\n'
                + Arrays.toString(cornerTwist) + '\n'
                + Arrays.toString(edgeTwist);
    }

    int[] cornerPermRef() {
        return cornerPerm;
    }

    int[] cornerTwistRef() {
        return cornerTwist;
    }

    int[] edgePermRef() {
        return edgePerm;
    }

    int[] edgeTwistRef() {
        return edgeTwist;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Move)) {
            return false;
        }
        Move other = (Move) o;
        return Arrays.equals(cornerPerm, other.cornerPerm)
                && Arrays.equals(cornerTwist, other.cornerTwist)
                && Arrays.equals(edgePerm, other.edgePerm)
                && Arrays.equals(edgeTwist, other.edgeTwist);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(cornerPerm);
        result = 31 * result + Arrays.hashCode(cornerTwist);
        result = 31 * result + Arrays.hashCode(edgePerm);
        result = 31 * result + Arrays.hashCode(edgeTwist);
        return result;
    }

    @Override
    public String toString() {
        return "Move" + tokens();
    }

    private static void requireLength(int[] table, int size, String name) {
        Objects.requireNonNull(table, name);
        if (table.length != size) {
            throw new IllegalArgumentException(name + " must have " + size + " entries, got " + table.length);
        }
    }

    private static void requirePermutation(int[] perm, int size, String name) {
        requireLength(perm, size, name);
        boolean[] seen = new boolean[size];
        for (int value : perm) {
            if (value < 0 || value >= size) {
                throw new IllegalArgumentException(name + " entry out of range: " + value);
            }
            if (seen[value]) {
                throw new IllegalArgumentException(name + " is not a bijection, duplicate entry: " + value);
            }
            seen[value] = true;
        }
    }
}
