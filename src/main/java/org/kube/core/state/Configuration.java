package org.kube.core.state;

import org.kube.core.algebra.Move;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable puzzle configuration: which cubie occupies each slot and how it is turned.
 *
 * <p>{@code cornerPos[i]} is the label of the corner cubie in slot {@code i} and
 * {@code cornerOri[i]} its twist in {@code Z3}; edges likewise with flips in {@code Z2}.
 * Configurations only change by replacement through {@link #apply(Move)}.</p>
 */
public final class Configuration {
    private static final Configuration SOLVED = new Configuration(
            identity(Move.CORNER_COUNT),
            new int[Move.CORNER_COUNT],
            identity(Move.EDGE_COUNT),
            new int[Move.EDGE_COUNT]
    );

    private final int[] cornerPos;
    private final int[] cornerOri;
    private final int[] edgePos;
    private final int[] edgeOri;

    private Configuration(int[] cornerPos, int[] cornerOri, int[] edgePos, int[] edgeOri) {
        this.cornerPos = cornerPos;
        this.cornerOri = cornerOri;
        this.edgePos = edgePos;
        this.edgeOri = edgeOri;
    }

    /**
     * Returns the solved configuration.
     */
    public static Configuration solved() {
        return SOLVED;
    }

    /**
     * Evaluates a move on the solved configuration.
     */
    public static Configuration of(Move move) {
        return SOLVED.apply(move);
    }

    /**
     * Returns {@code move} applied after this configuration.
     */
    public Configuration apply(Move move) {
        Objects.requireNonNull(move, "move");
        int[] nextCornerPos = new int[Move.CORNER_COUNT];
        int[] nextCornerOri = new int[Move.CORNER_COUNT];
        for (int i = 0; i < Move.CORNER_COUNT; i++) {
            int source = move.cornerPerm(i);
            nextCornerPos[i] = cornerPos[source];
            nextCornerOri[i] = (cornerOri[source] + move.cornerTwist(i)) % Move.CORNER_TWISTS;
        }
        int[] nextEdgePos = new int[Move.EDGE_COUNT];
        int[] nextEdgeOri = new int[Move.EDGE_COUNT];
        for (int i = 0; i < Move.EDGE_COUNT; i++) {
            int source = move.edgePerm(i);
            nextEdgePos[i] = edgePos[source];
            nextEdgeOri[i] = (edgeOri[source] + move.edgeTwist(i)) % Move.EDGE_FLIPS;
        }
        return new Configuration(nextCornerPos, nextCornerOri, nextEdgePos, nextEdgeOri);
    }

    public int cornerPos(int slot) {
        return cornerPos[slot];
    }

    public int cornerOri(int slot) {
        return cornerOri[slot];
    }

    public int edgePos(int slot) {
        return edgePos[slot];
    }

    public int edgeOri(int slot) {
        return edgeOri[slot];
    }

    /**
     * Returns the slot currently holding corner cubie {@code label}.
     */
    public int cornerSlotOf(int label) {
        return indexOf(cornerPos, label);
    }

    /**
     * Returns the slot currently holding edge cubie {@code label}.
     */
    public int edgeSlotOf(int label) {
        return indexOf(edgePos, label);
    }

    public boolean isSolved() {
        return misplacedCorners() == 0
                && twistedCorners() == 0
                && misplacedEdges() == 0
                && flippedEdges() == 0;
    }

    public int misplacedCorners() {
        return countMisplaced(cornerPos);
    }

    public int twistedCorners() {
        return countNonZero(cornerOri);
    }

    public int misplacedEdges() {
        return countMisplaced(edgePos);
    }

    public int flippedEdges() {
        return countNonZero(edgeOri);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Configuration)) {
            return false;
        }
        Configuration other = (Configuration) o;
        return Arrays.equals(cornerPos, other.cornerPos)
                && Arrays.equals(cornerOri, other.cornerOri)
                && Arrays.equals(edgePos, other.edgePos)
                && Arrays.equals(edgeOri, other.edgeOri);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(cornerPos);
        result = 31 * result + Arrays.hashCode(cornerOri);
        result = 31 * result + Arrays.hashCode(edgePos);
        result = 31 * result + Arrays.hashCode(edgeOri);
        return result;
    }

    @Override
    public String toString() {
        return "Configuration{cornerPos=" + Arrays.toString(cornerPos)
                + ", cornerOri=" + Arrays.toString(cornerOri)
                + ", edgePos=" + Arrays.toString(edgePos)
                + ", edgeOri=" + Arrays.toString(edgeOri) + '}';
    }

    private static int indexOf(int[] positions, int label) {
        for (int slot = 0; slot < positions.length; slot++) {
            if (positions[slot] == label) {
                return slot;
            }
        }
        throw new IllegalArgumentException("label out of range: " + label);
    }

    private static int countMisplaced(int[] positions) {
        int count = 0;
        for (int slot = 0; slot < positions.length; slot++) {
            if (positions[slot] != slot) {
                count++;
            }
        }
        return count;
    }

    private static int countNonZero(int[] values) {
        int count = 0;
        for (int value : values) {
            if (value != 0) {
                count++;
            }
        }
        return count;
    }

    private static int[] identity(int size) {
        int[] values = new int[size];
        for (int i = 0; i < size; i++) {
            values[i] = i;
        }
        return values;
    }
}
