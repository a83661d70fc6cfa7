package org.kube.solving.search;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Layered candidate storage for iterative-deepening connector search.
 *
 * <p>Every candidate is one authorized move appended to a candidate of the previous layer.
 * Parent and move indices are kept for all layers so a hit can be rebuilt; packed family
 * permutations are kept only for the previous and the current layer, in two buffers that
 * swap roles at each layer. Buffers keep their capacity across searches.</p>
 *
 * <p>Not thread-safe; {@link ConnectorSearch} keeps one arena per thread.</p>
 */
final class CandidateArena {
    private static final int NO_PARENT = -1;

    private final List<IntArrayList> parentsByLayer = new ArrayList<>();
    private final List<IntArrayList> movesByLayer = new ArrayList<>();
    private ByteArrayList previousPerms = new ByteArrayList();
    private ByteArrayList currentPerms = new ByteArrayList();
    private int width;
    private int layers;

    /**
     * Drops all layers and prepares for permutations of {@code width} slots.
     */
    void reset(int width) {
        this.width = width;
        this.layers = 0;
        previousPerms.clear();
        currentPerms.clear();
    }

    /**
     * Opens a new layer; the current layer becomes the previous one.
     */
    void beginLayer() {
        ByteArrayList recycled = previousPerms;
        previousPerms = currentPerms;
        currentPerms = recycled;
        currentPerms.clear();
        if (parentsByLayer.size() == layers) {
            parentsByLayer.add(new IntArrayList());
            movesByLayer.add(new IntArrayList());
        }
        parentsByLayer.get(layers).clear();
        movesByLayer.get(layers).clear();
        layers++;
    }

    /**
     * Appends a first-layer candidate made of one authorized move.
     *
     * @return index of the candidate in the current layer.
     */
    int appendRoot(int moveIndex, int[] movePerm) {
        for (int i = 0; i < width; i++) {
            currentPerms.add((byte) movePerm[i]);
        }
        return record(NO_PARENT, moveIndex);
    }

    /**
     * Appends {@code move * previous[parent]}: the authorized move applied after the parent.
     *
     * @return index of the candidate in the current layer.
     */
    int appendComposed(int parent, int moveIndex, int[] movePerm) {
        byte[] previous = previousPerms.elements();
        int base = parent * width;
        for (int i = 0; i < width; i++) {
            currentPerms.add(previous[base + movePerm[i]]);
        }
        return record(parent, moveIndex);
    }

    int previousSize() {
        return layers < 2 ? 0 : movesByLayer.get(layers - 2).size();
    }

    /**
     * Returns the authorized move index that ended candidate {@code candidate} of the previous layer.
     */
    int previousMove(int candidate) {
        return movesByLayer.get(layers - 2).getInt(candidate);
    }

    /**
     * Backing array of the current layer's packed permutations. Re-read after every append.
     */
    byte[] currentPerms() {
        return currentPerms.elements();
    }

    int offsetOf(int candidate) {
        return candidate * width;
    }

    /**
     * Returns the authorized move indices of a current-layer candidate, first applied first.
     */
    int[] chain(int candidate) {
        int[] chain = new int[layers];
        int index = candidate;
        for (int layer = layers - 1; layer >= 0; layer--) {
            chain[layer] = movesByLayer.get(layer).getInt(index);
            index = parentsByLayer.get(layer).getInt(index);
        }
        return chain;
    }

    private int record(int parent, int moveIndex) {
        IntArrayList parents = parentsByLayer.get(layers - 1);
        parents.add(parent);
        movesByLayer.get(layers - 1).add(moveIndex);
        return parents.size() - 1;
    }
}
