package org.kube.solving.search;

import java.util.Arrays;
import java.util.Objects;

/**
 * Placement constraint for the connector search.
 *
 * <p>Labels name cubies by their slot in the solved configuration. A candidate move
 * {@code g} places label {@code l} into slot {@code s} when {@code g.perm[s] == l}, that is,
 * applying {@code g} to the solved cube leaves cubie {@code l} in slot {@code s}.</p>
 */
public final class ConnectorQuery {
    private final CubieFamily family;
    private final MatchMode mode;
    private final int[] labels;
    private final int[] slots;

    private ConnectorQuery(CubieFamily family, MatchMode mode, int[] labels, int[] slots) {
        this.family = Objects.requireNonNull(family, "family");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.labels = labels;
        this.slots = slots;
        requireDistinctInRange(labels, "labels");
        requireDistinctInRange(slots, "slots");
    }

    /**
     * Labels {@code a, b} onto slots {@code slotA, slotB} or {@code slotB, slotA}.
     */
    public static ConnectorQuery permissivePair(CubieFamily family, int a, int b, int slotA, int slotB) {
        return new ConnectorQuery(family, MatchMode.PERMISSIVE_PAIR, new int[]{a, b}, new int[]{slotA, slotB});
    }

    /**
     * Label {@code a} onto {@code slotA} and label {@code b} onto {@code slotB}.
     */
    public static ConnectorQuery strictPair(CubieFamily family, int a, int b, int slotA, int slotB) {
        return new ConnectorQuery(family, MatchMode.STRICT_PAIR, new int[]{a, b}, new int[]{slotA, slotB});
    }

    /**
     * Label {@code a} onto {@code slotA}, label {@code b} onto {@code slotB}, and label
     * {@code c} into any slot after {@code slotA}.
     */
    public static ConnectorQuery zoneTriple(CubieFamily family, int a, int b, int c, int slotA, int slotB) {
        return new ConnectorQuery(family, MatchMode.ZONE_TRIPLE, new int[]{a, b, c}, new int[]{slotA, slotB});
    }

    public CubieFamily family() {
        return family;
    }

    public MatchMode mode() {
        return mode;
    }

    public int label(int index) {
        return labels[index];
    }

    public int slot(int index) {
        return slots[index];
    }

    /**
     * Tests a packed family permutation stored at {@code offset} of {@code perms}.
     */
    boolean matches(byte[] perms, int offset) {
        int atA = perms[offset + slots[0]];
        int atB = perms[offset + slots[1]];
        return switch (mode) {
            case PERMISSIVE_PAIR -> (atA == labels[0] && atB == labels[1]) || (atA == labels[1] && atB == labels[0]);
            case STRICT_PAIR -> atA == labels[0] && atB == labels[1];
            case ZONE_TRIPLE -> atA == labels[0] && atB == labels[1] && landsAfter(perms, offset, slots[0], labels[2]);
        };
    }

    private boolean landsAfter(byte[] perms, int offset, int slot, int label) {
        for (int next = slot + 1; next < family.slotCount(); next++) {
            if (perms[offset + next] == label) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ConnectorQuery{" + family + ' ' + mode
                + ", labels=" + Arrays.toString(labels)
                + ", slots=" + Arrays.toString(slots) + '}';
    }

    private void requireDistinctInRange(int[] values, String name) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0 || values[i] >= family.slotCount()) {
                throw new IllegalArgumentException(
                        name + " must be in [0, " + family.slotCount() + "), got " + values[i]
                );
            }
            for (int j = 0; j < i; j++) {
                if (values[i] == values[j]) {
                    throw new IllegalArgumentException(name + " must be distinct, got " + Arrays.toString(values));
                }
            }
        }
    }
}
