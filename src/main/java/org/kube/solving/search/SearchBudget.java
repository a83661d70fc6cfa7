package org.kube.solving.search;

/**
 * Per-family depth bounds for the connector search.
 *
 * <p>The bound is the only limit on solver work: search cost grows roughly with
 * {@code 15^depth} candidates after pruning, so a corner bound of 5 allows close to a million
 * candidates per query while an edge bound of 3 stays in the low thousands.</p>
 */
public final class SearchBudget {
    public static final int DEFAULT_MAX_CORNER_MOVES = 5;
    public static final int DEFAULT_MAX_EDGE_MOVES = 3;

    static final String PROP_MAX_CORNER_MOVES = "kube.search.maxCornerMoves";
    static final String PROP_MAX_EDGE_MOVES = "kube.search.maxEdgeMoves";

    private final int maxCornerMoves;
    private final int maxEdgeMoves;

    private SearchBudget(int maxCornerMoves, int maxEdgeMoves) {
        this.maxCornerMoves = normalizeBound(maxCornerMoves, DEFAULT_MAX_CORNER_MOVES);
        this.maxEdgeMoves = normalizeBound(maxEdgeMoves, DEFAULT_MAX_EDGE_MOVES);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values select the defaults.
     */
    public static SearchBudget of(int maxCornerMoves, int maxEdgeMoves) {
        return new SearchBudget(maxCornerMoves, maxEdgeMoves);
    }

    /**
     * Loads bounds from system properties, falling back to the defaults.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_CORNER_MOVES),
                readBound(PROP_MAX_EDGE_MOVES)
        );
    }

    public int maxCornerMoves() {
        return maxCornerMoves;
    }

    public int maxEdgeMoves() {
        return maxEdgeMoves;
    }

    /**
     * Returns the depth bound that applies to queries over {@code family}.
     */
    public int maxMovesFor(CubieFamily family) {
        return family == CubieFamily.CORNER ? maxCornerMoves : maxEdgeMoves;
    }

    @Override
    public String toString() {
        return "SearchBudget{maxCornerMoves=" + maxCornerMoves + ", maxEdgeMoves=" + maxEdgeMoves + '}';
    }

    private static int normalizeBound(int bound, int fallback) {
        if (bound <= 0) {
            return fallback;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
