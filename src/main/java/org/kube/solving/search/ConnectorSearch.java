package org.kube.solving.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.algebra.Turn;
import org.kube.core.catalog.FundamentalMoves;

import java.util.List;
import java.util.Objects;

/**
 * Bounded iterative-deepening search for a short product of authorized moves that
 * satisfies a {@link ConnectorQuery}.
 *
 * <p>Layer 1 holds the identity and every authorized move; layer {@code n} appends every
 * authorized move to every candidate of layer {@code n - 1}, outer loop over authorized
 * moves in set order, inner loop over previous candidates in creation order. A candidate is
 * skipped when the appended move starts on the face the previous candidate ended on, which
 * removes literal cancellations and same-face repeats. The first candidate that satisfies
 * the query wins, so the result is the shortest under this pruning, not globally shortest.</p>
 *
 * <p>While searching only the queried family's permutation is tracked; the full move of a
 * hit is rebuilt by composing its authorized-move chain.</p>
 *
 * <p>Instances are immutable and thread-safe; candidate buffers are thread-confined.</p>
 */
public final class ConnectorSearch {
    private static final Logger log = LogManager.getLogger(ConnectorSearch.class);

    private final List<Move> authorized;
    private final Turn[] firstTurns;
    private final Turn[] lastTurns;
    private final int[][] cornerPerms;
    private final int[][] edgePerms;
    private final ThreadLocal<CandidateArena> arenas = ThreadLocal.withInitial(CandidateArena::new);

    /**
     * Creates a search over the standard quarter- and half-turn set.
     */
    public ConnectorSearch() {
        this(FundamentalMoves.authorizedSet());
    }

    /**
     * Creates a search over a custom generating set.
     *
     * @param authorized non-empty list of moves, each with at least one turn.
     */
    public ConnectorSearch(List<Move> authorized) {
        Objects.requireNonNull(authorized, "authorized");
        if (authorized.isEmpty()) {
            throw new IllegalArgumentException("authorized set must not be empty");
        }
        this.authorized = List.copyOf(authorized);
        int size = this.authorized.size();
        this.firstTurns = new Turn[size];
        this.lastTurns = new Turn[size];
        this.cornerPerms = new int[size][];
        this.edgePerms = new int[size][];
        for (int i = 0; i < size; i++) {
            Move move = this.authorized.get(i);
            List<Turn> turns = move.turns();
            if (turns.isEmpty()) {
                throw new IllegalArgumentException("authorized move " + i + " has no turns");
            }
            firstTurns[i] = turns.get(0);
            lastTurns[i] = turns.get(turns.size() - 1);
            cornerPerms[i] = CubieFamily.CORNER.permutationOf(move);
            edgePerms[i] = CubieFamily.EDGE.permutationOf(move);
        }
    }

    /**
     * Searches up to {@code maxMoves} authorized moves deep.
     *
     * @param query placement constraint.
     * @param maxMoves depth bound, at least 1.
     * @return the first hit, or the exhausted sentinel once the bound is passed.
     */
    public ConnectorResult search(ConnectorQuery query, int maxMoves) {
        Objects.requireNonNull(query, "query");
        if (maxMoves < 1) {
            throw new IllegalArgumentException("maxMoves must be >= 1, got " + maxMoves);
        }
        int width = query.family().slotCount();
        int[][] perms = query.family() == CubieFamily.CORNER ? cornerPerms : edgePerms;

        long generated = 1;
        if (query.matches(identityPerm(width), 0)) {
            return ConnectorResult.hit(MoveAlgebra.identity(), 1, generated);
        }

        CandidateArena arena = arenas.get();
        arena.reset(width);
        arena.beginLayer();
        for (int moveIndex = 0; moveIndex < perms.length; moveIndex++) {
            int candidate = arena.appendRoot(moveIndex, perms[moveIndex]);
            generated++;
            if (query.matches(arena.currentPerms(), arena.offsetOf(candidate))) {
                return ConnectorResult.hit(rebuild(arena.chain(candidate)), 1, generated);
            }
        }

        for (int depth = 2; depth <= maxMoves; depth++) {
            arena.beginLayer();
            int previousSize = arena.previousSize();
            for (int moveIndex = 0; moveIndex < perms.length; moveIndex++) {
                Turn first = firstTurns[moveIndex];
                int[] movePerm = perms[moveIndex];
                for (int parent = 0; parent < previousSize; parent++) {
                    if (first.sameFace(lastTurns[arena.previousMove(parent)])) {
                        continue;
                    }
                    int candidate = arena.appendComposed(parent, moveIndex, movePerm);
                    generated++;
                    if (query.matches(arena.currentPerms(), arena.offsetOf(candidate))) {
                        return ConnectorResult.hit(rebuild(arena.chain(candidate)), depth, generated);
                    }
                }
            }
        }

        log.debug("connector search exhausted query={} maxMoves={} generated={}", query, maxMoves, generated);
        return ConnectorResult.exhausted(maxMoves, generated);
    }

    /**
     * Returns the generating set in search order.
     */
    public List<Move> authorizedSet() {
        return authorized;
    }

    private Move rebuild(int[] chain) {
        Move result = MoveAlgebra.identity();
        for (int moveIndex : chain) {
            result = MoveAlgebra.compose(authorized.get(moveIndex), result);
        }
        return result;
    }

    private static byte[] identityPerm(int width) {
        byte[] perm = new byte[width];
        for (int i = 0; i < width; i++) {
            perm[i] = (byte) i;
        }
        return perm;
    }
}
