package org.kube.solving.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.kube.core.algebra.Move;
import org.kube.core.algebra.MoveAlgebra;
import org.kube.core.algebra.Turn;
import org.kube.core.catalog.FundamentalMoves;
import org.kube.core.state.Configuration;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Connector Search Tests")
class ConnectorSearchTest {

    private final ConnectorSearch search = new ConnectorSearch();

    @Nested
    @DisplayName("1. Depth and Candidate Counts")
    class DepthTests {

        @Test
        @DisplayName("Identity satisfies a query that already holds")
        void testIdentityHit() {
            ConnectorResult result = search.search(ConnectorQuery.permissivePair(CubieFamily.CORNER, 1, 3, 3, 1), 5);
            assertTrue(result.found());
            assertTrue(result.move().isIdentity());
            assertEquals(0, result.move().length());
            assertEquals(1, result.depth());
            assertEquals(1, result.generatedCandidates());
        }

        @Test
        @DisplayName("Depth 1 exhausted: identity plus 18 moves generated")
        void testExhaustedAtOne() {
            ConnectorResult result = search.search(ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 7, 7, 0), 1);
            assertFalse(result.found());
            assertNull(result.move());
            assertEquals(1, result.depth());
            assertEquals(19, result.generatedCandidates());
            assertThrows(IllegalStateException.class, result::requireMove);
        }

        @Test
        @DisplayName("Depth 2 exhausted: same-face pruning leaves 15 successors per candidate")
        void testExhaustedAtTwo() {
            ConnectorResult result = search.search(ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 7, 7, 0), 2);
            assertFalse(result.found());
            assertEquals(2, result.depth());
            assertEquals(19 + 18 * 15, result.generatedCandidates());
        }

        @Test
        @DisplayName("Strict corner pair found at depth 3 in deterministic order")
        void testStrictCornerPairAtDepthThree() {
            ConnectorResult result = search.search(ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 7, 7, 0), 5);
            assertTrue(result.found());
            assertEquals(3, result.depth());
            assertEquals(List.of("f", "R", "R", "F"), result.move().tokens());
            assertEquals(307, result.generatedCandidates());

            Configuration placed = Configuration.of(result.requireMove());
            assertEquals(0, placed.cornerPos(7));
            assertEquals(7, placed.cornerPos(0));
        }

        @Test
        @DisplayName("Strict pair is order sensitive where the permissive pair is not")
        void testStrictVersusPermissive() {
            ConnectorResult strict = search.search(ConnectorQuery.strictPair(CubieFamily.CORNER, 1, 3, 3, 1), 5);
            assertTrue(strict.found());
            assertEquals(List.of("l", "F", "U"), strict.move().tokens());
            assertEquals(3, strict.depth());
            assertEquals(1651, strict.generatedCandidates());
        }

        @Test
        @DisplayName("Permissive pair accepts either order")
        void testPermissivePair() {
            ConnectorResult result = search.search(ConnectorQuery.permissivePair(CubieFamily.CORNER, 1, 3, 0, 6), 5);
            assertTrue(result.found());
            assertEquals(List.of("D", "U", "U"), result.move().tokens());
            assertEquals(2, result.depth());
            assertEquals(137, result.generatedCandidates());
        }

        @Test
        @DisplayName("Edge queries track the edge permutation")
        void testEdgeQueries() {
            ConnectorResult strict = search.search(ConnectorQuery.strictPair(CubieFamily.EDGE, 0, 3, 0, 5), 3);
            assertTrue(strict.found());
            assertEquals(List.of("U", "B", "B"), strict.move().tokens());
            assertEquals(176, strict.generatedCandidates());

            ConnectorResult zone = search.search(ConnectorQuery.zoneTriple(CubieFamily.EDGE, 0, 3, 11, 1, 4), 3);
            assertTrue(zone.found());
            assertEquals(List.of("L", "L", "D", "L"), zone.move().tokens());
            assertEquals(3, zone.depth());
            assertEquals(3183, zone.generatedCandidates());

            Configuration placed = Configuration.of(zone.move());
            assertEquals(0, placed.edgePos(1));
            assertEquals(3, placed.edgePos(4));
            assertTrue(placed.edgeSlotOf(11) > 1);
        }
    }

    @Nested
    @DisplayName("2. Result Properties")
    class PropertyTests {

        @Test
        @DisplayName("Found connectors satisfy their query and never undo a turn")
        void testRandomQueries() {
            Random random = new Random(21L);
            for (int trial = 0; trial < 40; trial++) {
                int a = random.nextInt(8);
                int b = (a + 1 + random.nextInt(7)) % 8;
                int slotA = random.nextInt(8);
                int slotB = (slotA + 1 + random.nextInt(7)) % 8;
                ConnectorResult result = search.search(ConnectorQuery.strictPair(CubieFamily.CORNER, a, b, slotA, slotB), 5);
                assertTrue(result.found(), "corner pair queries are reachable within 5 moves");

                Move move = result.move();
                Configuration placed = Configuration.of(move);
                assertEquals(a, placed.cornerPos(slotA));
                assertEquals(b, placed.cornerPos(slotB));

                List<Turn> turns = move.turns();
                for (int i = 1; i < turns.size(); i++) {
                    assertFalse(turns.get(i).cancels(turns.get(i - 1)), "adjacent inverse turns in " + move);
                }
            }
        }

        @Test
        @DisplayName("Repeated searches reuse buffers and return the same connector")
        void testDeterministicReuse() {
            ConnectorQuery deep = ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 7, 7, 0);
            ConnectorQuery shallow = ConnectorQuery.strictPair(CubieFamily.EDGE, 0, 3, 0, 5);
            ConnectorResult first = search.search(deep, 5);
            search.search(shallow, 3);
            ConnectorResult second = search.search(deep, 5);
            assertTrue(first.move().sameTurns(second.move()));
            assertEquals(first.generatedCandidates(), second.generatedCandidates());
        }

        @Test
        @Timeout(value = 30, unit = TimeUnit.SECONDS)
        @DisplayName("Concurrent searches on a shared instance agree")
        void testConcurrentSearches() throws Exception {
            ConnectorQuery query = ConnectorQuery.strictPair(CubieFamily.CORNER, 1, 3, 3, 1);
            List<String> expected = search.search(query, 5).move().tokens();

            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<List<String>>> futures = new ArrayList<>();
                for (int i = 0; i < 16; i++) {
                    futures.add(executor.submit(() -> search.search(query, 5).move().tokens()));
                }
                for (Future<List<String>> future : futures) {
                    assertEquals(expected, future.get());
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("3. Validation")
    class ValidationTests {

        @Test
        @DisplayName("Depth bound below 1 is rejected")
        void testRejectsNonPositiveBound() {
            ConnectorQuery query = ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 7, 7, 0);
            assertThrows(IllegalArgumentException.class, () -> search.search(query, 0));
            assertThrows(IllegalArgumentException.class, () -> search.search(query, -3));
            assertThrows(NullPointerException.class, () -> search.search(null, 3));
        }

        @Test
        @DisplayName("Custom generating sets must be non-empty and made of turns")
        void testRejectsBadGeneratingSet() {
            assertThrows(IllegalArgumentException.class, () -> new ConnectorSearch(List.of()));
            assertThrows(IllegalArgumentException.class,
                    () -> new ConnectorSearch(List.of(MoveAlgebra.identity())));
        }

        @Test
        @DisplayName("Custom generating set limits what can be reached")
        void testCustomGeneratingSet() {
            ConnectorSearch upOnly = new ConnectorSearch(List.of(FundamentalMoves.of(Turn.U)));
            assertEquals(1, upOnly.authorizedSet().size());

            // U after U is pruned, so nothing past depth 1 is generated
            ConnectorResult result = upOnly.search(ConnectorQuery.strictPair(CubieFamily.CORNER, 0, 1, 2, 1), 4);
            assertFalse(result.found());
            assertEquals(2, result.generatedCandidates());
        }
    }
}
