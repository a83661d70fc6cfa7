package org.kube.core.algebra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.kube.core.catalog.FundamentalMoves;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Move Algebra Tests")
class MoveAlgebraTest {

    private static Move gen(Turn turn) {
        return FundamentalMoves.of(turn);
    }

    private static Move randomMove(Random random, int length) {
        Turn[] turns = Turn.values();
        Move result = MoveAlgebra.identity();
        for (int i = 0; i < length; i++) {
            result = MoveAlgebra.compose(gen(turns[random.nextInt(turns.length)]), result);
        }
        return result;
    }

    @Nested
    @DisplayName("1. Identity and Composition")
    class CompositionTests {

        @Test
        @DisplayName("Identity has no turns and fixes every cubie")
        void testIdentity() {
            Move identity = MoveAlgebra.identity();
            assertTrue(identity.isIdentity());
            assertEquals(0, identity.length());
            assertEquals(List.of(), identity.tokens());
        }

        @Test
        @DisplayName("Identity is neutral on both sides")
        void testIdentityNeutral() {
            Move move = randomMove(new Random(3L), 25);
            assertEquals(move, MoveAlgebra.compose(MoveAlgebra.identity(), move));
            assertEquals(move, MoveAlgebra.compose(move, MoveAlgebra.identity()));
            assertTrue(move.sameTurns(MoveAlgebra.compose(MoveAlgebra.identity(), move)));
        }

        @Test
        @DisplayName("compose(a, b) applies b first: tokens are b then a")
        void testComposeTokenOrder() {
            Move uf = MoveAlgebra.compose(gen(Turn.U), gen(Turn.F));
            assertEquals(List.of("F", "U"), uf.tokens());
        }

        @Test
        @DisplayName("Front quarter turn matches its cycle tables")
        void testFrontGenerator() {
            Move f = gen(Turn.F);
            assertArrayEquals(new int[]{4, 1, 0, 3, 6, 5, 2, 7}, f.cornerPermutation());
            assertArrayEquals(new int[]{2, 0, 1, 0, 1, 0, 2, 0}, f.cornerTwists());
            assertArrayEquals(new int[]{0, 4, 2, 3, 9, 5, 1, 7, 8, 6, 10, 11}, f.edgePermutation());
            assertArrayEquals(new int[]{0, 1, 0, 0, 1, 0, 1, 0, 0, 1, 0, 0}, f.edgeTwists());
        }

        @Test
        @DisplayName("describe() prints corner positions, edge positions, corner twists, edge flips")
        void testDescribeFront() {
            assertEquals(
                    "[4, 1, 0, 3, 6, 5, 2, 7]\n"
                            + "[0, 4, 2, 3, 9, 5, 1, 7, 8, 6, 10, 11]\n"
                            + "[2, 0, 1, 0, 1, 0, 2, 0]\n"
                            + "[0, 1, 0, 0, 1, 0, 1, 0, 0, 1, 0, 0]",
                    gen(Turn.F).describe()
            );
        }

        @Test
        @DisplayName("Composition is associative")
        void testAssociativity() {
            Random random = new Random(11L);
            for (int trial = 0; trial < 20; trial++) {
                Move a = randomMove(random, 7);
                Move b = randomMove(random, 7);
                Move c = randomMove(random, 7);
                assertEquals(
                        MoveAlgebra.compose(MoveAlgebra.compose(a, b), c),
                        MoveAlgebra.compose(a, MoveAlgebra.compose(b, c))
                );
            }
        }

        @Test
        @DisplayName("product() reads in written order")
        void testProductWrittenOrder() {
            Move written = MoveAlgebra.product(gen(Turn.R), gen(Turn.U), gen(Turn.F));
            assertEquals(List.of("F", "U", "R"), written.tokens());
            assertEquals(MoveAlgebra.compose(gen(Turn.R), MoveAlgebra.compose(gen(Turn.U), gen(Turn.F))), written);
        }

        @Test
        @DisplayName("Equality ignores the recorded turn sequence")
        void testEqualityIgnoresTurns() {
            Move twoQuarters = MoveAlgebra.power(gen(Turn.R), 2);
            Move twoInverses = MoveAlgebra.power(gen(Turn.R_PRIME), 2);
            assertEquals(twoQuarters, twoInverses);
            assertEquals(twoQuarters.hashCode(), twoInverses.hashCode());
            assertFalse(twoQuarters.sameTurns(twoInverses));
        }
    }

    @Nested
    @DisplayName("2. Inverse and Power")
    class InverseTests {

        @ParameterizedTest
        @EnumSource(Turn.class)
        @DisplayName("Every quarter turn has order four")
        void testGeneratorOrder(Turn turn) {
            Move move = gen(turn);
            assertFalse(move.isIdentity());
            assertFalse(MoveAlgebra.power(move, 2).isIdentity());
            assertTrue(MoveAlgebra.power(move, 4).isIdentity());
            assertEquals(4, MoveAlgebra.power(move, 4).length());
        }

        @ParameterizedTest
        @EnumSource(Turn.class)
        @DisplayName("Counter-clockwise generator is the inverse of the clockwise one")
        void testGeneratorInverse(Turn turn) {
            assertEquals(gen(turn.inverse()), MoveAlgebra.inverse(gen(turn)));
        }

        @Test
        @DisplayName("a * a^-1 and a^-1 * a are the identity")
        void testInverseCancels() {
            Random random = new Random(5L);
            for (int trial = 0; trial < 20; trial++) {
                Move a = randomMove(random, 30);
                assertTrue(MoveAlgebra.compose(a, MoveAlgebra.inverse(a)).isIdentity());
                assertTrue(MoveAlgebra.compose(MoveAlgebra.inverse(a), a).isIdentity());
            }
        }

        @Test
        @DisplayName("Inverse tokens are reversed and case-swapped")
        void testInverseTokens() {
            Move a = MoveAlgebra.product(gen(Turn.U), gen(Turn.R), gen(Turn.F_PRIME));
            assertEquals(List.of("f", "R", "U"), a.tokens());
            assertEquals(List.of("u", "r", "F"), MoveAlgebra.inverse(a).tokens());
        }

        @Test
        @DisplayName("Power edge cases: 0, 1, -1 and n < -1")
        void testPowerEdgeCases() {
            Move a = gen(Turn.L);
            assertTrue(MoveAlgebra.power(a, 0).isIdentity());
            assertEquals(0, MoveAlgebra.power(a, 0).length());
            assertEquals(a, MoveAlgebra.power(a, 1));
            assertEquals(MoveAlgebra.inverse(a), MoveAlgebra.power(a, -1));
            assertThrows(IllegalArgumentException.class, () -> MoveAlgebra.power(a, -2));
        }

        @Test
        @DisplayName("power(m, n) equals the product of n copies of m")
        void testPowerMatchesRepeatedProduct() {
            Random random = new Random(17L);
            for (int trial = 0; trial < 10; trial++) {
                Move m = randomMove(random, 1 + random.nextInt(12));
                for (int n = 0; n <= 4; n++) {
                    Move[] copies = new Move[n];
                    Arrays.fill(copies, m);
                    Move expected = MoveAlgebra.product(copies);
                    Move actual = MoveAlgebra.power(m, n);
                    assertEquals(expected, actual, "n=" + n);
                    assertTrue(expected.sameTurns(actual), "n=" + n);
                    assertEquals(n * m.length(), actual.length());
                }
            }
        }
    }

    @Nested
    @DisplayName("3. Conjugate and Commutator")
    class ConjugationTests {

        @Test
        @DisplayName("Conjugate by identity returns the same element")
        void testConjugateByIdentity() {
            Move a = randomMove(new Random(9L), 12);
            assertEquals(a, MoveAlgebra.conjugate(a, MoveAlgebra.identity()));
        }

        @Test
        @DisplayName("Conjugate is g * a * g^-1")
        void testConjugateDefinition() {
            Random random = new Random(13L);
            Move a = randomMove(random, 9);
            Move g = randomMove(random, 9);
            Move expected = MoveAlgebra.product(g, a, MoveAlgebra.inverse(g));
            Move actual = MoveAlgebra.conjugate(a, g);
            assertEquals(expected, actual);
            assertTrue(expected.sameTurns(actual));
        }

        @Test
        @DisplayName("Commutators of turns on opposite faces vanish")
        void testCommutingFaces() {
            assertTrue(MoveAlgebra.commutator(gen(Turn.U), gen(Turn.D)).isIdentity());
            assertTrue(MoveAlgebra.commutator(gen(Turn.F), gen(Turn.B_PRIME)).isIdentity());
            assertFalse(MoveAlgebra.commutator(gen(Turn.U), gen(Turn.L)).isIdentity());
        }

        @Test
        @DisplayName("Commutator is b^-1 * a^-1 * b * a")
        void testCommutatorDefinition() {
            Move a = gen(Turn.U);
            Move b = gen(Turn.L);
            Move expected = MoveAlgebra.product(
                    MoveAlgebra.inverse(b), MoveAlgebra.inverse(a), b, a
            );
            assertEquals(expected, MoveAlgebra.commutator(a, b));
            assertEquals(List.of("U", "L", "u", "l"), MoveAlgebra.commutator(a, b).tokens());
        }
    }

    @Nested
    @DisplayName("4. Validation")
    class ValidationTests {

        @Test
        @DisplayName("Move.of rejects a non-bijective permutation")
        void testRejectsDuplicateEntries() {
            int[] badCorners = {0, 0, 2, 3, 4, 5, 6, 7};
            assertThrows(IllegalArgumentException.class, () -> Move.of(
                    badCorners, new int[8], identity(12), new int[12], List.of()
            ));
        }

        @Test
        @DisplayName("Move.of rejects tables of the wrong size")
        void testRejectsWrongSize() {
            assertThrows(IllegalArgumentException.class, () -> Move.of(
                    identity(8), new int[7], identity(12), new int[12], List.of()
            ));
        }

        @Test
        @DisplayName("Move.of reduces orientation deltas and copies its inputs")
        void testNormalizesAndCopies() {
            int[] cornerTwist = {-1, 4, 0, 0, 0, 0, 0, 0};
            Move move = Move.of(identity(8), cornerTwist, identity(12), new int[12], List.of());
            cornerTwist[2] = 1;
            assertArrayEquals(new int[]{2, 1, 0, 0, 0, 0, 0, 0}, move.cornerTwists());
        }

        private int[] identity(int size) {
            int[] perm = new int[size];
            for (int i = 0; i < size; i++) {
                perm[i] = i;
            }
            return perm;
        }
    }
}
