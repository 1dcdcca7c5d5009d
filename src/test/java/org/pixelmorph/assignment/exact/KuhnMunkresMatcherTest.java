package org.pixelmorph.assignment.exact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pixelmorph.assignment.Assignments;
import org.pixelmorph.assignment.SolveOutcome;
import org.pixelmorph.assignment.SolverTuning;
import org.pixelmorph.cost.CostModel;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.grid.RgbImage;
import org.pixelmorph.progress.CancellationFlag;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.ProgressMessage;
import org.pixelmorph.progress.ProgressSink;
import org.pixelmorph.testutil.GridFixtures;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Kuhn-Munkres Matcher Tests")
class KuhnMunkresMatcherTest {

    private static final SolverTuning TUNING = SolverTuning.of(4, 12345L, 100);

    private static SolveOutcome solve(RgbImage source, CostModel model, ProgressSink sink) {
        PixelGrid sourceGrid = PixelGrid.fromImage(source);
        return new KuhnMunkresMatcher(TUNING)
                .solve(new ImageDiffWeights(sourceGrid, model), sourceGrid, sink, CancellationToken.NONE);
    }

    /**
     * Dense test matrix, rows are targets.
     */
    private static final class MatrixWeights implements AssignmentWeights {
        private final long[][] values;

        private MatrixWeights(long[][] values) {
            this.values = values;
        }

        @Override
        public int rows() {
            return values.length;
        }

        @Override
        public int columns() {
            return values[0].length;
        }

        @Override
        public long at(int row, int column) {
            return values[row][column];
        }
    }

    @Nested
    @DisplayName("1. Optimality")
    class OptimalityTests {

        @Test
        @DisplayName("Rotated 2x2 image is solved exactly")
        void testRotatedTwoByTwo() {
            RgbImage source = RgbImage.fromPacked(2, 2, new int[]{0xFF0000, 0x00FF00, 0x0000FF, 0xFFFFFF});
            RgbImage target = RgbImage.fromPacked(2, 2, new int[]{0xFFFFFF, 0x0000FF, 0x00FF00, 0xFF0000});
            CostModel model = GridFixtures.uniformModel(target, 0);

            SolveOutcome outcome = solve(source, model, ProgressSink.DISCARD);

            assertTrue(outcome.done());
            assertArrayEquals(new int[]{3, 2, 1, 0}, outcome.assignment());
            assertEquals(0L, outcome.totalCost());
        }

        @Test
        @DisplayName("Identical images map to identity at zero cost")
        void testIdentity() {
            RgbImage image = GridFixtures.gradient(5);
            CostModel model = GridFixtures.uniformModel(image, 10);

            SolveOutcome outcome = solve(image, model, ProgressSink.DISCARD);

            assertArrayEquals(Assignments.identity(25), outcome.assignment());
            assertEquals(0L, outcome.totalCost());
            assertEquals(25, outcome.iterations());
        }

        @Test
        @DisplayName("3x3 optimum matches brute force over all permutations")
        void testBruteForceThreeByThree() {
            RgbImage source = GridFixtures.random(3, 7L);
            RgbImage target = GridFixtures.random(3, 11L);
            CostModel model = GridFixtures.uniformModel(target, 1);
            PixelGrid sourceGrid = PixelGrid.fromImage(source);

            SolveOutcome outcome = solve(source, model, ProgressSink.DISCARD);

            long best = bruteForce(model, sourceGrid, Assignments.identity(9), 0);
            assertTrue(Assignments.isPermutation(outcome.assignment()));
            assertEquals(best, outcome.totalCost());
            assertEquals(best, GridFixtures.totalCost(model, sourceGrid, outcome.assignment()));
        }

        @Test
        @DisplayName("Reported total equals summed per-pixel cost")
        void testTotalCostConsistent() {
            RgbImage source = GridFixtures.random(6, 3L);
            RgbImage target = GridFixtures.gradient(6);
            CostModel model = GridFixtures.uniformModel(target, 4);

            SolveOutcome outcome = solve(source, model, ProgressSink.DISCARD);

            assertEquals(
                    GridFixtures.totalCost(model, PixelGrid.fromImage(source), outcome.assignment()),
                    outcome.totalCost()
            );
        }

        @Test
        @DisplayName("Rectangular matrix picks the best columns")
        void testRectangular() {
            long[][] values = {
                    {-5, -1, -9},
                    {-1, -7, -2}
            };
            SolveOutcome outcome = new KuhnMunkresMatcher(TUNING)
                    .solve(new MatrixWeights(values), null, ProgressSink.DISCARD, CancellationToken.NONE);

            assertArrayEquals(new int[]{1, 0}, outcome.assignment());
            assertEquals(2L, outcome.totalCost());
        }

        @Test
        @DisplayName("More rows than columns is rejected")
        void testRejectsTallMatrix() {
            long[][] values = {{1}, {2}};
            assertThrows(IllegalArgumentException.class, () -> new KuhnMunkresMatcher(TUNING)
                    .solve(new MatrixWeights(values), null, ProgressSink.DISCARD, CancellationToken.NONE));
        }

        private long bruteForce(CostModel model, PixelGrid source, int[] permutation, int depth) {
            if (depth == permutation.length) {
                return GridFixtures.totalCost(model, source, permutation);
            }
            long best = Long.MAX_VALUE;
            for (int i = depth; i < permutation.length; i++) {
                swap(permutation, depth, i);
                best = Math.min(best, bruteForce(model, source, permutation, depth + 1));
                swap(permutation, depth, i);
            }
            return best;
        }

        private void swap(int[] values, int i, int j) {
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }

    @Nested
    @DisplayName("2. Progress and Cancellation")
    class ProgressTests {

        @Test
        @DisplayName("Same input gives the same permutation")
        void testDeterministic() {
            RgbImage source = GridFixtures.random(6, 21L);
            RgbImage target = GridFixtures.random(6, 22L);
            CostModel model = GridFixtures.uniformModel(target, 2);

            assertArrayEquals(
                    solve(source, model, ProgressSink.DISCARD).assignment(),
                    solve(source, model, ProgressSink.DISCARD).assignment()
            );
        }

        @Test
        @DisplayName("Reports a preview at root 0 and full progress at the end")
        void testProgressSequence() {
            RgbImage source = GridFixtures.random(4, 1L);
            CostModel model = GridFixtures.uniformModel(GridFixtures.gradient(4), 1);
            List<ProgressMessage> messages = new ArrayList<>();

            solve(source, model, messages::add);

            assertEquals(ProgressMessage.Kind.PROGRESS, messages.get(0).kind());
            assertEquals(0.0f, messages.get(0).fraction());
            assertEquals(ProgressMessage.Kind.UPDATE_PREVIEW, messages.get(1).kind());
            assertEquals(4, messages.get(1).preview().width());
            ProgressMessage last = messages.get(messages.size() - 1);
            assertEquals(ProgressMessage.Kind.PROGRESS, last.kind());
            assertEquals(1.0f, last.fraction());
            assertTrue(messages.stream().noneMatch(m -> m.kind() == ProgressMessage.Kind.CANCELLED));
        }

        @Test
        @Timeout(value = 60, unit = TimeUnit.SECONDS)
        @DisplayName("Cancellation on a 100x100 grid stops at the next report boundary")
        void testCancellationLargeGrid() {
            RgbImage source = GridFixtures.random(100, 5L);
            CostModel model = GridFixtures.uniformModel(GridFixtures.random(100, 6L), 1);
            PixelGrid sourceGrid = PixelGrid.fromImage(source);
            CancellationFlag flag = new CancellationFlag();
            List<ProgressMessage> messages = new ArrayList<>();

            SolveOutcome outcome = new KuhnMunkresMatcher(TUNING).solve(
                    new ImageDiffWeights(sourceGrid, model),
                    null,
                    message -> {
                        messages.add(message);
                        if (message.kind() == ProgressMessage.Kind.PROGRESS) {
                            flag.cancel();
                        }
                    },
                    flag
            );

            assertFalse(outcome.done());
            assertEquals(SolveOutcome.Status.CANCELLED, outcome.status());
            assertTrue(outcome.iterations() <= 101, "stopped after " + outcome.iterations() + " roots");
            assertEquals(ProgressMessage.Kind.CANCELLED, messages.get(messages.size() - 1).kind());
            assertTrue(messages.stream().noneMatch(m -> m.kind() == ProgressMessage.Kind.DONE));
        }
    }
}
