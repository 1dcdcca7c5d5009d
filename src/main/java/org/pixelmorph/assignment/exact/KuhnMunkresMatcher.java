package org.pixelmorph.assignment.exact;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pixelmorph.assignment.PreviewRenderer;
import org.pixelmorph.assignment.SolveOutcome;
import org.pixelmorph.assignment.SolverTuning;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.ProgressMessage;
import org.pixelmorph.progress.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Optimal assignment via Kuhn-Munkres (augmenting-path formulation with slack tracking).
 *
 * <p>Maximizes total {@link AssignmentWeights#at(int, int)} over {@code nx <= ny}. Labels
 * satisfy {@code lx[x] + ly[y] >= w(x, y)} throughout; each root grows an alternating tree by
 * repeatedly taking the unvisited column of minimum slack (first index on ties), tightening
 * labels when that slack is positive, until a free column closes an augmenting path.</p>
 *
 * <p>Every {@link SolverTuning#reportEveryRoots()} roots the matcher checks cancellation,
 * then reports progress and an optional preview. The algorithm uses no randomness.</p>
 */
public final class KuhnMunkresMatcher {
    private static final Logger log = LoggerFactory.getLogger(KuhnMunkresMatcher.class);

    private static final int UNMATCHED = -1;

    private final int reportEveryRoots;

    public KuhnMunkresMatcher(SolverTuning tuning) {
        this.reportEveryRoots = Objects.requireNonNull(tuning, "tuning").reportEveryRoots();
    }

    /**
     * Solves one assignment problem.
     *
     * @param weights weight matrix, rows are target cells.
     * @param previewSource source grid for periodic previews; {@code null} disables previews.
     * @param sink progress consumer.
     * @param cancellation cooperative cancellation token.
     * @return {@code DONE} with the optimal permutation, or {@code CANCELLED}.
     * @throws IllegalArgumentException when {@code rows > columns}.
     */
    public SolveOutcome solve(
            AssignmentWeights weights,
            PixelGrid previewSource,
            ProgressSink sink,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        int nx = weights.rows();
        int ny = weights.columns();
        if (nx > ny) {
            throw new IllegalArgumentException(
                    "number of rows must not be larger than number of columns: " + nx + " > " + ny
            );
        }
        if (previewSource != null && previewSource.size() != nx) {
            throw new IllegalArgumentException(
                    "preview grid size " + previewSource.size() + " does not match row count " + nx
            );
        }

        int[] xy = new int[nx];
        int[] yx = new int[ny];
        Arrays.fill(xy, UNMATCHED);
        Arrays.fill(yx, UNMATCHED);

        long[] lx = new long[nx];
        for (int row = 0; row < nx; row++) {
            long best = Long.MIN_VALUE;
            for (int col = 0; col < ny; col++) {
                best = Math.max(best, weights.at(row, col));
            }
            lx[row] = best;
        }
        long[] ly = new long[ny];

        // alternating[y] holds the tree predecessor x of y, or UNMATCHED when y is outside the tree.
        int[] alternating = new int[ny];
        long[] slack = new long[ny];
        int[] slackx = new int[ny];
        IntArrayList treeRows = new IntArrayList();

        for (int root = 0; root < nx; root++) {
            Arrays.fill(alternating, UNMATCHED);
            treeRows.clear();
            treeRows.add(root);
            for (int y = 0; y < ny; y++) {
                slack[y] = lx[root] + ly[y] - weights.at(root, y);
            }
            Arrays.fill(slackx, root);

            int freeY;
            while (true) {
                long delta = Long.MAX_VALUE;
                int x = 0;
                int y = 0;
                for (int yy = 0; yy < ny; yy++) {
                    if (alternating[yy] == UNMATCHED && slack[yy] < delta) {
                        delta = slack[yy];
                        x = slackx[yy];
                        y = yy;
                    }
                }
                if (delta > 0) {
                    for (int i = 0; i < treeRows.size(); i++) {
                        lx[treeRows.getInt(i)] -= delta;
                    }
                    for (int yy = 0; yy < ny; yy++) {
                        if (alternating[yy] != UNMATCHED) {
                            ly[yy] += delta;
                        } else {
                            slack[yy] -= delta;
                        }
                    }
                }
                alternating[y] = x;
                if (yx[y] == UNMATCHED) {
                    freeY = y;
                    break;
                }
                int matchedX = yx[y];
                treeRows.add(matchedX);
                for (int yy = 0; yy < ny; yy++) {
                    if (alternating[yy] == UNMATCHED) {
                        long alternateSlack = lx[matchedX] + ly[yy] - weights.at(matchedX, yy);
                        if (slack[yy] > alternateSlack) {
                            slack[yy] = alternateSlack;
                            slackx[yy] = matchedX;
                        }
                    }
                }
            }

            // Flip matching edges along the augmenting path back to root.
            int cursor = freeY;
            while (cursor != UNMATCHED) {
                int x = alternating[cursor];
                int previous = xy[x];
                yx[cursor] = x;
                xy[x] = cursor;
                cursor = previous;
            }

            if (root % reportEveryRoots == 0) {
                if (cancellation.isCancellationRequested()) {
                    log.debug("exact solve cancelled after {} of {} roots", root + 1, nx);
                    sink.emit(ProgressMessage.cancelled());
                    return SolveOutcome.cancelled(root + 1);
                }
                sink.emit(ProgressMessage.progress((float) root / (float) nx));
                if (previewSource != null) {
                    sink.emit(ProgressMessage.preview(PreviewRenderer.render(previewSource, partialAssignment(xy))));
                }
                log.debug("exact solve augmented root {}/{}", root + 1, nx);
            }
        }

        long labelSum = 0L;
        for (long value : lx) {
            labelSum += value;
        }
        for (long value : ly) {
            labelSum += value;
        }
        sink.emit(ProgressMessage.progress(1.0f));
        return SolveOutcome.done(xy, -labelSum, nx);
    }

    /**
     * Copies a partial matching, substituting source {@code 0} for unmatched targets.
     */
    private static int[] partialAssignment(int[] xy) {
        int[] out = new int[xy.length];
        for (int i = 0; i < xy.length; i++) {
            out[i] = xy[i] == UNMATCHED ? 0 : xy[i];
        }
        return out;
    }
}
