package org.pixelmorph.assignment.local;

import org.pixelmorph.assignment.Assignments;
import org.pixelmorph.assignment.SolveOutcome;
import org.pixelmorph.assignment.SolverTuning;
import org.pixelmorph.canvas.CanvasSnapshot;
import org.pixelmorph.canvas.LiveCanvas;
import org.pixelmorph.cost.CostModel;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.ProgressMessage;
import org.pixelmorph.progress.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Continuous local search behind the interactive drawing canvas.
 *
 * <p>The live canvas is the source image. Each generation snapshots the canvas, runs one
 * bounded batch of swaps under {@link AgeSwapRadius} and {@link StrokeCohesion}, publishes the
 * permutation when anything changed, then checks its token. The loop only ends by
 * cancellation, typically because a newer drawing session has started.</p>
 */
public final class DrawingSolver {
    private static final Logger log = LoggerFactory.getLogger(DrawingSolver.class);

    private final SolverTuning tuning;

    public DrawingSolver(SolverTuning tuning) {
        this.tuning = Objects.requireNonNull(tuning, "tuning");
    }

    /**
     * Runs until {@code cancellation} fires.
     *
     * @param costModel cost model bound to the drawing target.
     * @param canvas shared live canvas; only read through snapshots.
     * @param initialAssignment starting permutation, or {@code null} for identity.
     * @param sink receives {@code UPDATE_ASSIGNMENTS} after productive generations and a final
     *             {@code CANCELLED}.
     * @param cancellation session token.
     * @return a {@code CANCELLED} outcome carrying the number of generations run.
     */
    public SolveOutcome run(
            CostModel costModel,
            LiveCanvas canvas,
            int[] initialAssignment,
            ProgressSink sink,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(costModel, "costModel");
        Objects.requireNonNull(canvas, "canvas");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        if (canvas.sideLength() != costModel.target().sideLength()) {
            throw new IllegalArgumentException(
                    "canvas side " + canvas.sideLength() + " does not match target side "
                            + costModel.target().sideLength()
            );
        }
        int cells = costModel.target().size();
        int[] start = initialAssignment == null ? Assignments.identity(cells) : initialAssignment;
        SwapSearchEngine engine = new SwapSearchEngine(costModel, start, tuning.seed());

        CanvasSnapshot initial = canvas.snapshot();
        engine.initializeCosts(initial::rgb, StrokeCohesion.STROKE_REWARD);

        long proposals = tuning.swapsPerGeneration(cells);
        int generation = 0;
        while (true) {
            CanvasSnapshot snapshot = canvas.snapshot();
            int swapsMade = engine.runGeneration(
                    proposals,
                    new AgeSwapRadius(snapshot),
                    snapshot::rgb,
                    new StrokeCohesion(snapshot)
            );
            generation++;
            if (swapsMade > 0) {
                sink.emit(ProgressMessage.assignments(engine.assignment()));
            }
            log.trace("drawing generation {} at frame {}: swaps={}", generation, snapshot.frame(), swapsMade);

            if (cancellation.isCancellationRequested()) {
                log.debug("drawing solver superseded after {} generations", generation);
                sink.emit(ProgressMessage.cancelled());
                return SolveOutcome.cancelled(generation);
            }
        }
    }
}
