package org.pixelmorph.assignment.local;

import org.pixelmorph.assignment.Assignments;
import org.pixelmorph.assignment.PreviewRenderer;
import org.pixelmorph.assignment.SolveOutcome;
import org.pixelmorph.assignment.SolverTuning;
import org.pixelmorph.cost.CostModel;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.ProgressMessage;
import org.pixelmorph.progress.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Batch local search: swap generations under a shrinking global radius until converged.
 *
 * <p>The radius starts at the grid side and decays by {@value #RADIUS_DECAY} per generation
 * (floored to an integer, never below {@value #MIN_RADIUS}). The solve finishes once the radius
 * is below {@value #CONVERGED_RADIUS} and a generation accepted fewer than
 * {@value #CONVERGED_SWAPS} swaps.</p>
 */
public final class LocalSearchMatcher {
    private static final Logger log = LoggerFactory.getLogger(LocalSearchMatcher.class);

    static final float RADIUS_DECAY = 0.99f;
    static final int MIN_RADIUS = 2;
    static final int CONVERGED_RADIUS = 4;
    static final int CONVERGED_SWAPS = 10;

    private final SolverTuning tuning;

    public LocalSearchMatcher(SolverTuning tuning) {
        this.tuning = Objects.requireNonNull(tuning, "tuning");
    }

    /**
     * Improves {@code initialAssignment} until convergence or cancellation.
     *
     * @param source source grid (colors are static).
     * @param costModel cost model bound to the target grid.
     * @param initialAssignment starting permutation, or {@code null} for identity.
     * @param sink progress consumer; receives a preview and progress after every unconverged generation.
     * @param cancellation cooperative cancellation token, checked after every generation.
     * @return {@code DONE} with the converged permutation, or {@code CANCELLED}.
     */
    public SolveOutcome solve(
            PixelGrid source,
            CostModel costModel,
            int[] initialAssignment,
            ProgressSink sink,
            CancellationToken cancellation
    ) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(costModel, "costModel");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        if (source.sideLength() != costModel.target().sideLength()) {
            throw new IllegalArgumentException(
                    "source side " + source.sideLength() + " does not match target side "
                            + costModel.target().sideLength()
            );
        }
        int side = source.sideLength();
        int[] start = initialAssignment == null ? Assignments.identity(source.size()) : initialAssignment;
        SwapSearchEngine engine = new SwapSearchEngine(costModel, start, tuning.seed());
        SourceColors colors = source::rgb;
        engine.initializeCosts(colors, 0L);

        long proposals = tuning.swapsPerGeneration(source.size());
        int maxDist = side;
        int generation = 0;
        while (true) {
            int swapsMade = engine.runGeneration(proposals, SwapRadius.global(maxDist), colors, CostAugmentation.NONE);
            generation++;
            log.debug("generation {}: maxDist={}, swaps={}", generation, maxDist, swapsMade);

            if (cancellation.isCancellationRequested()) {
                log.debug("local search cancelled after {} generations", generation);
                sink.emit(ProgressMessage.cancelled());
                return SolveOutcome.cancelled(generation);
            }

            int[] assignment = engine.assignment();
            if (maxDist < CONVERGED_RADIUS && swapsMade < CONVERGED_SWAPS) {
                return SolveOutcome.done(assignment, engine.totalCachedCost(), generation);
            }
            sink.emit(ProgressMessage.preview(PreviewRenderer.render(source, assignment)));
            sink.emit(ProgressMessage.progress(1.0f - (float) maxDist / (float) side));

            maxDist = decay(maxDist);
        }
    }

    static int decay(int maxDist) {
        return (int) Math.max((float) MIN_RADIUS, maxDist * RADIUS_DECAY);
    }
}
