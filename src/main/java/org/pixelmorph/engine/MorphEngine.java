package org.pixelmorph.engine;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pixelmorph.assignment.Assignments;
import org.pixelmorph.assignment.SolveOutcome;
import org.pixelmorph.assignment.SolverTuning;
import org.pixelmorph.assignment.exact.ImageDiffWeights;
import org.pixelmorph.assignment.exact.KuhnMunkresMatcher;
import org.pixelmorph.assignment.local.DrawingSolver;
import org.pixelmorph.assignment.local.LocalSearchMatcher;
import org.pixelmorph.canvas.LiveCanvas;
import org.pixelmorph.cost.CostModel;
import org.pixelmorph.cost.CostParameters;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.grid.RgbImage;
import org.pixelmorph.grid.WeightMap;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.DrawingSessionCounter;
import org.pixelmorph.progress.ProgressMessage;
import org.pixelmorph.progress.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main assignment orchestration entry point.
 *
 * <p>The facade validates requests before any solver starts. Execution flow:</p>
 * <ul>
 * <li>Check image shapes and settings; failures become an {@code ERROR} message carrying a
 * {@link MorphException} reason code.</li>
 * <li>Extract source/target grids, weights, and the cost model.</li>
 * <li>Delegate to the exact or local-search solver on the calling thread, or on the worker pool
 * for {@link #submit} and {@link #startDrawing}.</li>
 * <li>Wrap a completed permutation into a {@link MorphResult} and emit {@code DONE}.</li>
 * </ul>
 * <p>
 * Starting a drawing session retires the previous one through a {@link DrawingSessionCounter};
 * the old solver acknowledges with {@code CANCELLED} at its next generation boundary.
 * Contract violations inside solvers are programming errors and propagate unchanged.
 * </p>
 */
@Accessors(fluent = true)
public final class MorphEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MorphEngine.class);

    public static final String REASON_REQUEST_REQUIRED = "MORPH_REQUEST_REQUIRED";
    public static final String REASON_SETTINGS_REQUIRED = "MORPH_SETTINGS_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "MORPH_ALGORITHM_REQUIRED";
    public static final String REASON_SOURCE_REQUIRED = "MORPH_SOURCE_REQUIRED";
    public static final String REASON_TARGET_REQUIRED = "MORPH_TARGET_REQUIRED";
    public static final String REASON_CANVAS_REQUIRED = "MORPH_CANVAS_REQUIRED";
    public static final String REASON_TARGET_NOT_SQUARE = "MORPH_TARGET_NOT_SQUARE";
    public static final String REASON_WEIGHTS_DIMENSION_MISMATCH = "MORPH_WEIGHTS_DIMENSION_MISMATCH";
    public static final String REASON_SOURCE_DIMENSION_MISMATCH = "MORPH_SOURCE_DIMENSION_MISMATCH";
    public static final String REASON_SIDE_LENGTH_MISMATCH = "MORPH_SIDE_LENGTH_MISMATCH";
    public static final String REASON_CANVAS_DIMENSION_MISMATCH = "MORPH_CANVAS_DIMENSION_MISMATCH";
    public static final String REASON_PROXIMITY_INVALID = "MORPH_PROXIMITY_INVALID";
    public static final String REASON_INITIAL_ASSIGNMENT_INVALID = "MORPH_INITIAL_ASSIGNMENT_INVALID";

    @Getter
    private final SolverTuning tuning;
    private final ExecutorService worker;
    private final boolean ownsWorker;
    private final DrawingSessionCounter drawingSessions = new DrawingSessionCounter();

    /**
     * Creates the engine facade.
     *
     * @param tuning solver tuning; {@code null} loads {@link SolverTuning#defaults()}.
     * @param worker executor for background solves; {@code null} creates an owned daemon pool.
     */
    @Builder
    public MorphEngine(SolverTuning tuning, ExecutorService worker) {
        this.tuning = tuning == null ? SolverTuning.defaults() : tuning;
        this.ownsWorker = worker == null;
        this.worker = worker == null ? Executors.newCachedThreadPool(new WorkerThreadFactory()) : worker;
    }

    /**
     * Runs one static solve on the calling thread.
     *
     * <p>Emits progress and previews while solving, then exactly one of {@code DONE},
     * {@code CANCELLED} or {@code ERROR}.</p>
     */
    public void process(MorphRequest request, ProgressSink sink, CancellationToken cancellation) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        PreparedSolve prepared;
        try {
            prepared = prepare(request);
        } catch (MorphException ex) {
            log.warn("rejected morph request: {}", ex.getMessage());
            sink.emit(ProgressMessage.error(ex.getMessage()));
            return;
        }

        MorphSettings settings = request.getSettings();
        log.info(
                "solving '{}' with {} on {}x{} grid (proximity={})",
                settings.getName(),
                settings.getAlgorithm(),
                prepared.source().sideLength(),
                prepared.source().sideLength(),
                settings.getProximityImportance()
        );
        SolveOutcome outcome = switch (settings.getAlgorithm()) {
            case EXACT -> new KuhnMunkresMatcher(tuning).solve(
                    new ImageDiffWeights(prepared.source(), prepared.costModel()),
                    prepared.source(),
                    sink,
                    cancellation
            );
            case LOCAL_SEARCH -> new LocalSearchMatcher(tuning).solve(
                    prepared.source(),
                    prepared.costModel(),
                    request.getInitialAssignment(),
                    sink,
                    cancellation
            );
        };

        if (!outcome.done()) {
            log.info("solve '{}' cancelled after {} iterations", settings.getName(), outcome.iterations());
            return;
        }
        log.info("solve '{}' done after {} iterations, total cost {}", settings.getName(), outcome.iterations(),
                outcome.totalCost());
        sink.emit(ProgressMessage.done(MorphResult.builder()
                .name(settings.getName())
                .source(prepared.source().toImage())
                .assignments(outcome.assignment())
                .totalCost(outcome.totalCost())
                .algorithm(settings.getAlgorithm())
                .build()));
    }

    /**
     * Runs {@link #process} on the worker pool.
     */
    public Future<?> submit(MorphRequest request, ProgressSink sink, CancellationToken cancellation) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        return worker.submit(() -> failFast(() -> process(request, sink, cancellation)));
    }

    /**
     * Starts a new drawing session in the background, retiring any running one.
     *
     * @return future completing when this session's solver acknowledges cancellation.
     */
    public Future<?> startDrawing(DrawingRequest request, ProgressSink sink) {
        Objects.requireNonNull(sink, "sink");
        DrawingSessionCounter.SessionToken token = drawingSessions.begin();
        log.info("starting drawing session {}", token.generation());
        return worker.submit(() -> failFast(() -> runDrawing(request, sink, token)));
    }

    /**
     * Retires the running drawing session, if any.
     */
    public void stopDrawing() {
        drawingSessions.retireAll();
    }

    public long currentDrawingGeneration() {
        return drawingSessions.currentGeneration();
    }

    /**
     * Runs a drawing session on the calling thread until {@code cancellation} fires.
     */
    public void runDrawing(DrawingRequest request, ProgressSink sink, CancellationToken cancellation) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        CostModel costModel;
        try {
            costModel = prepareDrawing(request);
        } catch (MorphException ex) {
            log.warn("rejected drawing request: {}", ex.getMessage());
            sink.emit(ProgressMessage.error(ex.getMessage()));
            return;
        }
        SolveOutcome outcome = new DrawingSolver(tuning).run(
                costModel,
                request.getCanvas(),
                request.getInitialAssignment(),
                sink,
                cancellation
        );
        log.info("drawing session ended after {} generations", outcome.iterations());
    }

    @Override
    public void close() {
        drawingSessions.retireAll();
        if (ownsWorker) {
            worker.shutdown();
        }
    }

    /**
     * Validates a static request and builds its solver inputs.
     *
     * @throws MorphException when a request precondition fails.
     */
    static PreparedSolve prepare(MorphRequest request) {
        if (request == null) {
            throw new MorphException(REASON_REQUEST_REQUIRED, "request must be provided");
        }
        MorphSettings settings = requireSettings(request.getSettings());
        if (settings.getAlgorithm() == null) {
            throw new MorphException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        RgbImage source = request.getSource();
        if (source == null) {
            throw new MorphException(REASON_SOURCE_REQUIRED, "source image must be provided");
        }
        RgbImage target = requireTarget(request.getTarget(), request.getWeights(), settings);
        if (source.width() != target.width() || source.height() != target.height()) {
            throw new MorphException(
                    REASON_SOURCE_DIMENSION_MISMATCH,
                    "Source image must be resampled to the target dimensions: source "
                            + source.width() + "x" + source.height() + ", target "
                            + target.width() + "x" + target.height()
            );
        }
        CostModel costModel = buildCostModel(target, request.getWeights(), settings);
        if (request.getInitialAssignment() != null) {
            requireInitialAssignment(request.getInitialAssignment(), target.pixelCount());
        }
        return new PreparedSolve(PixelGrid.fromImage(source), costModel);
    }

    /**
     * Validates a drawing request and builds its cost model.
     *
     * @throws MorphException when a request precondition fails.
     */
    static CostModel prepareDrawing(DrawingRequest request) {
        if (request == null) {
            throw new MorphException(REASON_REQUEST_REQUIRED, "request must be provided");
        }
        MorphSettings settings = requireSettings(request.getSettings());
        RgbImage target = requireTarget(request.getTarget(), request.getWeights(), settings);
        LiveCanvas canvas = request.getCanvas();
        if (canvas == null) {
            throw new MorphException(REASON_CANVAS_REQUIRED, "drawing canvas must be provided");
        }
        if (canvas.sideLength() != target.width()) {
            throw new MorphException(
                    REASON_CANVAS_DIMENSION_MISMATCH,
                    "Canvas side " + canvas.sideLength() + " does not match target side " + target.width()
            );
        }
        if (request.getInitialAssignment() != null) {
            requireInitialAssignment(request.getInitialAssignment(), target.pixelCount());
        }
        return buildCostModel(target, request.getWeights(), settings);
    }

    private static MorphSettings requireSettings(MorphSettings settings) {
        if (settings == null) {
            throw new MorphException(REASON_SETTINGS_REQUIRED, "settings must be provided");
        }
        if (settings.getProximityImportance() < 0L) {
            throw new MorphException(
                    REASON_PROXIMITY_INVALID,
                    "proximityImportance must be >= 0, got " + settings.getProximityImportance()
            );
        }
        return settings;
    }

    private static RgbImage requireTarget(RgbImage target, RgbImage weights, MorphSettings settings) {
        if (target == null) {
            throw new MorphException(REASON_TARGET_REQUIRED, "target image must be provided");
        }
        if (!target.isSquare()) {
            throw new MorphException(
                    REASON_TARGET_NOT_SQUARE,
                    "Target image must be square, got " + target.width() + "x" + target.height()
            );
        }
        if (weights != null && (weights.width() != target.width() || weights.height() != target.height())) {
            throw new MorphException(
                    REASON_WEIGHTS_DIMENSION_MISMATCH,
                    "Target and weights images must have the same dimensions: target "
                            + target.width() + "x" + target.height() + ", weights "
                            + weights.width() + "x" + weights.height()
            );
        }
        if (settings.getSideLength() > 0 && settings.getSideLength() != target.width()) {
            throw new MorphException(
                    REASON_SIDE_LENGTH_MISMATCH,
                    "Working side length " + settings.getSideLength() + " does not match target side "
                            + target.width()
            );
        }
        return target;
    }

    private static CostModel buildCostModel(RgbImage target, RgbImage weights, MorphSettings settings) {
        PixelGrid targetGrid = PixelGrid.fromImage(target);
        WeightMap weightMap = weights == null
                ? WeightMap.uniform(targetGrid.size())
                : WeightMap.fromImage(weights);
        return new CostModel(targetGrid, weightMap, CostParameters.of(settings.getProximityImportance()));
    }

    private static void requireInitialAssignment(int[] assignment, int cells) {
        if (assignment.length != cells || !Assignments.isPermutation(assignment)) {
            throw new MorphException(
                    REASON_INITIAL_ASSIGNMENT_INVALID,
                    "initial assignment must be a permutation of [0, " + cells + ")"
            );
        }
    }

    /**
     * Logs contract failures escaping a background solve before they land in the future.
     */
    private static void failFast(Runnable solve) {
        try {
            solve.run();
        } catch (RuntimeException ex) {
            log.error("background solve aborted on contract violation", ex);
            throw ex;
        }
    }

    /**
     * Validated solver inputs.
     */
    record PreparedSolve(PixelGrid source, CostModel costModel) {
    }

    /**
     * Daemon worker threads so an abandoned drawing session never keeps the JVM alive.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pixelmorph-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
