package org.pixelmorph.app;

import org.pixelmorph.engine.AssignmentAlgorithm;
import org.pixelmorph.engine.MorphEngine;
import org.pixelmorph.engine.MorphRequest;
import org.pixelmorph.engine.MorphSettings;
import org.pixelmorph.grid.RgbImage;
import org.pixelmorph.progress.CallbackProgressSink;
import org.pixelmorph.progress.CancellationToken;
import org.pixelmorph.progress.ProgressMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Solves a horizontally-graded source onto a vertically-graded target with both solvers
 * and logs the resulting costs. The optional first argument sets the grid side (default 24).</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    /**
     * Launches the smoke run.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int side = args.length > 0 ? Integer.parseInt(args[0]) : 24;
        RgbImage source = gradient(side, true);
        RgbImage target = gradient(side, false);

        try (MorphEngine engine = MorphEngine.builder().build()) {
            for (AssignmentAlgorithm algorithm : AssignmentAlgorithm.values()) {
                MorphSettings settings = MorphSettings.defaults(UUID.randomUUID(), "gradient-" + algorithm)
                        .toBuilder()
                        .algorithm(algorithm)
                        .build();
                MorphRequest request = MorphRequest.builder()
                        .source(source)
                        .target(target)
                        .settings(settings)
                        .build();
                engine.process(request, new CallbackProgressSink(Main::report), CancellationToken.NONE);
            }
        }
    }

    private static void report(ProgressMessage message) {
        switch (message.kind()) {
            case DONE -> log.info("{}: total cost {}", message.result().getName(), message.result().getTotalCost());
            case ERROR -> log.error("solve failed: {}", message.errorMessage());
            case CANCELLED -> log.info("solve cancelled");
            default -> log.debug("{}", message);
        }
    }

    private static RgbImage gradient(int side, boolean horizontal) {
        int[] packed = new int[side * side];
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                int level = (horizontal ? x : y) * 255 / Math.max(1, side - 1);
                packed[y * side + x] = (level << 16) | ((255 - level) << 8) | 128;
            }
        }
        return RgbImage.fromPacked(side, side, packed);
    }
}
