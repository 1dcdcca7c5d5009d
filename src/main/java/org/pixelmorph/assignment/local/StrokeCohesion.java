package org.pixelmorph.assignment.local;

import org.pixelmorph.canvas.CanvasSnapshot;

import java.util.Objects;

/**
 * Drawing-mode reward for keeping a stroke's pixels next to each other.
 *
 * <p>Moving a pixel into a position whose 4-neighborhood already holds a pixel of the same
 * stroke contributes {@link #STROKE_REWARD}. The reward dwarfs any pixel cost, so it acts as a
 * hard preference for contiguous strokes.</p>
 */
public final class StrokeCohesion implements CostAugmentation {
    public static final long STROKE_REWARD = -10_000_000_000L;

    private static final int[] NEIGHBOR_DX = {0, -1, 1, 0};
    private static final int[] NEIGHBOR_DY = {-1, 0, 0, 1};

    private final CanvasSnapshot snapshot;
    private final int sideLength;

    /**
     * Binds the reward to one generation's stroke metadata (indexed by source cell).
     */
    public StrokeCohesion(CanvasSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.sideLength = snapshot.sideLength();
    }

    @Override
    public long contribution(int newPosition, int oldPosition, int[] assignment) {
        int strokeId = snapshot.strokeId(assignment[oldPosition]);
        int x = newPosition % sideLength;
        int y = newPosition / sideLength;
        for (int i = 0; i < NEIGHBOR_DX.length; i++) {
            int nx = x + NEIGHBOR_DX[i];
            int ny = y + NEIGHBOR_DY[i];
            if (nx < 0 || nx >= sideLength || ny < 0 || ny >= sideLength) {
                continue;
            }
            if (snapshot.strokeId(assignment[ny * sideLength + nx]) == strokeId) {
                return STROKE_REWARD;
            }
        }
        return 0L;
    }
}
