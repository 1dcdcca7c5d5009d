package org.pixelmorph.assignment.local;

import org.pixelmorph.canvas.CanvasSnapshot;

import java.util.Objects;

/**
 * Per-cell swap radius that shrinks as a cell ages.
 *
 * <pre>
 * maxDist(age) = round((S / 4) * 0.99^(age / 30))     (integer division in both quotients)
 * </pre>
 * <p>
 * Freshly edited cells reach a quarter of the canvas; settled cells only swap locally.
 * </p>
 */
public final class AgeSwapRadius implements SwapRadius {
    static final float DECAY_PER_STEP = 0.99f;
    static final int FRAMES_PER_STEP = 30;

    private final CanvasSnapshot snapshot;
    private final int sideLength;

    public AgeSwapRadius(CanvasSnapshot snapshot) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.sideLength = snapshot.sideLength();
    }

    @Override
    public int maxDistance(int position) {
        return maxDistanceForAge(sideLength, snapshot.age(position));
    }

    /**
     * Radius for a cell last edited {@code age} frames ago on a {@code sideLength} grid.
     */
    public static int maxDistanceForAge(int sideLength, int age) {
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0, got " + age);
        }
        float decay = (float) Math.pow(DECAY_PER_STEP, age / FRAMES_PER_STEP);
        return Math.round((sideLength / 4) * decay);
    }
}
