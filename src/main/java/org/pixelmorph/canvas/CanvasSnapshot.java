package org.pixelmorph.canvas;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Immutable per-generation copy of the live canvas.
 *
 * <p>Arrays are owned by the snapshot and never shared with the canvas, so a solver can
 * read them without holding any lock.</p>
 */
@Accessors(fluent = true)
public final class CanvasSnapshot {
    @Getter
    private final int sideLength;
    @Getter
    private final int frame;
    private final int[] colors;
    private final int[] strokeIds;
    private final int[] lastEdited;

    CanvasSnapshot(int sideLength, int frame, int[] colors, int[] strokeIds, int[] lastEdited) {
        this.sideLength = sideLength;
        this.frame = frame;
        this.colors = colors;
        this.strokeIds = strokeIds;
        this.lastEdited = lastEdited;
    }

    public int size() {
        return colors.length;
    }

    /**
     * Cell color packed as {@code 0xRRGGBB}.
     */
    public int rgb(int cell) {
        return colors[cell];
    }

    public int strokeId(int cell) {
        return strokeIds[cell];
    }

    public int lastEdited(int cell) {
        return lastEdited[cell];
    }

    /**
     * Frames since {@code cell} was last edited, relative to this snapshot's frame.
     */
    public int age(int cell) {
        return Math.max(0, frame - lastEdited[cell]);
    }

    public PixelAge pixelAge(int cell) {
        return new PixelAge(strokeIds[cell], lastEdited[cell]);
    }
}
