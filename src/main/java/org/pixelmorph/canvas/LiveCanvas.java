package org.pixelmorph.canvas;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.pixelmorph.grid.RgbImage;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared drawing canvas: live cell colors plus per-cell {@link PixelAge}.
 *
 * <ul>
 * <li>The UI thread is the writer: it paints cells and advances the frame counter.</li>
 * <li>Solvers only call {@link #snapshot()}, which holds the read lock just long enough to
 * copy state; no computation happens under the lock.</li>
 * </ul>
 * <p>
 * Colors are stored as RGB floats in {@code [0, 1]} and quantized to bytes as
 * {@code (int) (c * 256)} saturated to {@code [0, 255]} when snapshotted.
 * </p>
 */
@Accessors(fluent = true)
public final class LiveCanvas {
    @Getter
    private final int sideLength;
    private final float[] rgb;
    private final int[] strokeIds;
    private final int[] lastEdited;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger strokeCounter = new AtomicInteger();
    private int frame;

    /**
     * Creates a canvas initialized from {@code initial}; every cell starts on stroke {@code 0},
     * edited at frame {@code 0}.
     */
    public LiveCanvas(RgbImage initial) {
        Objects.requireNonNull(initial, "initial");
        if (!initial.isSquare()) {
            throw new IllegalArgumentException(
                    "canvas must be square, got " + initial.width() + "x" + initial.height()
            );
        }
        this.sideLength = initial.width();
        int cells = initial.pixelCount();
        this.rgb = new float[cells * 3];
        this.strokeIds = new int[cells];
        this.lastEdited = new int[cells];
        for (int i = 0; i < cells; i++) {
            int packed = initial.packedAt(i);
            rgb[3 * i] = ((packed >>> 16) & 0xFF) / 255.0f;
            rgb[3 * i + 1] = ((packed >>> 8) & 0xFF) / 255.0f;
            rgb[3 * i + 2] = (packed & 0xFF) / 255.0f;
        }
    }

    public int size() {
        return strokeIds.length;
    }

    /**
     * Allocates the id for a new continuous pointer drag.
     */
    public int beginStroke() {
        return strokeCounter.incrementAndGet();
    }

    /**
     * Returns the id of the stroke in progress ({@code 0} before any stroke began).
     */
    public int currentStroke() {
        return strokeCounter.get();
    }

    /**
     * Advances the frame clock used to age cells.
     *
     * @return the new frame number.
     */
    public int advanceFrame() {
        lock.writeLock().lock();
        try {
            return ++frame;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int frame() {
        lock.readLock().lock();
        try {
            return frame;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Blends {@code color} into {@code cell} with opacity {@code alpha} and stamps the cell with
     * {@code strokeId} at the current frame.
     *
     * @param cell canvas cell index.
     * @param red red channel in {@code [0, 1]}.
     * @param green green channel in {@code [0, 1]}.
     * @param blue blue channel in {@code [0, 1]}.
     * @param alpha blend factor in {@code [0, 1]}.
     * @param strokeId stroke performing the edit.
     */
    public void paint(int cell, float red, float green, float blue, float alpha, int strokeId) {
        validateCell(cell);
        if (!(alpha >= 0.0f && alpha <= 1.0f)) {
            throw new IllegalArgumentException("alpha must be in [0, 1], got " + alpha);
        }
        lock.writeLock().lock();
        try {
            int base = 3 * cell;
            rgb[base] = blend(rgb[base], red, alpha);
            rgb[base + 1] = blend(rgb[base + 1], green, alpha);
            rgb[base + 2] = blend(rgb[base + 2], blue, alpha);
            strokeIds[cell] = strokeId;
            lastEdited[cell] = frame;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks every cell as stroke {@code 0} edited at the current frame, keeping colors.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            Arrays.fill(strokeIds, 0);
            Arrays.fill(lastEdited, frame);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Copies colors and ages under the read lock.
     */
    public CanvasSnapshot snapshot() {
        float[] rgbCopy;
        int[] strokeCopy;
        int[] editedCopy;
        int frameCopy;
        lock.readLock().lock();
        try {
            rgbCopy = rgb.clone();
            strokeCopy = strokeIds.clone();
            editedCopy = lastEdited.clone();
            frameCopy = frame;
        } finally {
            lock.readLock().unlock();
        }
        int[] colors = new int[strokeCopy.length];
        for (int i = 0; i < colors.length; i++) {
            colors[i] = (toChannel(rgbCopy[3 * i]) << 16)
                    | (toChannel(rgbCopy[3 * i + 1]) << 8)
                    | toChannel(rgbCopy[3 * i + 2]);
        }
        return new CanvasSnapshot(sideLength, frameCopy, colors, strokeCopy, editedCopy);
    }

    static int toChannel(float value) {
        float scaled = value * 256.0f;
        if (!(scaled > 0.0f)) {
            return 0;
        }
        return scaled >= 255.0f ? 255 : (int) scaled;
    }

    private static float blend(float current, float target, float alpha) {
        return (1.0f - alpha) * current + alpha * target;
    }

    private void validateCell(int cell) {
        if (cell < 0 || cell >= strokeIds.length) {
            throw new IndexOutOfBoundsException("cell out of range: " + cell + " [0, " + strokeIds.length + ")");
        }
    }
}
