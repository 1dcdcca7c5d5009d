package org.pixelmorph.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Interleaved 8-bit RGB raster exchanged with callers outside the engine.
 *
 * <p>Buffer layout is row-major, three bytes per pixel ({@code r, g, b}). Instances are
 * immutable: the backing buffer is copied on construction and on {@link #data()}.</p>
 */
@Accessors(fluent = true)
public final class RgbImage {
    @Getter
    private final int width;
    @Getter
    private final int height;
    private final byte[] data;

    private RgbImage(int width, int height, byte[] data) {
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Wraps a copy of an interleaved RGB buffer.
     *
     * @param width raster width in pixels.
     * @param height raster height in pixels.
     * @param data interleaved RGB bytes, exactly {@code 3 * width * height} long.
     * @return immutable image.
     * @throws IllegalArgumentException when dimensions or buffer length are invalid.
     */
    public static RgbImage of(int width, int height, byte[] data) {
        Objects.requireNonNull(data, "data");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image dimensions must be > 0, got " + width + "x" + height);
        }
        long expected = 3L * width * height;
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "RGB buffer length mismatch: expected " + expected + " bytes, got " + data.length
            );
        }
        return new RgbImage(width, height, data.clone());
    }

    /**
     * Builds an image from packed {@code 0xRRGGBB} pixels.
     */
    public static RgbImage fromPacked(int width, int height, int[] packed) {
        Objects.requireNonNull(packed, "packed");
        if ((long) width * height != packed.length) {
            throw new IllegalArgumentException(
                    "packed pixel count mismatch: expected " + ((long) width * height) + ", got " + packed.length
            );
        }
        byte[] out = new byte[packed.length * 3];
        for (int i = 0; i < packed.length; i++) {
            int rgb = packed[i];
            out[3 * i] = (byte) ((rgb >>> 16) & 0xFF);
            out[3 * i + 1] = (byte) ((rgb >>> 8) & 0xFF);
            out[3 * i + 2] = (byte) (rgb & 0xFF);
        }
        return new RgbImage(width, height, out);
    }

    public boolean isSquare() {
        return width == height;
    }

    public int pixelCount() {
        return width * height;
    }

    /**
     * Returns pixel {@code index} packed as {@code 0xRRGGBB}.
     */
    public int packedAt(int index) {
        if (index < 0 || index >= pixelCount()) {
            throw new IndexOutOfBoundsException("pixel index out of bounds: " + index);
        }
        int base = index * 3;
        return ((data[base] & 0xFF) << 16) | ((data[base + 1] & 0xFF) << 8) | (data[base + 2] & 0xFF);
    }

    /**
     * Returns first-channel intensity of pixel {@code index} (0..255).
     */
    public int redAt(int index) {
        return (packedAt(index) >>> 16) & 0xFF;
    }

    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RgbImage)) {
            return false;
        }
        RgbImage other = (RgbImage) o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RgbImage{" + width + "x" + height + "}";
    }
}
