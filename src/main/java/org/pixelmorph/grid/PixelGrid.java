package org.pixelmorph.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Square working grid of pixel features.
 *
 * <p>Every cell {@code i} carries the feature {@code (x, y, rgb)} where
 * {@code x = i % sideLength}, {@code y = i / sideLength} and the color is stored packed as
 * {@code 0xRRGGBB}. Grids are rebuilt whenever their source raster changes.</p>
 */
@Accessors(fluent = true)
public final class PixelGrid {
    @Getter
    private final int sideLength;
    private final int[] colors;

    private PixelGrid(int sideLength, int[] colors) {
        this.sideLength = sideLength;
        this.colors = colors;
    }

    /**
     * Extracts grid features from a square raster.
     *
     * @throws IllegalArgumentException when the raster is not square.
     */
    public static PixelGrid fromImage(RgbImage image) {
        Objects.requireNonNull(image, "image");
        if (!image.isSquare()) {
            throw new IllegalArgumentException(
                    "grid raster must be square, got " + image.width() + "x" + image.height()
            );
        }
        int[] colors = new int[image.pixelCount()];
        for (int i = 0; i < colors.length; i++) {
            colors[i] = image.packedAt(i);
        }
        return new PixelGrid(image.width(), colors);
    }

    /**
     * Wraps a copy of packed colors for a {@code sideLength x sideLength} grid.
     */
    public static PixelGrid ofPacked(int sideLength, int[] packedColors) {
        Objects.requireNonNull(packedColors, "packedColors");
        if (sideLength <= 0) {
            throw new IllegalArgumentException("sideLength must be > 0");
        }
        if ((long) sideLength * sideLength != packedColors.length) {
            throw new IllegalArgumentException(
                    "expected " + ((long) sideLength * sideLength) + " cells, got " + packedColors.length
            );
        }
        int[] copy = new int[packedColors.length];
        for (int i = 0; i < copy.length; i++) {
            copy[i] = packedColors[i] & 0xFFFFFF;
        }
        return new PixelGrid(sideLength, copy);
    }

    public int size() {
        return colors.length;
    }

    public int x(int index) {
        return index % sideLength;
    }

    public int y(int index) {
        return index / sideLength;
    }

    public int index(int x, int y) {
        return y * sideLength + x;
    }

    public int rgb(int index) {
        return colors[index];
    }

    public int[] packedColors() {
        return colors.clone();
    }

    public RgbImage toImage() {
        return RgbImage.fromPacked(sideLength, sideLength, colors);
    }
}
