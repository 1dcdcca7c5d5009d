package org.pixelmorph.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-target-cell multiplier for the color term of the cost model.
 *
 * <p>Weights come from a grayscale importance map: the first channel value (0..255) of
 * each pixel becomes that cell's weight. Without a custom map every cell uses
 * {@link #DEFAULT_WEIGHT}.</p>
 */
public final class WeightMap {
    /** Weight of a fully white importance-map pixel, used for uniform maps. */
    public static final long DEFAULT_WEIGHT = 255L;

    private final long[] weights;

    private WeightMap(long[] weights) {
        this.weights = weights;
    }

    /**
     * Reads weights from the first channel of an importance image.
     */
    public static WeightMap fromImage(RgbImage importance) {
        Objects.requireNonNull(importance, "importance");
        long[] weights = new long[importance.pixelCount()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = importance.redAt(i);
        }
        return new WeightMap(weights);
    }

    public static WeightMap uniform(int cells) {
        return uniform(cells, DEFAULT_WEIGHT);
    }

    public static WeightMap uniform(int cells, long weight) {
        if (cells <= 0) {
            throw new IllegalArgumentException("cells must be > 0");
        }
        if (weight < 0L) {
            throw new IllegalArgumentException("weight must be >= 0, got " + weight);
        }
        long[] weights = new long[cells];
        Arrays.fill(weights, weight);
        return new WeightMap(weights);
    }

    public static WeightMap of(long[] weights) {
        Objects.requireNonNull(weights, "weights");
        for (long weight : weights) {
            if (weight < 0L) {
                throw new IllegalArgumentException("weight must be >= 0, got " + weight);
            }
        }
        return new WeightMap(weights.clone());
    }

    public int size() {
        return weights.length;
    }

    public long at(int index) {
        return weights[index];
    }
}
