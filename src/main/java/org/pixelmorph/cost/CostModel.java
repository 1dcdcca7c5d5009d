package org.pixelmorph.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.grid.WeightMap;

import java.util.Objects;

/**
 * Dissimilarity score of placing a source pixel on a target cell.
 * <p>
 * Canonical cost:
 * </p>
 * <pre>
 * color_sq   = (r1-r2)^2 + (g1-g2)^2 + (b1-b2)^2
 * spatial_sq = (x1-x2)^2 + (y1-y2)^2
 * cost       = color_sq * weight + (spatial_sq * proximity_importance)^2
 * </pre>
 * <p>
 * Lower is better and {@code 0} is a perfect match. The spatial term is squared after
 * weighting, so displacement grows quartically and dominates color mismatch for far moves.
 * All arithmetic is 64-bit.
 * </p>
 */
@Accessors(fluent = true)
public final class CostModel {

    @Getter
    private final PixelGrid target;
    @Getter
    private final WeightMap weights;
    @Getter
    private final CostParameters parameters;
    private final long proximityImportance;

    /**
     * Binds the model to one target grid and its importance weights.
     */
    public CostModel(PixelGrid target, WeightMap weights, CostParameters parameters) {
        this.target = Objects.requireNonNull(target, "target");
        this.weights = Objects.requireNonNull(weights, "weights");
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        if (weights.size() != target.size()) {
            throw new IllegalArgumentException(
                    "weights size " + weights.size() + " does not match target size " + target.size()
            );
        }
        this.proximityImportance = parameters.getProximityImportance();
    }

    /**
     * Scores a source pixel, originally at {@code sourceIndex} with color {@code sourceRgb},
     * against target cell {@code targetIndex}.
     */
    public long costOf(int sourceIndex, int sourceRgb, int targetIndex) {
        int side = target.sideLength();
        return cost(
                sourceIndex % side,
                sourceIndex / side,
                sourceRgb,
                targetIndex % side,
                targetIndex / side,
                target.rgb(targetIndex),
                weights.at(targetIndex),
                proximityImportance
        );
    }

    /**
     * Explainable variant of {@link #costOf(int, int, int)} for diagnostics and tests.
     */
    public CostBreakdown explain(int sourceIndex, int sourceRgb, int targetIndex) {
        int side = target.sideLength();
        int sx = sourceIndex % side;
        int sy = sourceIndex / side;
        int tx = targetIndex % side;
        int ty = targetIndex / side;
        long colorSq = colorSqDistance(sourceRgb, target.rgb(targetIndex));
        long spatialSq = spatialSqDistance(sx, sy, tx, ty);
        long weight = weights.at(targetIndex);
        long colorTerm = colorSq * weight;
        long scaledSpatial = spatialSq * proximityImportance;
        long spatialTerm = scaledSpatial * scaledSpatial;
        return new CostBreakdown(
                sourceIndex,
                targetIndex,
                colorSq,
                spatialSq,
                weight,
                colorTerm,
                spatialTerm,
                colorTerm + spatialTerm
        );
    }

    /**
     * Allocation-free scalar kernel shared by every solver.
     */
    public static long cost(
            int sourceX,
            int sourceY,
            int sourceRgb,
            int targetX,
            int targetY,
            int targetRgb,
            long colorWeight,
            long proximityImportance
    ) {
        long scaledSpatial = spatialSqDistance(sourceX, sourceY, targetX, targetY) * proximityImportance;
        return colorSqDistance(sourceRgb, targetRgb) * colorWeight + scaledSpatial * scaledSpatial;
    }

    /**
     * Sum of squared per-channel differences of two packed {@code 0xRRGGBB} colors.
     */
    public static long colorSqDistance(int rgbA, int rgbB) {
        long dr = ((rgbA >>> 16) & 0xFF) - ((rgbB >>> 16) & 0xFF);
        long dg = ((rgbA >>> 8) & 0xFF) - ((rgbB >>> 8) & 0xFF);
        long db = (rgbA & 0xFF) - (rgbB & 0xFF);
        return dr * dr + dg * dg + db * db;
    }

    /**
     * Squared Euclidean distance in grid coordinates.
     */
    public static long spatialSqDistance(int ax, int ay, int bx, int by) {
        long dx = ax - bx;
        long dy = ay - by;
        return dx * dx + dy * dy;
    }

    /**
     * Immutable explainability payload.
     */
    public record CostBreakdown(
            int sourceIndex,
            int targetIndex,
            long colorSqDistance,
            long spatialSqDistance,
            long weight,
            long colorTerm,
            long spatialTerm,
            long total
    ) {
        /**
         * Returns whether displacement outweighs color mismatch for this placement.
         */
        public boolean spatiallyDominated() {
            return spatialTerm > colorTerm;
        }
    }
}
