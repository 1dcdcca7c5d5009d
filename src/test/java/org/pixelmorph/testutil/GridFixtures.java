package org.pixelmorph.testutil;

import org.pixelmorph.cost.CostModel;
import org.pixelmorph.cost.CostParameters;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.grid.RgbImage;
import org.pixelmorph.grid.WeightMap;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Small deterministic grids shared by solver tests.
 */
public final class GridFixtures {
    private GridFixtures() {
    }

    public static RgbImage solid(int side, int packedRgb) {
        int[] packed = new int[side * side];
        Arrays.fill(packed, packedRgb);
        return RgbImage.fromPacked(side, side, packed);
    }

    /**
     * Red channel rises left to right, green top to bottom.
     */
    public static RgbImage gradient(int side) {
        int[] packed = new int[side * side];
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                int red = x * 255 / Math.max(1, side - 1);
                int green = y * 255 / Math.max(1, side - 1);
                packed[y * side + x] = (red << 16) | (green << 8) | 64;
            }
        }
        return RgbImage.fromPacked(side, side, packed);
    }

    /**
     * Same pixels as {@link #gradient(int)} mirrored horizontally.
     */
    public static RgbImage mirroredGradient(int side) {
        RgbImage base = gradient(side);
        int[] packed = new int[side * side];
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                packed[y * side + x] = base.packedAt(y * side + (side - 1 - x));
            }
        }
        return RgbImage.fromPacked(side, side, packed);
    }

    public static RgbImage random(int side, long seed) {
        SplittableRandom random = new SplittableRandom(seed);
        int[] packed = new int[side * side];
        for (int i = 0; i < packed.length; i++) {
            packed[i] = random.nextInt(1 << 24);
        }
        return RgbImage.fromPacked(side, side, packed);
    }

    public static CostModel uniformModel(RgbImage target, long proximity) {
        PixelGrid grid = PixelGrid.fromImage(target);
        return new CostModel(grid, WeightMap.uniform(grid.size()), CostParameters.of(proximity));
    }

    /**
     * Sum of per-position costs of {@code assignment} under {@code model}.
     */
    public static long totalCost(CostModel model, PixelGrid source, int[] assignment) {
        long total = 0L;
        for (int position = 0; position < assignment.length; position++) {
            int from = assignment[position];
            total += model.costOf(from, source.rgb(from), position);
        }
        return total;
    }
}
