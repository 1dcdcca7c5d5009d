package org.pixelmorph.assignment;

import lombok.experimental.UtilityClass;
import org.pixelmorph.grid.PixelGrid;
import org.pixelmorph.grid.RgbImage;

import java.util.Objects;

/**
 * Rebuilds the image a consumer would see when every target cell shows its assigned source pixel.
 */
@UtilityClass
public class PreviewRenderer {

    /**
     * Renders {@code assignment} over {@code source}.
     *
     * <p>The assignment may be partial during an exact solve; callers substitute source
     * index {@code 0} for unmatched cells before rendering.</p>
     */
    public RgbImage render(PixelGrid source, int[] assignment) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(assignment, "assignment");
        if (assignment.length != source.size()) {
            throw new IllegalArgumentException(
                    "assignment length " + assignment.length + " does not match grid size " + source.size()
            );
        }
        int[] packed = new int[assignment.length];
        for (int target = 0; target < assignment.length; target++) {
            packed[target] = source.rgb(assignment[target]);
        }
        return RgbImage.fromPacked(source.sideLength(), source.sideLength(), packed);
    }
}
