package org.pixelmorph.engine;

import lombok.Builder;
import lombok.Value;
import org.pixelmorph.grid.RgbImage;

/**
 * Static solve request.
 *
 * <p>The source must already be resampled to the target's side length.</p>
 */
@Value
@Builder
public class MorphRequest {
    /** Source raster whose pixels get rearranged. */
    RgbImage source;
    /** Square target raster. */
    RgbImage target;
    /** Optional importance map with target dimensions; {@code null} means uniform. */
    RgbImage weights;
    /** Optional starting permutation for local search; ignored by the exact solver. */
    int[] initialAssignment;
    /** Generation settings. */
    MorphSettings settings;
}
