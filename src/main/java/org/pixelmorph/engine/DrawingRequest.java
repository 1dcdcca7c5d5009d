package org.pixelmorph.engine;

import lombok.Builder;
import lombok.Value;
import org.pixelmorph.canvas.LiveCanvas;
import org.pixelmorph.grid.RgbImage;

/**
 * Request for a continuous drawing-mode session.
 */
@Value
@Builder
public class DrawingRequest {
    /** Square target raster the canvas pixels arrange into. */
    RgbImage target;
    /** Optional importance map with target dimensions; {@code null} means uniform. */
    RgbImage weights;
    /** Live canvas acting as the source; must match the target side. */
    LiveCanvas canvas;
    /** Optional permutation to continue from; {@code null} starts at identity. */
    int[] initialAssignment;
    /** Generation settings; the algorithm field is ignored. */
    MorphSettings settings;
}
