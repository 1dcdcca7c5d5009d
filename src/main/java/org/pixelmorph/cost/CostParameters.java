package org.pixelmorph.cost;

import lombok.Value;

/**
 * Tunables of the pixel cost model.
 */
@Value
public class CostParameters {
    /** Scales the spatial term; larger values favor spatially local matches. */
    long proximityImportance;

    /**
     * Creates cost parameters.
     *
     * @param proximityImportance spatial weighting, must be {@code >= 0}.
     */
    public static CostParameters of(long proximityImportance) {
        if (proximityImportance < 0L) {
            throw new IllegalArgumentException("proximityImportance must be >= 0, got " + proximityImportance);
        }
        return new CostParameters(proximityImportance);
    }
}
