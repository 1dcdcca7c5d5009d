package org.pixelmorph.engine;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * User-facing generation settings of one solve.
 */
@Value
@Builder(toBuilder = true)
public class MorphSettings {
    public static final long DEFAULT_PROXIMITY_IMPORTANCE = 10L;

    /** Preset name echoed in the result. */
    String name;
    /** Stable preset identity. */
    UUID id;
    /** Spatial weighting of the cost model. */
    long proximityImportance;
    /** Solver to run. */
    AssignmentAlgorithm algorithm;
    /** Expected working grid side; {@code 0} accepts the target's side. */
    int sideLength;

    /**
     * Default settings: proximity {@value #DEFAULT_PROXIMITY_IMPORTANCE}, local search.
     */
    public static MorphSettings defaults(UUID id, String name) {
        return MorphSettings.builder()
                .name(name)
                .id(id)
                .proximityImportance(DEFAULT_PROXIMITY_IMPORTANCE)
                .algorithm(AssignmentAlgorithm.LOCAL_SEARCH)
                .build();
    }
}
