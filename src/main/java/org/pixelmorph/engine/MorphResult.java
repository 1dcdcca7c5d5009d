package org.pixelmorph.engine;

import lombok.Builder;
import lombok.Value;
import org.pixelmorph.grid.RgbImage;

import java.util.Objects;

/**
 * Final output of a completed static solve.
 *
 * <p>Consumers map each grid index {@code i} to the pair
 * {@code (source position of assignments[i], position i)}.</p>
 */
@Value
public class MorphResult {
    /** Preset name from the request settings. */
    String name;
    /** Source raster at working-grid resolution. */
    RgbImage source;
    /** Final permutation, {@code assignments[target] = source}. */
    int[] assignments;
    /** Summed cost of the permutation. */
    long totalCost;
    /** Solver that produced the permutation. */
    AssignmentAlgorithm algorithm;

    @Builder
    private MorphResult(String name, RgbImage source, int[] assignments, long totalCost, AssignmentAlgorithm algorithm) {
        this.name = name;
        this.source = source;
        this.assignments = Objects.requireNonNull(assignments, "assignments").clone();
        this.totalCost = totalCost;
        this.algorithm = algorithm;
    }

    public int[] getAssignments() {
        return assignments.clone();
    }
}
