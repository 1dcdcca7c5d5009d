package org.pixelmorph.assignment.local;

/**
 * Maximum per-axis distance a swap partner may lie from a grid position.
 */
@FunctionalInterface
public interface SwapRadius {

    int maxDistance(int position);

    /**
     * Same radius for every position.
     */
    static SwapRadius global(int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0, got " + maxDistance);
        }
        return position -> maxDistance;
    }
}
