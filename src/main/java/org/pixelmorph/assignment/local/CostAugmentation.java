package org.pixelmorph.assignment.local;

/**
 * Extra cost term added on top of the pixel cost when a pixel is proposed for a new position.
 */
@FunctionalInterface
public interface CostAugmentation {
    /** No extra term. */
    CostAugmentation NONE = (newPosition, oldPosition, assignment) -> 0L;

    /**
     * Contribution of moving the pixel currently at {@code oldPosition} to {@code newPosition},
     * evaluated against the current (pre-swap) {@code assignment}. Must not mutate it.
     */
    long contribution(int newPosition, int oldPosition, int[] assignment);
}
