package org.pixelmorph.assignment.local;

/**
 * Color lookup for source pixels, static for batch solves and snapshot-backed while drawing.
 */
@FunctionalInterface
public interface SourceColors {
    /**
     * Color of source pixel {@code sourceIndex}, packed as {@code 0xRRGGBB}.
     */
    int rgb(int sourceIndex);
}
