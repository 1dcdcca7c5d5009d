package org.pixelmorph.canvas;

/**
 * Drawing metadata of one canvas cell.
 *
 * @param strokeId id of the stroke that last painted the cell ({@code 0} = never painted).
 * @param lastEdited frame number of the last edit.
 */
public record PixelAge(int strokeId, int lastEdited) {

    /**
     * Frames elapsed since the last edit, clamped at {@code 0}.
     */
    public int ageAt(int frame) {
        return Math.max(0, frame - lastEdited);
    }
}
