package org.pixelmorph.progress;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.pixelmorph.engine.MorphResult;
import org.pixelmorph.grid.RgbImage;

import java.util.Objects;

/**
 * One-directional message from a running solve to its consumer.
 *
 * <p>Payload fields not relevant to a message {@link Kind} are {@code null} (or {@code NaN}
 * for {@link #fraction()}).</p>
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@Accessors(fluent = true)
public final class ProgressMessage {

    /**
     * Message discriminator with a stable wire name.
     */
    public enum Kind {
        PROGRESS("progress"),
        UPDATE_PREVIEW("update_preview"),
        UPDATE_ASSIGNMENTS("update_assignments"),
        DONE("done"),
        ERROR("error"),
        CANCELLED("cancelled");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        /**
         * Returns whether no further messages follow this one for the same solve.
         */
        public boolean terminal() {
            return this == DONE || this == ERROR || this == CANCELLED;
        }
    }

    private static final ProgressMessage CANCELLED_MESSAGE =
            new ProgressMessage(Kind.CANCELLED, Float.NaN, null, null, null, null);

    private final Kind kind;
    private final float fraction;
    private final RgbImage preview;
    private final int[] assignments;
    private final MorphResult result;
    private final String errorMessage;

    public static ProgressMessage progress(float fraction) {
        if (!Float.isFinite(fraction)) {
            throw new IllegalArgumentException("fraction must be finite, got " + fraction);
        }
        return new ProgressMessage(Kind.PROGRESS, fraction, null, null, null, null);
    }

    public static ProgressMessage preview(RgbImage image) {
        return new ProgressMessage(Kind.UPDATE_PREVIEW, Float.NaN, Objects.requireNonNull(image, "image"), null, null, null);
    }

    /**
     * Publishes a copy of the given permutation.
     */
    public static ProgressMessage assignments(int[] assignments) {
        Objects.requireNonNull(assignments, "assignments");
        return new ProgressMessage(Kind.UPDATE_ASSIGNMENTS, Float.NaN, null, assignments.clone(), null, null);
    }

    public static ProgressMessage done(MorphResult result) {
        return new ProgressMessage(Kind.DONE, Float.NaN, null, null, Objects.requireNonNull(result, "result"), null);
    }

    public static ProgressMessage error(String message) {
        return new ProgressMessage(Kind.ERROR, Float.NaN, null, null, null, Objects.requireNonNull(message, "message"));
    }

    public static ProgressMessage cancelled() {
        return CANCELLED_MESSAGE;
    }

    /**
     * Stable wire name of this message kind.
     */
    public String typ() {
        return kind.wireName();
    }

    public int[] assignments() {
        return assignments == null ? null : assignments.clone();
    }

    @Override
    public String toString() {
        return switch (kind) {
            case PROGRESS -> "ProgressMessage{progress " + fraction + "}";
            case UPDATE_PREVIEW -> "ProgressMessage{update_preview " + preview + "}";
            case UPDATE_ASSIGNMENTS -> "ProgressMessage{update_assignments n=" + assignments.length + "}";
            case DONE -> "ProgressMessage{done " + result.getName() + "}";
            case ERROR -> "ProgressMessage{error " + errorMessage + "}";
            case CANCELLED -> "ProgressMessage{cancelled}";
        };
    }
}
