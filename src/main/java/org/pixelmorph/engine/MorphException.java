package org.pixelmorph.engine;

import lombok.Getter;

import java.util.Objects;

/**
 * Rejected morph or drawing request.
 *
 * <p>The message always starts with the bracketed reason code, e.g.
 * {@code [MORPH_TARGET_NOT_SQUARE] Target image must be square, got 4x3}, so consumers that only
 * receive the {@code ERROR} text can still branch on it.</p>
 */
@Getter
public final class MorphException extends RuntimeException {
    /** One of the {@code REASON_*} constants on {@link MorphEngine}. */
    private final String reasonCode;

    public MorphException(String reasonCode, String message) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
