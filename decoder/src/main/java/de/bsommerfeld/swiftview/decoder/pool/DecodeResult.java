package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.decoder.EncodedImage;

/**
 * Outcome of a {@link DecodeTask}. Errors are values here; nothing is thrown
 * across the pool boundary.
 */
public sealed interface DecodeResult permits DecodeResult.Pixels, DecodeResult.Encoded, DecodeResult.Failed {

    default boolean isSuccess() {
        return !(this instanceof Failed);
    }

    /** Full or boxed decode for display. */
    record Pixels(PixelBuffer pixels) implements DecodeResult {
    }

    /** Thumbnail bytes plus source dimensions. */
    record Encoded(EncodedImage image) implements DecodeResult {
    }

    record Failed(DecodeError error) implements DecodeResult {
    }
}
