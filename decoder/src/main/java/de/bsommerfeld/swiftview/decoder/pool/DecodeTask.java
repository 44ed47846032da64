package de.bsommerfeld.swiftview.decoder.pool;

import de.bsommerfeld.swiftview.core.domain.CacheKey;
import de.bsommerfeld.swiftview.core.domain.DecodeError;
import de.bsommerfeld.swiftview.core.domain.DecodeMode;
import de.bsommerfeld.swiftview.core.domain.TargetSize;
import de.bsommerfeld.swiftview.core.util.PathKeys;
import de.bsommerfeld.swiftview.decoder.DecodeException;
import de.bsommerfeld.swiftview.decoder.Decoder;

import java.util.Objects;

/**
 * One unit of decode work. Primitive data only, so it can be written to a
 * worker process as is.
 *
 * @param path   store key of the file
 * @param mode   what to produce
 * @param target box to fit, {@code null} for full resolution
 */
public record DecodeTask(String path, DecodeMode mode, TargetSize target) {

    public DecodeTask {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mode, "mode");
    }

    public static DecodeTask of(CacheKey key) {
        return new DecodeTask(key.path(), key.mode(), key.targetSize());
    }

    /**
     * Runs the task on the given decoder. Decode failures become
     * {@link DecodeResult.Failed}; anything else escapes.
     */
    public DecodeResult runWith(Decoder decoder) {
        try {
            if (mode == DecodeMode.THUMBNAIL)
                return new DecodeResult.Encoded(decoder.decodeToEncodedBytes(PathKeys.toPath(path), target));
            return new DecodeResult.Pixels(decoder.decode(PathKeys.toPath(path), target));
        } catch (DecodeException e) {
            return new DecodeResult.Failed(e.getError());
        } catch (RuntimeException e) {
            return new DecodeResult.Failed(DecodeError.of(DecodeError.Kind.INTERNAL,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
}
