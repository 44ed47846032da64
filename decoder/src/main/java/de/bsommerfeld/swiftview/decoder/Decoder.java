package de.bsommerfeld.swiftview.decoder;

import de.bsommerfeld.swiftview.core.domain.PixelBuffer;
import de.bsommerfeld.swiftview.core.domain.TargetSize;

import java.nio.file.Path;

/**
 * Turns a file into displayable data. Implementations hold no shared mutable
 * state, so the same instance may be called from many threads or run inside
 * an isolated worker process.
 *
 * <p>
 * A {@code null} or unbounded {@link TargetSize} means full resolution.
 * Otherwise the result fits inside the box, keeps the source aspect ratio and
 * is never larger than the source.
 */
public interface Decoder {

    PixelBuffer decode(Path file, TargetSize target) throws DecodeException;

    /**
     * Decodes and re-encodes losslessly (PNG). Used for thumbnails, which are
     * persisted as bytes.
     */
    EncodedImage decodeToEncodedBytes(Path file, TargetSize target) throws DecodeException;

    /** Reads the image header only. */
    Dimensions readDimensions(Path file) throws DecodeException;

    /**
     * Decodes bytes previously produced by {@link #decodeToEncodedBytes}.
     * Used to verify stored thumbnails before they are served.
     */
    PixelBuffer decodeEncoded(byte[] encoded) throws DecodeException;
}
