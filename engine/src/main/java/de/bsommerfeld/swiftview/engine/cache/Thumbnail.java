package de.bsommerfeld.swiftview.engine.cache;

import de.bsommerfeld.swiftview.core.domain.CacheRow;
import de.bsommerfeld.swiftview.decoder.EncodedImage;

/**
 * Encoded thumbnail as handed to consumers.
 *
 * @param path         store key of the source file
 * @param bytes        PNG data
 * @param sourceWidth  width of the source image, {@code null} if unknown
 * @param sourceHeight height of the source image, {@code null} if unknown
 */
public record Thumbnail(String path, byte[] bytes, Integer sourceWidth, Integer sourceHeight) {

    public static Thumbnail of(CacheRow.Populated row) {
        return new Thumbnail(row.path(), row.thumbnail(), row.width(), row.height());
    }

    public static Thumbnail of(String path, EncodedImage image) {
        return new Thumbnail(path, image.bytes(), image.sourceWidth(), image.sourceHeight());
    }

    @Override
    public String toString() {
        return "Thumbnail[path=" + path + ", bytes=" + bytes.length + "]";
    }
}
