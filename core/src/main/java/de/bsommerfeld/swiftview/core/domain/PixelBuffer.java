package de.bsommerfeld.swiftview.core.domain;

/**
 * Decoded RGB pixels, one packed {@code 0xFFRRGGBB} int per pixel in
 * row-major order. Alpha is flattened against black by the decoder.
 *
 * <p>
 * Plain primitives only, so the buffer can cross the decode worker's process
 * boundary unchanged.
 */
public record PixelBuffer(int width, int height, int[] pixels) {

    public PixelBuffer {
        if (width <= 0 || height <= 0)
            throw new IllegalArgumentException("Invalid dimensions: " + width + "x" + height);
        if (pixels.length != width * height)
            throw new IllegalArgumentException(
                    "Pixel count " + pixels.length + " does not match " + width + "x" + height);
    }

    public int pixelAt(int x, int y) {
        return pixels[y * width + x];
    }

    public long byteSize() {
        return (long) pixels.length * Integer.BYTES;
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
