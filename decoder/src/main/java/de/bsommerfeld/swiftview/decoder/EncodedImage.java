package de.bsommerfeld.swiftview.decoder;

/**
 * PNG bytes of a down-sampled image together with the dimensions of the
 * source it was made from, so callers can persist both without a second
 * header read.
 */
public record EncodedImage(byte[] bytes, int width, int height, int sourceWidth, int sourceHeight) {

    public EncodedImage {
        if (bytes == null || bytes.length == 0)
            throw new IllegalArgumentException("Encoded image must not be empty");
    }

    @Override
    public String toString() {
        return "EncodedImage[" + width + "x" + height + " from " + sourceWidth + "x" + sourceHeight
                + ", bytes=" + bytes.length + "]";
    }
}
