package de.bsommerfeld.swiftview.core.domain;

/**
 * Approximate bounding box for a down-sampled decode. A dimension of
 * {@code 0} means "unconstrained" on that axis. The decoder preserves the
 * source aspect ratio and never upscales.
 */
public record TargetSize(int width, int height) {

    public TargetSize {
        if (width < 0 || height < 0)
            throw new IllegalArgumentException("Target size must not be negative: " + width + "x" + height);
    }

    public static TargetSize of(int width, int height) {
        return new TargetSize(width, height);
    }

    public static TargetSize width(int width) {
        return new TargetSize(width, 0);
    }

    /** True if neither axis constrains the decode. */
    public boolean isUnbounded() {
        return width == 0 && height == 0;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
