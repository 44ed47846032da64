package de.bsommerfeld.swiftview.core.domain;

import java.util.Objects;

/**
 * Identifies a unit of decode work and its result. Two keys are equal iff
 * path, target dimensions and mode all match.
 *
 * <p>
 * {@code path} is always a normalized store key (see
 * {@link de.bsommerfeld.swiftview.core.util.PathKeys#dbKey}). Target
 * dimensions are {@code null} when the axis is unconstrained.
 */
public record CacheKey(String path, Integer targetWidth, Integer targetHeight, DecodeMode mode) {

    public CacheKey {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mode, "mode");
    }

    public static CacheKey thumbnail(String path, TargetSize size) {
        return new CacheKey(path, nullIfZero(size.width()), nullIfZero(size.height()), DecodeMode.THUMBNAIL);
    }

    public static CacheKey full(String path) {
        return new CacheKey(path, null, null, DecodeMode.FULL);
    }

    public static CacheKey full(String path, TargetSize size) {
        if (size == null || size.isUnbounded())
            return full(path);
        return new CacheKey(path, nullIfZero(size.width()), nullIfZero(size.height()), DecodeMode.FULL);
    }

    public DecodeIdentity identity() {
        return new DecodeIdentity(path, mode);
    }

    /** The requested box, or {@code null} for a full-resolution decode. */
    public TargetSize targetSize() {
        if (targetWidth == null && targetHeight == null)
            return null;
        return new TargetSize(targetWidth == null ? 0 : targetWidth, targetHeight == null ? 0 : targetHeight);
    }

    private static Integer nullIfZero(int value) {
        return value > 0 ? value : null;
    }
}
