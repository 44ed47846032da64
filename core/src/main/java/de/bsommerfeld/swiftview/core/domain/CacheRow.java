package de.bsommerfeld.swiftview.core.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One row of the persistent thumbnail table, modeled by what it holds rather
 * than by a nullable blob column.
 *
 * <ul>
 * <li>{@link MetaOnly}: written by the stat prefetch, or after a corrupt blob
 * was cleared. Never satisfies a thumbnail lookup.</li>
 * <li>{@link Populated}: written after a successful decode.</li>
 * </ul>
 *
 * Rows are replaced, never merged.
 */
public sealed interface CacheRow permits CacheRow.MetaOnly, CacheRow.Populated {

    String path();

    long mtimeMs();

    long size();

    /** Source image width, {@code null} if unknown. */
    Integer width();

    /** Source image height, {@code null} if unknown. */
    Integer height();

    int thumbWidth();

    int thumbHeight();

    /** Epoch milliseconds at which the row was written. */
    long createdAt();

    /**
     * A row is valid for a file iff the stored mtime and size equal the live
     * stat values and the stored thumbnail box equals the configured one.
     * Anything else is a plain miss, eligible for overwrite.
     */
    default boolean isValidFor(FileStat stat, TargetSize thumbSize) {
        return path().equals(stat.path())
                && mtimeMs() == stat.mtimeMs()
                && size() == stat.size()
                && thumbWidth() == thumbSize.width()
                && thumbHeight() == thumbSize.height();
    }

    /** Drops the thumbnail, keeping the metadata. */
    default MetaOnly withoutThumbnail() {
        return new MetaOnly(path(), mtimeMs(), size(), width(), height(), thumbWidth(), thumbHeight(), createdAt());
    }

    static MetaOnly metaOnly(FileStat stat, TargetSize thumbSize, long createdAt) {
        return new MetaOnly(stat.path(), stat.mtimeMs(), stat.size(), null, null,
                thumbSize.width(), thumbSize.height(), createdAt);
    }

    static Populated populated(FileStat stat, Integer width, Integer height, TargetSize thumbSize,
            byte[] thumbnail, long createdAt) {
        return new Populated(stat.path(), stat.mtimeMs(), stat.size(), width, height,
                thumbSize.width(), thumbSize.height(), thumbnail, createdAt);
    }

    record MetaOnly(String path, long mtimeMs, long size, Integer width, Integer height,
            int thumbWidth, int thumbHeight, long createdAt) implements CacheRow {

        public MetaOnly {
            Objects.requireNonNull(path, "path");
        }
    }

    record Populated(String path, long mtimeMs, long size, Integer width, Integer height,
            int thumbWidth, int thumbHeight, byte[] thumbnail, long createdAt) implements CacheRow {

        public Populated {
            Objects.requireNonNull(path, "path");
            if (thumbnail == null || thumbnail.length == 0)
                throw new IllegalArgumentException("Populated row requires thumbnail bytes: " + path);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Populated other))
                return false;
            return mtimeMs == other.mtimeMs && size == other.size
                    && thumbWidth == other.thumbWidth && thumbHeight == other.thumbHeight
                    && createdAt == other.createdAt
                    && path.equals(other.path)
                    && Objects.equals(width, other.width) && Objects.equals(height, other.height)
                    && Arrays.equals(thumbnail, other.thumbnail);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(path, mtimeMs, size, width, height, thumbWidth, thumbHeight, createdAt);
            return 31 * result + Arrays.hashCode(thumbnail);
        }

        @Override
        public String toString() {
            return "Populated[path=" + path + ", mtimeMs=" + mtimeMs + ", size=" + size
                    + ", source=" + width + "x" + height + ", thumb=" + thumbWidth + "x" + thumbHeight
                    + ", bytes=" + thumbnail.length + "]";
        }
    }
}
