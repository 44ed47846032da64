package de.bsommerfeld.swiftview.db;

import de.bsommerfeld.swiftview.core.domain.CacheRow;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Maps between {@code thumbnails} rows and {@link CacheRow}. A NULL or empty
 * blob reads as {@link CacheRow.MetaOnly}.
 */
final class CacheRowMapper {

    private CacheRowMapper() {
    }

    static CacheRow map(ResultSet rs) throws SQLException {
        String path = rs.getString("path");
        byte[] thumbnail = rs.getBytes("thumbnail");
        Integer width = nullableInt(rs, "width");
        Integer height = nullableInt(rs, "height");
        long mtime = rs.getLong("mtime");
        long size = rs.getLong("size");
        int thumbWidth = rs.getInt("thumb_width");
        int thumbHeight = rs.getInt("thumb_height");
        long createdAt = rs.getLong("created_at");

        if (thumbnail == null || thumbnail.length == 0)
            return new CacheRow.MetaOnly(path, mtime, size, width, height, thumbWidth, thumbHeight, createdAt);
        return new CacheRow.Populated(path, mtime, size, width, height, thumbWidth, thumbHeight, thumbnail,
                createdAt);
    }

    /** Binds all 9 columns in {@code upsert-row.sql} order. */
    static void bind(PreparedStatement ps, CacheRow row) throws SQLException {
        ps.setString(1, row.path());
        if (row instanceof CacheRow.Populated populated)
            ps.setBytes(2, populated.thumbnail());
        else
            ps.setNull(2, Types.BLOB);
        setNullableInt(ps, 3, row.width());
        setNullableInt(ps, 4, row.height());
        ps.setLong(5, row.mtimeMs());
        ps.setLong(6, row.size());
        ps.setInt(7, row.thumbWidth());
        ps.setInt(8, row.thumbHeight());
        ps.setLong(9, row.createdAt());
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null)
            ps.setNull(index, Types.INTEGER);
        else
            ps.setInt(index, value);
    }
}
