package de.bsommerfeld.swiftview.db.migration;

import de.bsommerfeld.swiftview.db.SqlLoader;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * v0 to v1: records the thumbnail box each row was rendered for, and when it
 * was written. Existing rows get box {@code 0x0}, which never matches a
 * configured size, so they are regenerated on first use.
 */
public class V1AddThumbColumns implements Migration {

    private static final Map<String, String> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("thumb_width", "migration/v1-add-thumb-width");
        COLUMNS.put("thumb_height", "migration/v1-add-thumb-height");
        COLUMNS.put("created_at", "migration/v1-add-created-at");
    }

    @Override
    public int fromVersion() {
        return 0;
    }

    @Override
    public String description() {
        return "add thumb_width, thumb_height, created_at";
    }

    @Override
    public void upgrade(Connection conn) throws SQLException {
        // Columns may already exist if an older build added them without bumping the version
        Set<String> existing = SchemaSupport.columns(conn, "thumbnails");
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> column : COLUMNS.entrySet()) {
                if (!existing.contains(column.getKey()))
                    st.execute(SqlLoader.load(column.getValue()));
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("migration/v1-backfill-created-at"))) {
            ps.setLong(1, System.currentTimeMillis());
            ps.executeUpdate();
        }
    }

    @Override
    public void downgrade(Connection conn) throws SQLException {
        Set<String> existing = SchemaSupport.columns(conn, "thumbnails");
        if (COLUMNS.keySet().stream().noneMatch(existing::contains))
            return;
        SchemaSupport.runScript(conn, "migration/v1-down");
    }
}
