package de.bsommerfeld.swiftview.db.migration;

import de.bsommerfeld.swiftview.db.SqlLoader;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/** Small helpers shared by migration steps. */
final class SchemaSupport {

    private SchemaSupport() {
    }

    static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next())
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
        }
        return columns;
    }

    static boolean tableExists(Connection conn, String table) throws SQLException {
        try (var ps = conn.prepareStatement("SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    static void runScript(Connection conn, String name) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : SqlLoader.statements(name))
                st.execute(sql);
        }
    }
}
