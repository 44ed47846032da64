package de.bsommerfeld.swiftview.db.migration;

import de.bsommerfeld.swiftview.db.SchemaException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MigrationRunnerTest {

    @TempDir
    Path tempDir;

    private Connection conn;
    private final MigrationRunner runner = new MigrationRunner();

    @BeforeEach
    void setUp() throws SQLException {
        conn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("thumbs.db").toAbsolutePath());
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    // -- Upgrade --

    @Test
    void migrate_freshStore_shouldCreateTableAndReachLatest() throws SQLException {
        MigrationReport report = runner.migrate(conn);

        assertEquals(0, report.fromVersion());
        assertEquals(2, report.toVersion());
        assertEquals(List.of(1, 2), report.applied());
        assertEquals(2, runner.currentVersion(conn));
        assertTrue(SchemaSupport.columns(conn, "thumbnails").containsAll(
                Set.of("path", "thumbnail", "mtime", "size", "thumb_width", "thumb_height", "created_at")));
    }

    @Test
    void migrate_twice_shouldBeNoOpTheSecondTime() throws SQLException {
        runner.migrate(conn);

        MigrationReport second = runner.migrate(conn);

        assertTrue(second.isNoOp());
        assertEquals(2, second.fromVersion());
        assertEquals(2, second.toVersion());
        assertEquals(2, runner.currentVersion(conn));
    }

    @Test
    void migrate_latestSchema_shouldAllowMetadataOnlyRows() throws SQLException {
        runner.migrate(conn);

        try (Statement st = conn.createStatement()) {
            st.execute("INSERT INTO thumbnails (path, thumbnail, mtime, size) VALUES ('/a.png', NULL, 1, 2)");
        }

        assertEquals(1, countRows());
    }

    @Test
    void migrate_legacyStore_shouldKeepRowsAndBackfillCreatedAt() throws SQLException {
        createLegacyV0Table();
        insertLegacyRow("/p/a.png", new byte[] { 1, 2, 3 });

        long before = System.currentTimeMillis();
        MigrationReport report = runner.migrate(conn);

        assertEquals(List.of(1, 2), report.applied());
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT thumbnail, thumb_width, created_at FROM thumbnails")) {
            assertTrue(rs.next());
            assertArrayEquals(new byte[] { 1, 2, 3 }, rs.getBytes(1));
            assertEquals(0, rs.getInt(2));
            assertTrue(rs.getLong(3) >= before);
        }
    }

    @Test
    void migrate_legacyStoreWithColumnsButNoVersion_shouldNotFail() throws SQLException {
        createLegacyV0Table();
        try (Statement st = conn.createStatement()) {
            st.execute("ALTER TABLE thumbnails ADD COLUMN thumb_width INTEGER NOT NULL DEFAULT 0");
        }

        MigrationReport report = runner.migrate(conn);

        assertEquals(2, report.toVersion());
    }

    @Test
    void migrate_newerStore_shouldFailWithSchemaException() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA user_version = 9");
        }

        SchemaException e = assertThrows(SchemaException.class, () -> runner.migrate(conn));
        assertTrue(e.getMessage().contains("v9"));
    }

    @Test
    void migrate_failingStep_shouldRollBackAndKeepPreviousVersion() throws SQLException {
        Migration broken = new Migration() {
            @Override
            public int fromVersion() {
                return 1;
            }

            @Override
            public String description() {
                return "broken";
            }

            @Override
            public void upgrade(Connection c) throws SQLException {
                try (Statement st = c.createStatement()) {
                    st.execute("CREATE TABLE half_done (x INTEGER)");
                    st.execute("THIS IS NOT SQL");
                }
            }

            @Override
            public void downgrade(Connection c) {
            }
        };
        MigrationRunner failing = new MigrationRunner(List.of(new V1AddThumbColumns(), broken));

        SchemaException e = assertThrows(SchemaException.class, () -> failing.migrate(conn));

        assertTrue(e.getMessage().contains("broken"));
        assertEquals(1, failing.currentVersion(conn));
        assertFalse(SchemaSupport.tableExists(conn, "half_done"));
        assertTrue(conn.getAutoCommit());
    }

    @Test
    void pending_shouldListRemainingSteps() throws SQLException {
        createLegacyV0Table();
        assertEquals(2, runner.pending(conn).size());

        runner.migrate(conn);

        assertTrue(runner.pending(conn).isEmpty());
    }

    @Test
    void constructor_shouldRejectGapsInChain() {
        assertThrows(IllegalArgumentException.class, () -> new MigrationRunner(List.of(new V2NullableThumbnail())));
    }

    // -- Downgrade --

    @Test
    void downgrade_toZero_shouldRemoveAddedColumnsAndMetadataRows() throws SQLException {
        runner.migrate(conn);
        insertRow("/p/populated.png", new byte[] { 7, 7 });
        insertRow("/p/meta.png", null);

        MigrationReport report = runner.downgrade(conn, 0);

        assertEquals(List.of(1, 0), report.applied());
        assertEquals(0, runner.currentVersion(conn));
        Set<String> columns = SchemaSupport.columns(conn, "thumbnails");
        assertFalse(columns.contains("thumb_width"));
        assertFalse(columns.contains("created_at"));
        assertEquals(1, countRows());
    }

    @Test
    void downgradeThenMigrate_shouldPreservePopulatedRows() throws SQLException {
        runner.migrate(conn);
        insertRow("/p/a.png", new byte[] { 4, 5, 6 });

        runner.downgrade(conn, 0);
        runner.migrate(conn);

        assertEquals(2, runner.currentVersion(conn));
        try (PreparedStatement ps = conn.prepareStatement("SELECT thumbnail FROM thumbnails WHERE path = ?")) {
            ps.setString(1, "/p/a.png");
            try (ResultSet rs = ps.executeQuery()) {
                assertTrue(rs.next());
                assertArrayEquals(new byte[] { 4, 5, 6 }, rs.getBytes(1));
            }
        }
    }

    @Test
    void downgrade_toCurrentVersion_shouldDoNothing() throws SQLException {
        runner.migrate(conn);

        MigrationReport report = runner.downgrade(conn, 2);

        assertTrue(report.isNoOp());
        assertEquals(2, runner.currentVersion(conn));
    }

    @Test
    void downgrade_unknownTarget_shouldFail() {
        assertThrows(SchemaException.class, () -> runner.downgrade(conn, 5));
        assertThrows(SchemaException.class, () -> runner.downgrade(conn, -1));
    }

    // -- Helpers --

    private void createLegacyV0Table() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE thumbnails (path TEXT PRIMARY KEY, thumbnail BLOB NOT NULL, "
                    + "width INTEGER, height INTEGER, mtime INTEGER, size INTEGER)");
        }
    }

    private void insertLegacyRow(String path, byte[] thumbnail) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO thumbnails (path, thumbnail, width, height, mtime, size) VALUES (?, ?, 10, 10, 1, 2)")) {
            ps.setString(1, path);
            ps.setBytes(2, thumbnail);
            ps.executeUpdate();
        }
    }

    private void insertRow(String path, byte[] thumbnail) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO thumbnails "
                + "(path, thumbnail, width, height, mtime, size, thumb_width, thumb_height, created_at) "
                + "VALUES (?, ?, 10, 10, 1, 2, 256, 195, 3)")) {
            ps.setString(1, path);
            ps.setBytes(2, thumbnail);
            ps.executeUpdate();
        }
    }

    private int countRows() throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM thumbnails")) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
