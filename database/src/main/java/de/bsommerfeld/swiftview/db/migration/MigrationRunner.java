package de.bsommerfeld.swiftview.db.migration;

import de.bsommerfeld.swiftview.db.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brings a store file to the latest schema version.
 *
 * <p>
 * The version lives in SQLite's {@code PRAGMA user_version}. Steps run in
 * ascending order, each in its own transaction together with the version
 * bump, so a failing step leaves the file at the previous version and
 * nothing half-applied. Running the runner on an up-to-date store does
 * nothing.
 *
 * <p>
 * Downgrades exist for every step but only run through
 * {@link #downgrade(Connection, int)}; {@link #migrate(Connection)} never
 * goes backwards. A store with a version newer than {@link #latestVersion()}
 * is refused.
 *
 * <p>
 * The connection must be in auto-commit mode when handed in.
 */
public class MigrationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationRunner.class);

    private final List<Migration> migrations;

    public MigrationRunner() {
        this(List.of(new V1AddThumbColumns(), new V2NullableThumbnail()));
    }

    public MigrationRunner(List<Migration> migrations) {
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(Migration::fromVersion));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).fromVersion() != i)
                throw new IllegalArgumentException("Migrations must form a chain starting at 0, gap at v" + i);
        }
        this.migrations = List.copyOf(sorted);
    }

    public int latestVersion() {
        return migrations.size();
    }

    public int currentVersion(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("PRAGMA user_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /** Whether the file holds a thumbnail table at all, in any schema version. */
    public boolean hasThumbnailTable(Connection conn) throws SQLException {
        return SchemaSupport.tableExists(conn, "thumbnails");
    }

    /** Steps that {@link #migrate} would apply, in order. */
    public List<Migration> pending(Connection conn) throws SQLException {
        int current = currentVersion(conn);
        return migrations.stream().filter(m -> m.fromVersion() >= current).toList();
    }

    /**
     * Creates the baseline table on an empty file, then applies every pending
     * step.
     *
     * @throws SchemaException if a step fails or the store is newer than this
     *                         runner
     */
    public MigrationReport migrate(Connection conn) {
        int from;
        try {
            from = currentVersion(conn);
            if (from > latestVersion())
                throw new SchemaException("Store schema v" + from + " is newer than supported v" + latestVersion());
            if (from == 0 && !SchemaSupport.tableExists(conn, "thumbnails"))
                inTransaction(conn, () -> SchemaSupport.runScript(conn, "schema-v0"));
        } catch (SQLException e) {
            throw new SchemaException("Cannot read store schema: " + e.getMessage(), e);
        }

        List<Integer> applied = new ArrayList<>();
        for (Migration m : migrations) {
            if (m.fromVersion() < from)
                continue;
            try {
                inTransaction(conn, () -> {
                    m.upgrade(conn);
                    setVersion(conn, m.toVersion());
                });
            } catch (SQLException e) {
                throw new SchemaException("Migration v" + m.fromVersion() + " -> v" + m.toVersion()
                        + " (" + m.description() + ") failed: " + e.getMessage(), e);
            }
            applied.add(m.toVersion());
            LOG.info("Applied store migration v{} -> v{}: {}", m.fromVersion(), m.toVersion(), m.description());
        }
        return new MigrationReport(from, applied.isEmpty() ? from : latestVersion(), applied);
    }

    /**
     * Reverts steps down to {@code target}, newest first. Never called
     * implicitly.
     *
     * @throws SchemaException if a step fails, or the target is out of range
     */
    public MigrationReport downgrade(Connection conn, int target) {
        if (target < 0 || target > latestVersion())
            throw new SchemaException("Cannot downgrade to unknown version v" + target);

        int from;
        try {
            from = currentVersion(conn);
        } catch (SQLException e) {
            throw new SchemaException("Cannot read store schema: " + e.getMessage(), e);
        }
        if (from > latestVersion())
            throw new SchemaException("Store schema v" + from + " is newer than supported v" + latestVersion());

        List<Integer> applied = new ArrayList<>();
        for (int v = from; v > target; v--) {
            Migration m = migrations.get(v - 1);
            try {
                inTransaction(conn, () -> {
                    m.downgrade(conn);
                    setVersion(conn, m.fromVersion());
                });
            } catch (SQLException e) {
                throw new SchemaException("Downgrade v" + m.toVersion() + " -> v" + m.fromVersion()
                        + " failed: " + e.getMessage(), e);
            }
            applied.add(m.fromVersion());
            LOG.info("Reverted store migration v{} -> v{}", m.toVersion(), m.fromVersion());
        }
        return new MigrationReport(from, Math.min(from, target), applied);
    }

    private static void setVersion(Connection conn, int version) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA user_version = " + version);
        }
    }

    private static void inTransaction(Connection conn, SqlAction action) throws SQLException {
        conn.setAutoCommit(false);
        try {
            action.run();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            try {
                conn.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    @FunctionalInterface
    private interface SqlAction {
        void run() throws SQLException;
    }
}
