package de.bsommerfeld.swiftview.db.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One schema step from {@link #fromVersion()} to {@code fromVersion() + 1}.
 * Both directions run inside a transaction owned by the
 * {@link MigrationRunner}; implementations must not commit.
 */
public interface Migration {

    int fromVersion();

    default int toVersion() {
        return fromVersion() + 1;
    }

    String description();

    void upgrade(Connection conn) throws SQLException;

    void downgrade(Connection conn) throws SQLException;
}
