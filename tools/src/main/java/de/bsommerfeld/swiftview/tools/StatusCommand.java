package de.bsommerfeld.swiftview.tools;

import de.bsommerfeld.swiftview.core.config.ReadPolicy;
import de.bsommerfeld.swiftview.db.StoreOperator;
import de.bsommerfeld.swiftview.db.migration.Migration;
import picocli.CommandLine.Command;

import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

@Command(name = "status", description = "Report schema version, pending migrations and row count")
class StatusCommand extends StoreCommand {

    private record Status(int version, List<Migration> pending, int rows) {
    }

    @Override
    int run(StoreOperator operator) {
        // Read-only: reporting must not switch the journal mode or touch the schema
        Status status = StoreOperator.await(operator.read(ReadPolicy.DIRECT, conn -> {
            int rows = 0;
            if (runner.hasThumbnailTable(conn)) {
                try (Statement st = conn.createStatement();
                        ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM thumbnails")) {
                    rows = rs.next() ? rs.getInt(1) : 0;
                }
            }
            return new Status(runner.currentVersion(conn), runner.pending(conn), rows);
        }));

        out().printf("file:    %s%n", file);
        out().printf("version: v%d (latest v%d)%n", status.version(), runner.latestVersion());
        out().printf("rows:    %d%n", status.rows());
        if (status.version() > runner.latestVersion()) {
            out().println("pending: store is newer than this tool");
        } else if (status.pending().isEmpty()) {
            out().println("pending: none");
        } else {
            out().printf("pending: %d%n", status.pending().size());
            for (Migration m : status.pending())
                out().printf("  v%d -> v%d  %s%n", m.fromVersion(), m.toVersion(), m.description());
        }
        return 0;
    }
}
