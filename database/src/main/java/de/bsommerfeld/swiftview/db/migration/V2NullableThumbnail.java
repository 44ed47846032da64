package de.bsommerfeld.swiftview.db.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * v1 to v2: makes {@code thumbnail} nullable so a row can carry metadata
 * alone, tightens {@code mtime}/{@code size} to NOT NULL and adds indexes for
 * age-based cleanup. Done by table recreate.
 *
 * <p>
 * Downgrading drops metadata-only rows.
 */
public class V2NullableThumbnail implements Migration {

    @Override
    public int fromVersion() {
        return 1;
    }

    @Override
    public String description() {
        return "nullable thumbnail, indexes on mtime and created_at";
    }

    @Override
    public void upgrade(Connection conn) throws SQLException {
        SchemaSupport.runScript(conn, "migration/v2-up");
    }

    @Override
    public void downgrade(Connection conn) throws SQLException {
        SchemaSupport.runScript(conn, "migration/v2-down");
    }
}
