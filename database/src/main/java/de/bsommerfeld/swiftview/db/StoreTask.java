package de.bsommerfeld.swiftview.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed by the {@link StoreOperator} against a connection it
 * opened for this task alone. The task must not keep the connection.
 */
@FunctionalInterface
public interface StoreTask<T> {

    T execute(Connection conn) throws SQLException;
}
