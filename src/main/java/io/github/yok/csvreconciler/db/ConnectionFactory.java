package io.github.yok.csvreconciler.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens short-lived JDBC connections.
 *
 * <p>
 * Every write of the reconciliation (one archive insert, one upsert, the final error flush)
 * obtains its own connection and closes it afterwards.
 * </p>
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection. The caller owns and closes it.
     *
     * @return new JDBC connection
     * @throws SQLException if the connection cannot be established
     */
    Connection open() throws SQLException;
}
