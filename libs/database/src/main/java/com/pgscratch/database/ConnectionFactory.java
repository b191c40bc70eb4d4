package com.pgscratch.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections by URL.
 * <p>
 * Used for the administrative connection, for each background drop, and for the connection
 * handed to the test. Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens a new connection. The caller owns it and must close it.
     *
     * @param jdbcUrl target database URL
     * @throws SQLException if the database cannot be reached
     */
    Connection open(String jdbcUrl) throws SQLException;
}
