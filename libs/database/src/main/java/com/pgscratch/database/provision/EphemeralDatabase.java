package com.pgscratch.database.provision;

import com.pgscratch.database.naming.DatabaseName;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * A freshly provisioned database and the live connection to it.
 * <p>
 * Closing releases the connection only. The database itself outlives the test and is dropped by
 * a later garbage collection pass once it ages past the retention window.
 *
 * @param name       the generated database name
 * @param jdbcUrl    URL of the new database
 * @param connection open connection, owned by the caller
 */
public record EphemeralDatabase(DatabaseName name, String jdbcUrl, Connection connection)
        implements AutoCloseable {

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
