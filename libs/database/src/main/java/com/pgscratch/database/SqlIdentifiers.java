package com.pgscratch.database;

import com.pgscratch.database.naming.DatabaseName;
import java.sql.SQLException;
import org.postgresql.core.Utils;

/**
 * Identifier quoting for the DDL this library issues.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
        // Utility class, no instantiation
    }

    /**
     * Quotes a database name with the PostgreSQL driver's identifier rules.
     *
     * @throws SQLException if the name cannot be quoted (it contains a NUL character)
     */
    public static String quote(DatabaseName name) throws SQLException {
        return Utils.escapeIdentifier(null, name.value()).toString();
    }

    public static String createDatabase(DatabaseName name) throws SQLException {
        return "CREATE DATABASE " + quote(name);
    }

    public static String dropDatabase(DatabaseName name) throws SQLException {
        return "DROP DATABASE " + quote(name);
    }
}
