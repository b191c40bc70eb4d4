package com.pgscratch.database;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}. Every call opens a fresh physical
 * connection; nothing is pooled.
 */
public final class DriverManagerConnectionFactory implements ConnectionFactory {

    private final String username;
    private final String password;

    /** Creates a factory that relies on credentials in the URL or the driver's defaults. */
    public DriverManagerConnectionFactory() {
        this(null, null);
    }

    /**
     * Creates a factory that sends the given credentials with every connection.
     *
     * @param username database user, or null to leave it to the URL
     * @param password password, or null
     */
    public DriverManagerConnectionFactory(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public Connection open(String jdbcUrl) throws SQLException {
        Properties props = new Properties();
        if (username != null && !username.isBlank()) {
            props.setProperty("user", username);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        return DriverManager.getConnection(jdbcUrl, props);
    }
}
