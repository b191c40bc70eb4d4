package com.pgscratch.database.provision;

import com.pgscratch.database.ConnectionFactory;
import com.pgscratch.database.ProvisioningException;
import com.pgscratch.database.SqlIdentifiers;
import com.pgscratch.database.gc.EphemeralDatabaseCollector;
import com.pgscratch.database.naming.DatabaseName;
import com.pgscratch.database.naming.DatabaseNameGenerator;
import com.pgscratch.database.schema.SchemaLoader;
import com.pgscratch.database.schema.SchemaScript;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a fresh, uniquely named database for each caller and hands back a connection to it.
 * <p>
 * Every call runs the same synchronous sequence:
 * <ol>
 *   <li>resolve the schema sources (nothing touches the server if a file is missing);
 *   <li>open a control connection to the administrative database and run a garbage collection
 *       pass on it;
 *   <li>generate a name and {@code CREATE DATABASE} it, then release the control connection;
 *   <li>connect to the new database and execute each script in order, stopping at the first
 *       failure.
 * </ol>
 * Garbage collection is the only cleanup there is: databases are never dropped by the test that
 * created them. Drops dispatched by step 2 may still be running when this method returns.
 * <p>
 * A name collision on {@code CREATE DATABASE} is reported like any other SQL failure; no second
 * name is tried.
 * <p>
 * Thread-safe: concurrent tests may share one provisioner.
 */
public final class EphemeralDatabaseProvisioner {

    private static final Logger log = LoggerFactory.getLogger(EphemeralDatabaseProvisioner.class);

    /** Administrative database used when neither the provisioner nor the call names one. */
    public static final String DEFAULT_DATABASE_URL =
            "jdbc:postgresql://localhost:5432/postgres?sslmode=disable";

    private final String defaultDatabaseUrl;
    private final ConnectionFactory connectionFactory;
    private final SchemaLoader schemaLoader;
    private final EphemeralDatabaseCollector collector;
    private final DatabaseNameGenerator nameGenerator;

    /**
     * Creates a provisioner against {@link #DEFAULT_DATABASE_URL} with default collaborators.
     */
    public EphemeralDatabaseProvisioner(ConnectionFactory connectionFactory) {
        this(DEFAULT_DATABASE_URL, connectionFactory, new SchemaLoader(),
                new EphemeralDatabaseCollector(connectionFactory), new DatabaseNameGenerator());
    }

    /**
     * Creates a fully configured provisioner.
     *
     * @param defaultDatabaseUrl administrative URL used unless a call overrides it
     * @param connectionFactory  opens control and target connections
     * @param schemaLoader       resolves schema sources
     * @param collector          garbage collector run before each creation
     * @param nameGenerator      names new databases
     */
    public EphemeralDatabaseProvisioner(
            String defaultDatabaseUrl,
            ConnectionFactory connectionFactory,
            SchemaLoader schemaLoader,
            EphemeralDatabaseCollector collector,
            DatabaseNameGenerator nameGenerator) {
        if (defaultDatabaseUrl == null || defaultDatabaseUrl.isBlank()) {
            throw new IllegalArgumentException("defaultDatabaseUrl must not be null or blank");
        }
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        if (schemaLoader == null) {
            throw new IllegalArgumentException("schemaLoader must not be null");
        }
        if (collector == null) {
            throw new IllegalArgumentException("collector must not be null");
        }
        if (nameGenerator == null) {
            throw new IllegalArgumentException("nameGenerator must not be null");
        }
        this.defaultDatabaseUrl = defaultDatabaseUrl;
        this.connectionFactory = connectionFactory;
        this.schemaLoader = schemaLoader;
        this.collector = collector;
        this.nameGenerator = nameGenerator;
    }

    /**
     * Provisions an empty database, reporting failure through {@code fataler}.
     *
     * @see #open(Fataler, ProvisionOptions)
     */
    public Connection open(Fataler fataler) {
        return open(fataler, ProvisionOptions.NONE);
    }

    /**
     * Provisions a database and returns a connection to it. The caller owns the connection.
     * <p>
     * Any failure goes to {@code fataler}, which is expected to stop the test. Should it return
     * anyway, an {@link IllegalStateException} is thrown instead of handing back a connection.
     *
     * @param fataler failure sink of the calling test
     * @param options schema, URL override and caller tag
     * @return open connection to the new database
     */
    public Connection open(Fataler fataler, ProvisionOptions options) {
        if (fataler == null) {
            throw new IllegalArgumentException("fataler must not be null");
        }
        try {
            return provision(options).connection();
        } catch (ProvisioningException e) {
            fataler.fatal(e.getMessage(), e);
            throw new IllegalStateException("Fataler returned after: " + e.getMessage(), e);
        }
    }

    /**
     * Provisions a database, throwing on failure.
     *
     * @param options schema, URL override and caller tag
     * @return the new database with an open connection, owned by the caller
     * @throws ProvisioningException if any step fails; no connection is left open
     */
    public EphemeralDatabase provision(ProvisionOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        String adminUrl = options.databaseUrl() != null ? options.databaseUrl() : defaultDatabaseUrl;
        List<SchemaScript> scripts = schemaLoader.resolve(options.schemaSources());

        DatabaseName name = nameGenerator.generate(options.callerTag());
        String targetUrl = JdbcUrls.withDatabase(adminUrl, name);
        createDatabase(adminUrl, name);
        log.info("Created ephemeral database {}", targetUrl);

        Connection connection = connect(targetUrl);
        try {
            applySchema(connection, name, scripts);
        } catch (ProvisioningException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        return new EphemeralDatabase(name, targetUrl, connection);
    }

    private void createDatabase(String adminUrl, DatabaseName name) {
        try (Connection control = connectionFactory.open(adminUrl)) {
            collector.collect(control, adminUrl);
            try (Statement stmt = control.createStatement()) {
                stmt.execute(SqlIdentifiers.createDatabase(name));
            } catch (SQLException e) {
                throw new ProvisioningException(
                        ProvisioningException.Kind.SQL_EXECUTION,
                        "CREATE DATABASE " + name + " failed: " + e.getMessage(),
                        e);
            }
        } catch (SQLException e) {
            throw new ProvisioningException(
                    ProvisioningException.Kind.CONNECTION,
                    "Cannot connect to administrative database: " + e.getMessage(),
                    e);
        }
    }

    private Connection connect(String targetUrl) {
        try {
            return connectionFactory.open(targetUrl);
        } catch (SQLException e) {
            throw new ProvisioningException(
                    ProvisioningException.Kind.CONNECTION,
                    "Cannot connect to " + targetUrl + ": " + e.getMessage(),
                    e);
        }
    }

    private static void applySchema(
            Connection connection, DatabaseName name, List<SchemaScript> scripts) {
        for (SchemaScript script : scripts) {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(script.sql());
            } catch (SQLException e) {
                throw new ProvisioningException(
                        ProvisioningException.Kind.SQL_EXECUTION,
                        "Schema " + script.origin() + " failed on " + name + ": " + e.getMessage(),
                        e);
            }
        }
    }

    private static void closeAfterFailure(Connection connection, ProvisioningException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
