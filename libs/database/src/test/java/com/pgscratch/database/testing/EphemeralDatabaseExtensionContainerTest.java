package com.pgscratch.database.testing;

import static org.assertj.core.api.Assertions.assertThat;

import com.pgscratch.database.ConnectionFactory;
import com.pgscratch.database.PostgresContainerSupport;
import com.pgscratch.database.gc.EphemeralDatabaseCollector;
import com.pgscratch.database.naming.DatabaseNameGenerator;
import com.pgscratch.database.provision.EphemeralDatabase;
import com.pgscratch.database.provision.EphemeralDatabaseProvisioner;
import com.pgscratch.database.provision.ProvisionOptions;
import com.pgscratch.database.schema.SchemaLoader;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Uses the extension the way a suite would. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("EphemeralDatabaseExtension against PostgreSQL")
class EphemeralDatabaseExtensionContainerTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = PostgresContainerSupport.createContainer();

    // Instance field: built after the container has started.
    @RegisterExtension
    final EphemeralDatabaseExtension database = EphemeralDatabaseExtension
            .builder(provisioner())
            .options(ProvisionOptions.builder().classpathSchema("schema/accounts.sql").build())
            .build();

    private static EphemeralDatabaseProvisioner provisioner() {
        ConnectionFactory connectionFactory = PostgresContainerSupport.connectionFactory(POSTGRES);
        return new EphemeralDatabaseProvisioner(
                POSTGRES.getJdbcUrl(),
                connectionFactory,
                new SchemaLoader(),
                new EphemeralDatabaseCollector(connectionFactory),
                new DatabaseNameGenerator());
    }

    @Test
    @DisplayName("injects a connection to a database with the schema applied")
    void injectsConnection(Connection connection) throws Exception {
        try (Statement st = connection.createStatement()) {
            st.execute("INSERT INTO accounts (email) VALUES ('a@example.com')");
            try (ResultSet rs = st.executeQuery("SELECT count(*) FROM accounts")) {
                rs.next();
                assertThat(rs.getInt(1)).isEqualTo(1);
            }
        }
    }

    @Test
    @DisplayName("each test gets its own database, tagged with the test class")
    void separateDatabasePerTest(EphemeralDatabase db, Connection connection) throws Exception {
        assertThat(db.connection()).isSameAs(connection);
        assertThat(db.name().value()).endsWith("_ephemeraldatabaseextension");
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT count(*) FROM accounts")) {
            rs.next();
            assertThat(rs.getInt(1)).isZero();
        }
    }
}
