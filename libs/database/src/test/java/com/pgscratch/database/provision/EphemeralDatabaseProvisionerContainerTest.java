package com.pgscratch.database.provision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pgscratch.database.ConnectionFactory;
import com.pgscratch.database.PostgresContainerSupport;
import com.pgscratch.database.ProvisioningException;
import com.pgscratch.database.gc.CollectionPass;
import com.pgscratch.database.gc.EphemeralDatabaseCollector;
import com.pgscratch.database.naming.DatabaseName;
import com.pgscratch.database.naming.DatabaseNameGenerator;
import com.pgscratch.database.schema.SchemaLoader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end tests against a real PostgreSQL server. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("EphemeralDatabaseProvisioner against PostgreSQL")
class EphemeralDatabaseProvisionerContainerTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = PostgresContainerSupport.createContainer();

    private static final ExecutorService DROPS = Executors.newCachedThreadPool();

    private ConnectionFactory connectionFactory;
    private EphemeralDatabaseProvisioner provisioner;

    @AfterAll
    static void stopDrops() {
        DROPS.shutdownNow();
    }

    @BeforeEach
    void setUp() {
        connectionFactory = PostgresContainerSupport.connectionFactory(POSTGRES);
        provisioner = provisionerAt(Clock.systemUTC(), 6);
    }

    private EphemeralDatabaseProvisioner provisionerAt(Clock clock, int maxDrops) {
        return new EphemeralDatabaseProvisioner(
                POSTGRES.getJdbcUrl(),
                connectionFactory,
                new SchemaLoader(),
                new EphemeralDatabaseCollector(
                        connectionFactory, DROPS, Duration.ofMinutes(3), maxDrops, Clock.systemUTC()),
                new DatabaseNameGenerator(new SecureRandom(), clock));
    }

    private static Path migrationsDir() throws URISyntaxException {
        return Path.of(EphemeralDatabaseProvisionerContainerTest.class
                .getClassLoader().getResource("migrations").toURI());
    }

    private static boolean tableExists(Connection c, String table) throws SQLException {
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT count(*) FROM information_schema.tables WHERE table_name = '" + table + "'")) {
            rs.next();
            return rs.getInt(1) > 0;
        }
    }

    @Test
    @DisplayName("provisions a database with migrations applied in filename order")
    void appliesMigrations() throws Exception {
        ProvisionOptions options = ProvisionOptions.builder()
                .migrations(migrationsDir())
                .callerTag("migrations")
                .build();

        try (EphemeralDatabase db = provisioner.provision(options)) {
            Connection c = db.connection();
            assertThat(tableExists(c, "accounts")).isTrue();
            assertThat(tableExists(c, "orders")).isTrue();
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT current_database()")) {
                rs.next();
                assertThat(rs.getString(1)).isEqualTo(db.name().value());
            }
        }
    }

    @Test
    @DisplayName("concurrent callers get distinct databases with no shared state")
    void concurrentIsolation() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<EphemeralDatabase> first = CompletableFuture.supplyAsync(
                    () -> provisioner.provision(ProvisionOptions.builder()
                            .classpathSchema("schema/accounts.sql").callerTag("caller_one").build()),
                    callers);
            CompletableFuture<EphemeralDatabase> second = CompletableFuture.supplyAsync(
                    () -> provisioner.provision(ProvisionOptions.builder()
                            .classpathSchema("schema/accounts.sql").callerTag("caller_two").build()),
                    callers);

            try (EphemeralDatabase a = first.get(60, TimeUnit.SECONDS);
                 EphemeralDatabase b = second.get(60, TimeUnit.SECONDS)) {
                assertThat(a.name()).isNotEqualTo(b.name());

                try (Statement st = a.connection().createStatement()) {
                    st.execute("INSERT INTO accounts (email) VALUES ('one@example.com')");
                }
                try (Statement st = b.connection().createStatement();
                     ResultSet rs = st.executeQuery("SELECT count(*) FROM accounts")) {
                    rs.next();
                    assertThat(rs.getInt(1)).isZero();
                }
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @DisplayName("invalid schema fails the call and later sources are not applied")
    void invalidSchema() throws Exception {
        ProvisionOptions options = ProvisionOptions.builder()
                .classpathSchema("schema/accounts.sql")
                .classpathSchema("schema/broken.sql")
                .migrations(migrationsDir())
                .callerTag("brokenschema")
                .build();

        assertThatThrownBy(() -> provisioner.open(Fataler.throwing(), options))
                .isInstanceOf(ProvisioningException.class)
                .hasMessageContaining("broken.sql")
                .satisfies(e -> assertThat(((ProvisioningException) e).kind())
                        .isEqualTo(ProvisioningException.Kind.SQL_EXECUTION));

        List<String> created = PostgresContainerSupport.databasesMatching(POSTGRES, "_brokenschema");
        assertThat(created).hasSize(1);
        String url = POSTGRES.getJdbcUrl().replace("/" + POSTGRES.getDatabaseName(), "/" + created.get(0));
        try (Connection c = connectionFactory.open(url)) {
            assertThat(tableExists(c, "accounts")).isTrue();
            assertThat(tableExists(c, "broken")).isFalse();
            assertThat(tableExists(c, "orders")).isFalse();
        }
    }

    @Test
    @DisplayName("garbage collection drops aged databases and keeps fresh ones")
    void collectsAgedDatabases() throws Exception {
        Instant now = Instant.now();
        EphemeralDatabaseProvisioner tenMinutesAgo =
                provisionerAt(Clock.fixed(now.minus(Duration.ofMinutes(10)), ZoneOffset.UTC), 0);
        EphemeralDatabaseProvisioner oneMinuteAgo =
                provisionerAt(Clock.fixed(now.minus(Duration.ofMinutes(1)), ZoneOffset.UTC), 0);

        DatabaseName aged;
        DatabaseName fresh;
        try (EphemeralDatabase a = tenMinutesAgo.provision(
                     ProvisionOptions.builder().callerTag("gc_aged").build());
             EphemeralDatabase f = oneMinuteAgo.provision(
                     ProvisionOptions.builder().callerTag("gc_fresh").build())) {
            aged = a.name();
            fresh = f.name();
        }

        EphemeralDatabaseCollector collector = new EphemeralDatabaseCollector(
                connectionFactory, DROPS, Duration.ofMinutes(3), 6, Clock.systemUTC());
        CollectionPass pass;
        try (Connection control = connectionFactory.open(POSTGRES.getJdbcUrl())) {
            pass = collector.collect(control, POSTGRES.getJdbcUrl());
        }

        assertThat(pass.eligible()).contains(aged).doesNotContain(fresh);
        assertThat(pass.scheduled()).contains(aged);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
        while (!PostgresContainerSupport.databasesMatching(POSTGRES, aged.value()).isEmpty()
                && System.nanoTime() < deadline) {
            Thread.sleep(200);
        }
        assertThat(PostgresContainerSupport.databasesMatching(POSTGRES, aged.value())).isEmpty();
        assertThat(PostgresContainerSupport.databasesMatching(POSTGRES, fresh.value())).hasSize(1);
    }
}
