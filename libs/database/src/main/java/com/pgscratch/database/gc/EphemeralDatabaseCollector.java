package com.pgscratch.database.gc;

import com.pgscratch.database.ConnectionFactory;
import com.pgscratch.database.ProvisioningException;
import com.pgscratch.database.SqlIdentifiers;
import com.pgscratch.database.naming.DatabaseName;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opportunistic garbage collector for ephemeral databases.
 * <p>
 * Each call to {@link #collect(Connection, String)} lists the ephemeral databases whose embedded
 * timestamp is older than the retention window and dispatches {@code DROP DATABASE} for at most
 * {@code maxDropsPerPass} of them, oldest first. The rest wait for a later pass, so a single test
 * never pays for a large cleanup burst.
 * <p>
 * Drops are fire-and-forget: each runs on the drop {@link Executor} over its own administrative
 * connection, and the caller never learns whether it succeeded. A failed drop (typically because
 * another session is still connected) leaves the database eligible for the next pass. Listing
 * failures, on the other hand, are thrown synchronously: they mean the server connection is
 * broken, not that some other test got there first.
 * <p>
 * Thread-safe; one collector can be shared by every provisioning call in the JVM.
 */
public final class EphemeralDatabaseCollector {

    private static final Logger log = LoggerFactory.getLogger(EphemeralDatabaseCollector.class);

    /** Default minimum age before an ephemeral database may be dropped. */
    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(3);

    /** Default upper bound on drops dispatched by one pass. */
    public static final int DEFAULT_MAX_DROPS_PER_PASS = 6;

    static final String ELIGIBLE_QUERY = """
            SELECT datname FROM pg_database
            WHERE datname LIKE '%s\\_%%' AND datname < ?
            ORDER BY datname
            """.formatted(DatabaseName.PREFIX);

    private static final ExecutorService DEFAULT_DROP_EXECUTOR =
            Executors.newCachedThreadPool(new DropThreadFactory());

    private final ConnectionFactory connectionFactory;
    private final Executor dropExecutor;
    private final Duration retention;
    private final int maxDropsPerPass;
    private final Clock clock;

    /**
     * Creates a collector with the default retention, drop bound, clock and drop executor.
     *
     * @param connectionFactory opens the administrative connection each drop runs on
     */
    public EphemeralDatabaseCollector(ConnectionFactory connectionFactory) {
        this(connectionFactory, DEFAULT_DROP_EXECUTOR, DEFAULT_RETENTION,
                DEFAULT_MAX_DROPS_PER_PASS, Clock.systemUTC());
    }

    /**
     * Creates a fully configured collector.
     *
     * @param connectionFactory opens the administrative connection each drop runs on
     * @param dropExecutor      runs drops; never waited on
     * @param retention         minimum age before a database is eligible
     * @param maxDropsPerPass   upper bound on drops dispatched by one pass
     * @param clock             clock the retention cutoff is computed from
     */
    public EphemeralDatabaseCollector(
            ConnectionFactory connectionFactory,
            Executor dropExecutor,
            Duration retention,
            int maxDropsPerPass,
            Clock clock) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        if (dropExecutor == null) {
            throw new IllegalArgumentException("dropExecutor must not be null");
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be zero or positive");
        }
        if (maxDropsPerPass < 0) {
            throw new IllegalArgumentException("maxDropsPerPass must not be negative");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.connectionFactory = connectionFactory;
        this.dropExecutor = dropExecutor;
        this.retention = retention;
        this.maxDropsPerPass = maxDropsPerPass;
        this.clock = clock;
    }

    /**
     * Runs one collection pass. Returns once the drops are dispatched, not once they finish.
     *
     * @param control  open administrative connection used for the inventory query
     * @param adminUrl URL background drops connect to (the control connection may be closed by
     *                 the time they run)
     * @return what was found and what was dispatched
     * @throws ProvisioningException of kind {@link ProvisioningException.Kind#ENUMERATION} if the
     *                               inventory cannot be listed
     */
    public CollectionPass collect(Connection control, String adminUrl) {
        DatabaseName boundary = DatabaseName.boundary(cutoff());
        List<DatabaseName> eligible = findEligible(control, boundary);

        List<DatabaseName> scheduled =
                List.copyOf(eligible.subList(0, Math.min(eligible.size(), maxDropsPerPass)));
        for (DatabaseName name : scheduled) {
            dispatchDrop(adminUrl, name);
        }

        CollectionPass pass = new CollectionPass(boundary, eligible, scheduled);
        if (!eligible.isEmpty()) {
            log.debug("Collection pass below {}: {} eligible, {} dispatched, {} deferred",
                    boundary, eligible.size(), scheduled.size(), pass.deferred());
        }
        return pass;
    }

    /**
     * Lists ephemeral databases that sort below {@code boundary}, oldest first.
     */
    List<DatabaseName> findEligible(Connection control, DatabaseName boundary) {
        List<DatabaseName> names = new ArrayList<>();
        try (PreparedStatement ps = control.prepareStatement(ELIGIBLE_QUERY)) {
            ps.setString(1, boundary.value());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String datname = rs.getString(1);
                    if (DatabaseName.isEphemeral(datname)) {
                        names.add(DatabaseName.parse(datname));
                    } else {
                        log.debug("Ignoring {}: prefix matches but name is not ours", datname);
                    }
                }
            }
        } catch (SQLException e) {
            throw new ProvisioningException(
                    ProvisioningException.Kind.ENUMERATION,
                    "Cannot list ephemeral databases: " + e.getMessage(),
                    e);
        }
        return names;
    }

    /** Databases created before this instant are eligible. */
    Instant cutoff() {
        return clock.instant().minus(retention);
    }

    public Duration retention() {
        return retention;
    }

    public int maxDropsPerPass() {
        return maxDropsPerPass;
    }

    private void dispatchDrop(String adminUrl, DatabaseName name) {
        try {
            dropExecutor.execute(() -> drop(adminUrl, name));
        } catch (RejectedExecutionException e) {
            log.debug("Drop of {} not dispatched: {}", name, e.getMessage());
        }
    }

    private void drop(String adminUrl, DatabaseName name) {
        try (Connection conn = connectionFactory.open(adminUrl);
             Statement stmt = conn.createStatement()) {
            stmt.execute(SqlIdentifiers.dropDatabase(name));
            log.debug("Dropped {}", name);
        } catch (SQLException e) {
            // Still eligible; a later pass retries it.
            log.debug("Drop of {} failed: {}", name, e.getMessage());
        }
    }

    private static final class DropThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pgscratch-gc-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
