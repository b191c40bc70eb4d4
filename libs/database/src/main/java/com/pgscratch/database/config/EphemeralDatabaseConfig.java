package com.pgscratch.database.config;

import com.pgscratch.database.ConnectionFactory;
import com.pgscratch.database.DriverManagerConnectionFactory;
import com.pgscratch.database.gc.EphemeralDatabaseCollector;
import com.pgscratch.database.naming.DatabaseNameGenerator;
import com.pgscratch.database.provision.EphemeralDatabaseProvisioner;
import com.pgscratch.database.schema.SchemaLoader;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring wiring for ephemeral test databases.
 *
 * <p>Active only when {@code pgscratch.database.enabled=true}, so test slices opt in explicitly:
 *
 * <pre>{@code
 * @SpringBootTest(properties = "pgscratch.database.enabled=true")
 * @Import(EphemeralDatabaseConfig.class)
 * class OrderRepositoryTest { ... }
 * }</pre>
 *
 * <p>Each bean backs off when the application defines its own.
 *
 * @see EphemeralDatabaseProperties
 */
@Configuration
@EnableConfigurationProperties(EphemeralDatabaseProperties.class)
@ConditionalOnProperty(prefix = "pgscratch.database", name = "enabled", havingValue = "true")
public class EphemeralDatabaseConfig {

    /** Bean name of the executor background drops run on. */
    public static final String DROP_EXECUTOR_BEAN = "pgscratchDropExecutor";

    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory pgscratchConnectionFactory(EphemeralDatabaseProperties properties) {
        return new DriverManagerConnectionFactory(properties.username(), properties.password());
    }

    @Bean
    @ConditionalOnMissingBean
    public DatabaseNameGenerator databaseNameGenerator() {
        return new DatabaseNameGenerator(new SecureRandom(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaLoader schemaLoader() {
        return new SchemaLoader();
    }

    /**
     * Executor for fire-and-forget drops. Shut down with the context; drops still queued at that
     * point are abandoned and picked up by a later pass.
     */
    @Bean(name = DROP_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    public ExecutorService pgscratchDropExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pgscratch-gc");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public EphemeralDatabaseCollector ephemeralDatabaseCollector(
            EphemeralDatabaseProperties properties, ConnectionFactory connectionFactory) {
        return new EphemeralDatabaseCollector(
                connectionFactory,
                pgscratchDropExecutor(),
                properties.retention(),
                properties.maxDropsPerPass(),
                Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public EphemeralDatabaseProvisioner ephemeralDatabaseProvisioner(
            EphemeralDatabaseProperties properties,
            ConnectionFactory connectionFactory,
            SchemaLoader schemaLoader,
            EphemeralDatabaseCollector collector,
            DatabaseNameGenerator nameGenerator) {
        return new EphemeralDatabaseProvisioner(
                properties.url(), connectionFactory, schemaLoader, collector, nameGenerator);
    }
}
