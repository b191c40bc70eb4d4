package com.pgscratch.database.config;

import com.pgscratch.database.gc.EphemeralDatabaseCollector;
import com.pgscratch.database.provision.EphemeralDatabaseProvisioner;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized settings for ephemeral test databases, bound from {@code pgscratch.database.*}.
 *
 * <pre>
 * pgscratch:
 *   database:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/postgres?sslmode=disable
 *     username: postgres
 *     password: postgres
 *     retention: 3m
 *     max-drops-per-pass: 6
 * </pre>
 *
 * @param enabled         whether {@link EphemeralDatabaseConfig} wires its beans
 * @param url             administrative database the provisioner connects to
 * @param username        database user, or null to rely on the URL
 * @param password        password, or null
 * @param retention       minimum age before a database may be garbage collected
 * @param maxDropsPerPass upper bound on drops dispatched by one collection pass
 */
@Validated
@ConfigurationProperties(prefix = "pgscratch.database")
public record EphemeralDatabaseProperties(
        boolean enabled,
        @NotBlank String url,
        String username,
        String password,
        Duration retention,
        int maxDropsPerPass) {

    /**
     * Compact constructor: applies defaults for omitted fields. Runs before Bean Validation, so a
     * missing URL becomes the default rather than a violation.
     */
    public EphemeralDatabaseProperties {
        if (url == null || url.isBlank()) {
            url = EphemeralDatabaseProvisioner.DEFAULT_DATABASE_URL;
        }
        if (retention == null || retention.isNegative()) {
            retention = EphemeralDatabaseCollector.DEFAULT_RETENTION;
        }
        if (maxDropsPerPass <= 0) {
            maxDropsPerPass = EphemeralDatabaseCollector.DEFAULT_MAX_DROPS_PER_PASS;
        }
    }
}
