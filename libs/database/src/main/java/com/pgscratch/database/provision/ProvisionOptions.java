package com.pgscratch.database.provision;

import com.pgscratch.database.schema.SchemaSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-call settings for {@link EphemeralDatabaseProvisioner}.
 * <p>
 * Schema sources accumulate in the order the builder methods are called, and are applied in that
 * order:
 *
 * <pre>{@code
 * ProvisionOptions options = ProvisionOptions.builder()
 *         .schemaFile(Path.of("src/test/resources/base.sql"))
 *         .migrations(Path.of("db/migrations"))
 *         .callerTag("OrderRepositoryTest")
 *         .build();
 * }</pre>
 *
 * @param schemaSources sources applied to the new database, in order
 * @param databaseUrl   administrative URL override, or null for the provisioner's default
 * @param callerTag     debugging tag embedded in the database name, or null
 */
public record ProvisionOptions(List<SchemaSource> schemaSources, String databaseUrl, String callerTag) {

    /** Options with no schema, the default URL and no tag. */
    public static final ProvisionOptions NONE = new ProvisionOptions(List.of(), null, null);

    public ProvisionOptions {
        schemaSources = schemaSources == null ? List.of() : List.copyOf(schemaSources);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with these options. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.schemaSources.addAll(schemaSources);
        b.databaseUrl = databaseUrl;
        b.callerTag = callerTag;
        return b;
    }

    public static final class Builder {

        private final List<SchemaSource> schemaSources = new ArrayList<>();
        private String databaseUrl;
        private String callerTag;

        private Builder() {
        }

        /** Applies a single SQL file. */
        public Builder schemaFile(Path path) {
            return schema(SchemaSource.file(path));
        }

        /** Applies every {@code .sql} file under {@code directory}, ordered by path. */
        public Builder migrations(Path directory) {
            return schema(SchemaSource.migrations(directory));
        }

        /** Applies a classpath resource. */
        public Builder classpathSchema(String resource) {
            return schema(SchemaSource.classpath(resource));
        }

        public Builder schema(SchemaSource source) {
            if (source == null) {
                throw new IllegalArgumentException("source must not be null");
            }
            schemaSources.add(source);
            return this;
        }

        /** Overrides the administrative connection URL. */
        public Builder databaseUrl(String databaseUrl) {
            if (databaseUrl == null || databaseUrl.isBlank()) {
                throw new IllegalArgumentException("databaseUrl must not be null or blank");
            }
            this.databaseUrl = databaseUrl;
            return this;
        }

        /** Tags the database name with the calling test, for debugging leftovers. */
        public Builder callerTag(String callerTag) {
            this.callerTag = callerTag;
            return this;
        }

        public ProvisionOptions build() {
            return new ProvisionOptions(schemaSources, databaseUrl, callerTag);
        }
    }
}
