package com.pgscratch.database.schema;

/**
 * One unit of schema SQL, executed as a single statement batch.
 *
 * @param origin where the text came from (file path or {@code classpath:} resource)
 * @param sql    the script text, verbatim
 */
public record SchemaScript(String origin, String sql) {

    public SchemaScript {
        if (origin == null) {
            throw new IllegalArgumentException("origin must not be null");
        }
        if (sql == null) {
            throw new IllegalArgumentException("sql must not be null");
        }
    }
}
