package com.pgscratch.database;

/**
 * Thrown when an ephemeral database cannot be set up.
 * <p>
 * None of these failures is retried: a test whose database could not be prepared should stop,
 * and the {@link Kind} tells the reader which stage gave up.
 */
public class ProvisioningException extends RuntimeException {

    /** Stage of provisioning that failed. */
    public enum Kind {
        /** Bad schema path, unreadable migrations directory, malformed connection URL. */
        CONFIGURATION,
        /** The administrative server or the new database could not be reached. */
        CONNECTION,
        /** CREATE DATABASE or a schema script failed. */
        SQL_EXECUTION,
        /** The garbage collector could not list existing ephemeral databases. */
        ENUMERATION
    }

    private final Kind kind;

    public ProvisioningException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        this.kind = kind;
    }

    public ProvisioningException(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind kind() {
        return kind;
    }
}
