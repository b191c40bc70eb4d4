package com.pgscratch.database.naming;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Name of an ephemeral database: {@code pgscratch_<yyyyMMddHHmmss>Z_<suffix>}.
 *
 * <p>The timestamp is UTC and fixed-width, so comparing two names as strings compares their
 * creation times (to the second). The garbage collector relies on this: every database created
 * before a cutoff sorts below {@link #boundary(Instant)} for that cutoff, and the server can do
 * the filtering with a plain {@code <} on the name column.
 *
 * @param value the full database name
 */
public record DatabaseName(String value) implements Comparable<DatabaseName> {

    /** Literal prefix shared by every database this library creates. */
    public static final String PREFIX = "pgscratch";

    /** Longest identifier PostgreSQL keeps without truncating (NAMEDATALEN - 1). */
    public static final int MAX_LENGTH = 63;

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private static final Pattern CONVENTION =
            Pattern.compile("^" + PREFIX + "_(\\d{14})Z_([a-z0-9_]+)$");

    private static final String BOUNDARY_SUFFIX = "db";

    public DatabaseName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "database name exceeds %d characters: %s".formatted(MAX_LENGTH, value));
        }
    }

    /**
     * Builds a name from its creation time and suffix.
     *
     * @param createdAt creation instant, rendered in UTC at second resolution
     * @param suffix random token, optionally followed by {@code _<tag>}
     */
    public static DatabaseName of(Instant createdAt, String suffix) {
        return new DatabaseName(
                PREFIX + "_" + TIMESTAMP_FORMAT.format(createdAt) + "Z_" + suffix);
    }

    /**
     * Synthetic name that every ephemeral database created before {@code cutoff} sorts below.
     */
    public static DatabaseName boundary(Instant cutoff) {
        return of(cutoff, BOUNDARY_SUFFIX);
    }

    /**
     * Parses a name read back from the server.
     *
     * @throws IllegalArgumentException if {@code value} does not follow the naming convention
     */
    public static DatabaseName parse(String value) {
        if (!isEphemeral(value)) {
            throw new IllegalArgumentException("not an ephemeral database name: " + value);
        }
        return new DatabaseName(value);
    }

    /** Returns true when {@code value} follows the ephemeral naming convention. */
    public static boolean isEphemeral(String value) {
        if (value == null || value.length() > MAX_LENGTH) {
            return false;
        }
        Matcher m = CONVENTION.matcher(value);
        if (!m.matches()) {
            return false;
        }
        try {
            LocalDateTime.parse(m.group(1), TIMESTAMP_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Creation time embedded in the name.
     *
     * @throws IllegalStateException if this name does not follow the convention
     */
    public Instant createdAt() {
        Matcher m = CONVENTION.matcher(value);
        if (!m.matches()) {
            throw new IllegalStateException("no timestamp in database name: " + value);
        }
        return LocalDateTime.parse(m.group(1), TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC);
    }

    @Override
    public int compareTo(DatabaseName other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
