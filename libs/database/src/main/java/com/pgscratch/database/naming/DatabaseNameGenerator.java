package com.pgscratch.database.naming;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Random;

/**
 * Produces unique, time-sortable {@link DatabaseName}s.
 *
 * <p>Uniqueness is probabilistic: the suffix is {@value #TOKEN_LENGTH} letters drawn from a
 * 26-letter alphabet, and collisions are neither detected nor retried. The caller tag only aids
 * debugging ("which test left this database behind?") and plays no part in uniqueness.
 *
 * <p>Thread-safe as long as the supplied {@link Random} is ({@link SecureRandom} and {@link
 * Random} both are).
 */
public final class DatabaseNameGenerator {

    /** Length of the random token in every generated name. */
    public static final int TOKEN_LENGTH = 10;

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    // pgscratch_ + 14 digits + Z_ + token
    private static final int FIXED_LENGTH =
            DatabaseName.PREFIX.length() + 1 + 14 + 2 + TOKEN_LENGTH;

    /** Room left for {@code _<tag>} before PostgreSQL would truncate the identifier. */
    public static final int MAX_TAG_LENGTH = DatabaseName.MAX_LENGTH - FIXED_LENGTH - 1;

    private final Random random;
    private final Clock clock;

    /** Creates a generator backed by a {@link SecureRandom} and the system UTC clock. */
    public DatabaseNameGenerator() {
        this(new SecureRandom(), Clock.systemUTC());
    }

    /**
     * Creates a generator with an explicit random source and clock.
     *
     * @param random source for the random token; must be safe for concurrent use
     * @param clock  clock supplying creation timestamps
     */
    public DatabaseNameGenerator(Random random, Clock clock) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.random = random;
        this.clock = clock;
    }

    /**
     * Generates a name stamped with the current time.
     *
     * @param callerTag optional debugging tag (for example the test class name); may be null
     */
    public DatabaseName generate(String callerTag) {
        return generate(callerTag, clock.instant());
    }

    /**
     * Generates a name stamped with {@code now}.
     *
     * @param callerTag optional debugging tag; may be null
     * @param now       creation time to embed
     */
    public DatabaseName generate(String callerTag, Instant now) {
        StringBuilder suffix = new StringBuilder(TOKEN_LENGTH + 1 + MAX_TAG_LENGTH);
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        String tag = sanitizeTag(callerTag);
        if (!tag.isEmpty()) {
            suffix.append('_').append(tag);
        }
        return DatabaseName.of(now, suffix.toString());
    }

    /** Returns the clock this generator stamps names with. */
    public Clock clock() {
        return clock;
    }

    /**
     * Lowercases the tag, replaces anything outside {@code [a-z0-9_]} with {@code _}, and cuts
     * it to {@link #MAX_TAG_LENGTH}. Returns an empty string for a null or blank tag.
     */
    static String sanitizeTag(String callerTag) {
        if (callerTag == null || callerTag.isBlank()) {
            return "";
        }
        String lower = callerTag.strip().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(Math.min(lower.length(), MAX_TAG_LENGTH));
        for (int i = 0; i < lower.length() && sb.length() < MAX_TAG_LENGTH; i++) {
            char c = lower.charAt(i);
            boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(allowed ? c : '_');
        }
        return sb.toString();
    }
}
