package com.pgscratch.database.schema;

import com.pgscratch.database.ProvisioningException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves schema sources into the ordered list of scripts to run against a new database.
 * <p>
 * Sources keep the order they were given in; a migrations directory expands in place. Any read
 * or traversal error fails the whole resolution, so a database is never set up from a partial
 * schema.
 */
public final class SchemaLoader {

    /**
     * Reads every source.
     *
     * @param sources schema sources in application order
     * @return scripts in application order
     * @throws ProvisioningException of kind {@link ProvisioningException.Kind#CONFIGURATION} if a
     *                               source cannot be read
     */
    public List<SchemaScript> resolve(List<SchemaSource> sources) {
        if (sources == null) {
            throw new IllegalArgumentException("sources must not be null");
        }
        List<SchemaScript> scripts = new ArrayList<>();
        for (SchemaSource source : sources) {
            try {
                scripts.addAll(source.read());
            } catch (IOException e) {
                throw unreadable(source, e);
            } catch (UncheckedIOException e) {
                // Files.walk reports errors met mid-traversal this way
                throw unreadable(source, e.getCause());
            }
        }
        return List.copyOf(scripts);
    }

    private static ProvisioningException unreadable(SchemaSource source, IOException cause) {
        return new ProvisioningException(
                ProvisioningException.Kind.CONFIGURATION,
                "Cannot read schema from " + source + ": " + cause.getMessage(),
                cause);
    }
}
