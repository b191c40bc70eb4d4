package com.pgscratch.database.provision;

import com.pgscratch.database.ProvisioningException;

/**
 * Receives provisioning failures and stops the calling test.
 * <p>
 * Implementations must not return normally: they throw (an assertion error, an aborting
 * exception) or terminate the thread. Test frameworks plug in here without this library
 * depending on one; see {@code com.pgscratch.database.testing.JUnitFataler} for JUnit 5.
 */
@FunctionalInterface
public interface Fataler {

    /**
     * Fails immediately.
     *
     * @param message what went wrong
     * @param cause   the underlying {@link ProvisioningException}
     */
    void fatal(String message, ProvisioningException cause);

    /** A fataler that rethrows the cause unchanged. */
    static Fataler throwing() {
        return (message, cause) -> {
            throw cause;
        };
    }
}
