/**
 * Garbage collection of aged ephemeral databases.
 *
 * <p>Drops are dispatched in the background and never awaited; see {@link
 * com.pgscratch.database.gc.EphemeralDatabaseCollector}.
 */
package com.pgscratch.database.gc;
