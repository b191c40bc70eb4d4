package com.pgscratch.database.gc;

import com.pgscratch.database.naming.DatabaseName;
import java.util.List;

/**
 * Outcome of one garbage collection pass.
 * <p>
 * {@code scheduled} names were handed to the drop executor; whether (or when) they were actually
 * dropped is not observable. Names in {@code eligible} but not in {@code scheduled} are left for a
 * later pass.
 *
 * @param boundary  synthetic name every eligible database sorted below
 * @param eligible  ephemeral databases older than the retention window, oldest first
 * @param scheduled the prefix of {@code eligible} dispatched for dropping
 */
public record CollectionPass(
        DatabaseName boundary, List<DatabaseName> eligible, List<DatabaseName> scheduled) {

    public CollectionPass {
        eligible = List.copyOf(eligible);
        scheduled = List.copyOf(scheduled);
    }

    /** Number of eligible databases this pass did not dispatch. */
    public int deferred() {
        return eligible.size() - scheduled.size();
    }
}
