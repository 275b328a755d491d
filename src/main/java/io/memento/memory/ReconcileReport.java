package io.memento.memory;

/**
 * Outcome of a {@link MemoryStore#reconcile()} sweep.
 *
 * @param reactivated sources whose {@code consolidatedInto} target did not exist and were returned to active
 * @param completed   sources of an existing merged memory that were still active and got flipped
 */
public record ReconcileReport(int reactivated, int completed) {

    public static ReconcileReport clean() {
        return new ReconcileReport(0, 0);
    }

    public boolean isClean() {
        return reactivated == 0 && completed == 0;
    }
}
