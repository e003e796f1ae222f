package com.aiv.organizer.core.task;

/**
 * Counts of one executor run. {@code transferred} sums the counts of successful results, so a
 * folder copy contributes the number of files it copied.
 */
public record BatchOutcome(int submitted, int succeeded, int failed, int skipped, int transferred, boolean cancelled) {

    public static BatchOutcome empty() {
        return new BatchOutcome(0, 0, 0, 0, 0, false);
    }

    public int completed() {
        return succeeded + failed + skipped;
    }

    /** Adds the counts of {@code other}; cancelled if either was. */
    public BatchOutcome plus(BatchOutcome other) {
        return new BatchOutcome(
            submitted + other.submitted,
            succeeded + other.succeeded,
            failed + other.failed,
            skipped + other.skipped,
            transferred + other.transferred,
            cancelled || other.cancelled
        );
    }
}
