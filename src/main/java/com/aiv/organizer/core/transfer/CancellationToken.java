package com.aiv.organizer.core.transfer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by one task run. Set once by {@link #cancel()}, read by the
 * dispatcher and by every primitive at its safe points.
 */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * A token nobody will cancel, for callers running a primitive outside a task.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }
}
