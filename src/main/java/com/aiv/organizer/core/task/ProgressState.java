package com.aiv.organizer.core.task;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Progress of one batch: the total is fixed before dispatch and every completed unit counts once.
 * A silent state is tracked but not reported, for inner batches whose caller reports progress at
 * a coarser level.
 */
public final class ProgressState {
    private final int total;
    private final boolean reporting;
    private final AtomicInteger processed = new AtomicInteger();

    private ProgressState(int total, boolean reporting) {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative: " + total);
        }
        this.total = total;
        this.reporting = reporting;
    }

    public static ProgressState of(int total) {
        return new ProgressState(total, true);
    }

    public static ProgressState silent(int total) {
        return new ProgressState(total, false);
    }

    public int processed() {
        return processed.get();
    }

    public boolean isReporting() {
        return reporting;
    }

    /** Marks one unit complete and returns the new percentage. */
    public int complete() {
        return percent(processed.incrementAndGet(), total);
    }

    static int percent(int done, int total) {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.min(100L, (long) done * 100L / total);
    }
}
