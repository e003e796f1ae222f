package com.aiv.organizer.core.task;

import java.util.Objects;

/**
 * Thread-safe front of a {@link TaskListener}. Every callback is made while holding one lock,
 * progress never goes backwards and {@code finished} is forwarded once.
 */
public final class TaskEvents {
    private final TaskListener listener;
    private final Object lock = new Object();
    private int lastProgress = -1;
    private boolean finished;

    public TaskEvents(TaskListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public void progress(int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        synchronized (lock) {
            if (finished || clamped < lastProgress) {
                return;
            }
            lastProgress = clamped;
            listener.progress(clamped);
        }
    }

    public void log(String message) {
        synchronized (lock) {
            if (!finished) {
                listener.log(message);
            }
        }
    }

    public void ngCount(NgCountReport report) {
        synchronized (lock) {
            if (!finished) {
                listener.ngCount(report);
            }
        }
    }

    /**
     * Forwards the terminal summary. Returns false when a summary was already delivered.
     */
    public boolean finish(String summary) {
        synchronized (lock) {
            if (finished) {
                return false;
            }
            finished = true;
            listener.finished(summary);
            return true;
        }
    }

    public int lastProgress() {
        synchronized (lock) {
            return Math.max(lastProgress, 0);
        }
    }

    public boolean isFinished() {
        synchronized (lock) {
            return finished;
        }
    }
}
