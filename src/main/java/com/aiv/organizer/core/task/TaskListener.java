package com.aiv.organizer.core.task;

/**
 * Receives the events of one task run. Calls arrive one at a time, never concurrently.
 */
public interface TaskListener {
    void progress(int percent);

    void log(String message);

    /** Tabular result of the NG count operation. */
    default void ngCount(NgCountReport report) {
    }

    /** Terminal summary, delivered exactly once per run. */
    void finished(String summary);
}
