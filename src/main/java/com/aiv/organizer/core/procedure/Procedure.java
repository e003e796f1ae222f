package com.aiv.organizer.core.procedure;

import com.aiv.organizer.core.task.TaskContext;
import com.aiv.organizer.core.task.TaskDescriptor;

import java.io.IOException;

/**
 * One operation: enumerate candidates, compute the total, run the work items and summarize.
 * Per-item failures end up in the log and the counts; an exception thrown from {@code run} means
 * the run itself failed.
 */
public interface Procedure<T extends TaskDescriptor> {
    ProcedureOutcome run(T task, TaskContext context) throws IOException;
}
