package com.aiv.organizer.core.task;

import com.aiv.organizer.core.fs.FolderScanner;
import com.aiv.organizer.core.transfer.CancellationToken;
import com.aiv.organizer.core.transfer.FileTransfers;
import com.aiv.organizer.logging.TaskFailureLog;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Everything a procedure needs for one run: the shared stop flag, the event sink and factories
 * for the scanner, the copy primitives and executors.
 */
public final class TaskContext {
    private final OperationKind operation;
    private final CancellationToken token;
    private final TaskEvents events;
    private final TaskFailureLog failureLog;
    private final Logger logger;
    private final int poolSize;
    private final int chunkBytes;
    private final Runnable onDispatch;

    public TaskContext(OperationKind operation,
                       CancellationToken token,
                       TaskEvents events,
                       TaskFailureLog failureLog,
                       Logger logger,
                       int poolSize,
                       int chunkBytes,
                       Runnable onDispatch) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.token = Objects.requireNonNull(token, "token");
        this.events = Objects.requireNonNull(events, "events");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.poolSize = poolSize;
        this.chunkBytes = chunkBytes;
        this.onDispatch = onDispatch == null ? () -> { } : onDispatch;
    }

    public OperationKind operation() {
        return operation;
    }

    public CancellationToken token() {
        return token;
    }

    public TaskEvents events() {
        return events;
    }

    public Logger logger() {
        return logger;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    public void log(String message) {
        events.log(message);
    }

    public void progress(int percent) {
        events.progress(percent);
    }

    public FolderScanner scanner() {
        return new FolderScanner(events::log);
    }

    public FileTransfers transfers() {
        return new FileTransfers(token, chunkBytes, logger);
    }

    /** Marks the end of planning, for procedures that work without an executor. */
    public void markRunning() {
        onDispatch.run();
    }

    /** A fresh executor; the first call moves the run from planning to running. */
    public TaskExecutor newExecutor() {
        markRunning();
        return new TaskExecutor(operation, token, events, failureLog, logger, poolSize);
    }
}
