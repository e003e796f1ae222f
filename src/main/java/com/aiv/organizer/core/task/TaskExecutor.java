package com.aiv.organizer.core.task;

import com.aiv.organizer.core.transfer.CancellationToken;
import com.aiv.organizer.core.transfer.TransferResult;
import com.aiv.organizer.logging.TaskFailureLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a batch of {@link WorkItem}s on a fresh bounded pool and drains the results in completion
 * order. A failed item is logged and recorded but never stops its siblings; a cancelled result or
 * a set token stops the drain and cancels what has not started.
 */
public final class TaskExecutor {
    private static final long CANCEL_GRACE_SECONDS = 30;

    private final OperationKind operation;
    private final CancellationToken token;
    private final TaskEvents events;
    private final TaskFailureLog failureLog;
    private final Logger logger;
    private final int poolSize;

    public TaskExecutor(OperationKind operation,
                        CancellationToken token,
                        TaskEvents events,
                        TaskFailureLog failureLog,
                        Logger logger,
                        int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        this.operation = Objects.requireNonNull(operation, "operation");
        this.token = Objects.requireNonNull(token, "token");
        this.events = Objects.requireNonNull(events, "events");
        this.failureLog = Objects.requireNonNull(failureLog, "failureLog");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.poolSize = poolSize;
    }

    public BatchOutcome execute(List<WorkItem> items, ProgressState progress) {
        if (items.isEmpty()) {
            return BatchOutcome.empty();
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(poolSize, items.size()), threadFactory());
        CompletionService<TransferResult> completion = new ExecutorCompletionService<>(pool);
        List<Future<TransferResult>> futures = new ArrayList<>(items.size());

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int transferred = 0;
        boolean cancelled = false;
        try {
            for (WorkItem item : items) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                futures.add(completion.submit(() -> runGuarded(item)));
            }

            for (int drained = 0; !cancelled && drained < futures.size(); drained++) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                TransferResult result = await(completion);
                switch (result.status()) {
                    case CANCELLED -> {
                        cancelled = true;
                        continue;
                    }
                    case SUCCESS -> {
                        succeeded++;
                        transferred += result.count();
                    }
                    case SKIPPED -> skipped++;
                    case ERROR -> {
                        failed++;
                        failureLog.logFailure(operation.tag(), result.item(), result.message());
                    }
                }
                events.log(result.message());
                int percent = progress.complete();
                if (progress.isReporting()) {
                    events.progress(percent);
                }
            }
        } finally {
            if (cancelled) {
                futures.forEach(f -> f.cancel(false));
            }
            pool.shutdown();
            if (cancelled) {
                awaitInFlight(pool);
            }
        }
        return new BatchOutcome(futures.size(), succeeded, failed, skipped, transferred, cancelled);
    }

    private TransferResult runGuarded(WorkItem item) {
        try {
            TransferResult result = item.action().call();
            if (result == null) {
                return TransferResult.error(item.label(), "no result");
            }
            return result;
        } catch (Exception e) {
            logger.log(Level.WARNING, operation.displayName() + " item failed: " + item.label(), e);
            return TransferResult.error(item.label(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private TransferResult await(CompletionService<TransferResult> completion) {
        try {
            return completion.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            return TransferResult.cancelled(operation.displayName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.SEVERE, operation.displayName() + " worker crashed", cause);
            return TransferResult.error(operation.displayName(), String.valueOf(cause));
        }
    }

    // lets in-flight items reach their next cancellation check and clean up partial output
    private void awaitInFlight(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(CANCEL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                logger.warning(operation.displayName() + ": workers still running after cancel");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, operation.tag() + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            try {
                t.setPriority(Thread.NORM_PRIORITY - 1);
            } catch (SecurityException ignored) {
                // priority stays at the default
            }
            return t;
        };
    }
}
