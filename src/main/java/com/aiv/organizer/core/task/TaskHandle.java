package com.aiv.organizer.core.task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A task started with {@link TaskRunner#start()}.
 */
public final class TaskHandle {
    private final TaskRunner runner;
    private final CompletableFuture<TaskState> completion;

    TaskHandle(TaskRunner runner, CompletableFuture<TaskState> completion) {
        this.runner = runner;
        this.completion = completion;
    }

    public void stop() {
        runner.stop();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public TaskState state() {
        return runner.state();
    }

    /** Blocks until the task reaches a terminal state. */
    public TaskState await() throws InterruptedException {
        try {
            return completion.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task thread ended abnormally", e.getCause());
        }
    }

    public TaskState await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task thread ended abnormally", e.getCause());
        }
    }
}
