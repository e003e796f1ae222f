package com.aiv.organizer.core.task;

import com.aiv.organizer.core.transfer.TransferResult;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One unit of work of a batch. {@code label} names the item in logs when the action throws.
 */
public record WorkItem(String label, Callable<TransferResult> action) {
    public WorkItem {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(action, "action");
    }

    public static WorkItem of(String label, Callable<TransferResult> action) {
        return new WorkItem(label, action);
    }
}
