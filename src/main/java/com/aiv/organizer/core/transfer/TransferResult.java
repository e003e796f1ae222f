package com.aiv.organizer.core.transfer;

import java.util.Objects;

/**
 * Outcome of one unit of work. Primitives never throw to their caller; every failure is
 * converted into an {@link Status#ERROR} result whose message starts with {@link #ERROR_MARKER}.
 */
public record TransferResult(Status status, String item, String message, int count) {
    public static final String ERROR_MARKER = "ERROR: ";
    public static final String SKIP_MARKER = "SKIP: ";

    public enum Status {
        SUCCESS,
        SKIPPED,
        ERROR,
        CANCELLED
    }

    public TransferResult {
        Objects.requireNonNull(status, "status");
        item = item == null ? "" : item;
        message = message == null ? "" : message;
    }

    public static TransferResult success(String item, String message) {
        return new TransferResult(Status.SUCCESS, item, message, 1);
    }

    public static TransferResult success(String item, String message, int count) {
        return new TransferResult(Status.SUCCESS, item, message, count);
    }

    public static TransferResult skipped(String item, String reason) {
        return new TransferResult(Status.SKIPPED, item, SKIP_MARKER + reason, 0);
    }

    public static TransferResult error(String item, String reason) {
        return new TransferResult(Status.ERROR, item, ERROR_MARKER + reason, 0);
    }

    public static TransferResult cancelled(String item) {
        return new TransferResult(Status.CANCELLED, item, "Cancelled: " + item, 0);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
