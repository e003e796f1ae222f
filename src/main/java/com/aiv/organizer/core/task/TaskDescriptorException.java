package com.aiv.organizer.core.task;

/**
 * Raised when a task file cannot be turned into a {@link TaskDescriptor}.
 */
public class TaskDescriptorException extends Exception {
    private final String key;

    public TaskDescriptorException(String message, String key) {
        super(message);
        this.key = key;
    }

    public TaskDescriptorException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /** The offending field, or null when the problem is not tied to one field. */
    public String getKey() {
        return key;
    }
}
