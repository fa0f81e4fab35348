package com.example.vidorchestrator.exceptions;

import com.example.vidorchestrator.domain.SubTaskMetadata;

/**
 * Thrown by a task handler when its work fails. Optional metadata (error code, suggested fix,
 * provider...) ends up in the content status shown to the user.
 */
public class TaskExecutionException extends RuntimeException {

    private final SubTaskMetadata metadata; // null when the handler has no diagnostics

    public TaskExecutionException(String message) {
        super(message);
        this.metadata = null;
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.metadata = null;
    }

    public TaskExecutionException(String message, SubTaskMetadata metadata) {
        super(message);
        this.metadata = metadata;
    }

    public TaskExecutionException(String message, Throwable cause, SubTaskMetadata metadata) {
        super(message, cause);
        this.metadata = metadata;
    }

    /**
     * Gets the failure diagnostics, if the handler provided any.
     * @return The metadata, or null if not available.
     */
    public SubTaskMetadata getMetadata() {
        return metadata;
    }
}
