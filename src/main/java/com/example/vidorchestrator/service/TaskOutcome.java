package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.SubTaskMetadata;

/**
 * Result of executing one task.
 *
 * @param success       whether the task did its work
 * @param result        optional value produced by the task (not interpreted by the queue)
 * @param failureReason human-readable reason, set on failure
 * @param metadata      optional failure diagnostics forwarded to the status snapshot
 */
public record TaskOutcome(
        boolean success,
        Object result,
        String failureReason,
        SubTaskMetadata metadata
) {

    public static TaskOutcome ok() {
        return new TaskOutcome(true, null, null, null);
    }

    public static TaskOutcome ok(Object result) {
        return new TaskOutcome(true, result, null, null);
    }

    public static TaskOutcome failure(String reason) {
        return new TaskOutcome(false, null, reason, null);
    }

    public static TaskOutcome failure(String reason, SubTaskMetadata metadata) {
        return new TaskOutcome(false, null, reason, metadata);
    }
}
