package com.example.vidorchestrator.domain;

/**
 * Optional diagnostics attached to a failed content type, shown to the user
 * next to the error message.
 */
public record SubTaskMetadata(
        String errorCode,
        String errorType,
        Boolean isFiltered,
        String suggestedFix,
        String failureReason,
        String providerUsed
) {
    public static final SubTaskMetadata EMPTY = new SubTaskMetadata(null, null, null, null, null, null);
}
