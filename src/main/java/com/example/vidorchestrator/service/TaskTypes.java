package com.example.vidorchestrator.service;

/**
 * Task type names shared by the orchestrator and the task handlers.
 */
public final class TaskTypes {

    public static final String EXTRACT_TRANSCRIPT = "extract_transcript";
    public static final String GENERATE_CONTENT = "generate_content";
    public static final String EXTRACT_METADATA = "extract_metadata";
    public static final String GENERATE_SUMMARY = "generate_summary";
    public static final String GENERATE_TITLES = "generate_titles";
    public static final String GENERATE_THUMBNAILS = "generate_thumbnails";

    // Payload key naming the content type of a generate_content task
    public static final String CONTENT_TYPE_KEY = "contentType";

    public static final int DEFAULT_PRIORITY = 1;

    private TaskTypes() {
    }

    /**
     * Queue priority used when the caller does not give one. Higher runs first.
     */
    public static int priorityOf(String taskType) {
        if (taskType == null) {
            return DEFAULT_PRIORITY;
        }
        return switch (taskType) {
            case EXTRACT_TRANSCRIPT -> 5;
            case EXTRACT_METADATA -> 4;
            case GENERATE_CONTENT, GENERATE_SUMMARY -> 3;
            case GENERATE_TITLES -> 2;
            default -> DEFAULT_PRIORITY;
        };
    }
}
