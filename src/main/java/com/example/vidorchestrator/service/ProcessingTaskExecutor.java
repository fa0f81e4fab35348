package com.example.vidorchestrator.service;

import java.util.Map;

/**
 * Executes one task. Implementations may block for seconds to tens of seconds; they are
 * called from queue worker threads, never while the queue holds its dequeue lock.
 */
public interface ProcessingTaskExecutor {

    /**
     * @param videoId  The video the task belongs to.
     * @param taskType The task type, e.g. {@code extract_transcript}.
     * @param payload  Task arguments, never null.
     * @return The outcome. Implementations report failures through the outcome rather than throwing.
     */
    TaskOutcome execute(String videoId, String taskType, Map<String, String> payload);
}
