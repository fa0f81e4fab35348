package com.example.vidorchestrator.service;

import java.util.Map;

/**
 * Implementation of one task type (transcript extraction, content generation, metadata...).
 * Handlers are Spring beans picked up by the executor; they may throw
 * {@link com.example.vidorchestrator.exceptions.TaskExecutionException} or any runtime exception to fail.
 */
public interface TaskHandler {

    String taskType();

    TaskOutcome handle(String videoId, Map<String, String> payload);
}
