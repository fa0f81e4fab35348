package com.example.vidorchestrator.events;

import com.example.vidorchestrator.service.TaskOutcome;
import org.springframework.context.ApplicationEvent;

import java.util.Map;

/**
 * Event published by the task queue when a task ends for good: it succeeded, or it
 * failed with no retries left. Transient failures that are requeued publish nothing.
 */
public class TaskFinishedEvent extends ApplicationEvent {

    private final String videoId;
    private final String taskType;
    private final Map<String, String> payload;
    private final TaskOutcome outcome;

    public TaskFinishedEvent(Object source, String videoId, String taskType, Map<String, String> payload,
                             TaskOutcome outcome) {
        super(source);
        if (videoId == null || taskType == null || outcome == null) {
            throw new IllegalArgumentException("Event details (videoId, taskType, outcome) cannot be null");
        }
        this.videoId = videoId;
        this.taskType = taskType;
        this.payload = payload != null ? Map.copyOf(payload) : Map.of();
        this.outcome = outcome;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getTaskType() {
        return taskType;
    }

    public Map<String, String> getPayload() {
        return payload;
    }

    public TaskOutcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome.success();
    }
}
