package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.exceptions.TaskExecutionException;
import com.example.vidorchestrator.service.ProcessingTaskExecutor;
import com.example.vidorchestrator.service.TaskHandler;
import com.example.vidorchestrator.service.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes each task type to the {@link TaskHandler} bean registered for it and turns
 * handler exceptions into failed outcomes.
 */
@Service
public class DelegatingTaskExecutor implements ProcessingTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DelegatingTaskExecutor.class);

    private final Map<String, TaskHandler> handlers = new HashMap<>();

    @Autowired
    public DelegatingTaskExecutor(ObjectProvider<TaskHandler> taskHandlers) {
        this(taskHandlers.orderedStream().toList());
    }

    public DelegatingTaskExecutor(List<TaskHandler> taskHandlers) {
        for (TaskHandler handler : taskHandlers) {
            TaskHandler existing = handlers.putIfAbsent(handler.taskType(), handler);
            if (existing != null) {
                throw new IllegalStateException("Duplicate task handler for type '" + handler.taskType() + "': "
                        + existing.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered task handlers: {}", handlers.keySet());
    }

    @Override
    public TaskOutcome execute(String videoId, String taskType, Map<String, String> payload) {
        TaskHandler handler = handlers.get(taskType);
        if (handler == null) {
            log.warn("No handler for task type {} (video {})", taskType, videoId);
            return TaskOutcome.failure("Unknown task type: " + taskType);
        }
        try {
            TaskOutcome outcome = handler.handle(videoId, payload != null ? payload : Map.of());
            return outcome != null ? outcome : TaskOutcome.ok();
        } catch (TaskExecutionException e) {
            log.warn("Task {} failed for video {}: {}", taskType, videoId, e.getMessage());
            return TaskOutcome.failure(e.getMessage(), e.getMetadata());
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} handler for video {}", taskType, videoId, e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return TaskOutcome.failure(reason);
        }
    }

    public Set<String> getRegisteredTaskTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
