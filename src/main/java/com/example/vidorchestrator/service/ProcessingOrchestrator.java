package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.domain.ProcessingStatistics;
import com.example.vidorchestrator.domain.QueueItem;
import com.example.vidorchestrator.domain.QueueStatus;
import com.example.vidorchestrator.domain.SubTaskStatus;
import com.example.vidorchestrator.domain.SubTaskStatus.State;
import com.example.vidorchestrator.events.TaskFinishedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Composition root of the processing layer. Wires the task pipeline (transcript first, then one
 * content generation task per requested content type) and exposes the operations the web
 * layer calls. Owns the queue scheduler lifecycle.
 */
@Service
public class ProcessingOrchestrator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProcessingOrchestrator.class);

    static final String VIDEO_RECORD_ID_KEY = "videoRecordId";

    private final StatusTracker statusTracker;
    private final TaskQueue taskQueue;
    private final NotificationFanout notificationFanout;
    private final ContentTypeCatalog contentTypeCatalog;
    private final Duration staleMaxAge;
    private final int queueCleanupMaxAgeHours;

    public ProcessingOrchestrator(StatusTracker statusTracker,
                                  TaskQueue taskQueue,
                                  NotificationFanout notificationFanout,
                                  ContentTypeCatalog contentTypeCatalog,
                                  @Value("${processing.status.stale-max-age-hours:2}") long staleMaxAgeHours,
                                  @Value("${processing.queue.cleanup-max-age-hours:24}") int queueCleanupMaxAgeHours) {
        this.statusTracker = statusTracker;
        this.taskQueue = taskQueue;
        this.notificationFanout = notificationFanout;
        this.contentTypeCatalog = contentTypeCatalog;
        this.staleMaxAge = Duration.ofHours(staleMaxAgeHours);
        this.queueCleanupMaxAgeHours = queueCleanupMaxAgeHours;
    }

    /**
     * Starts tracking a video and enqueues its transcript extraction.
     *
     * @param videoId               The video.
     * @param userId                The owner; status pushes go to this user's connections.
     * @param videoRecordId         The persisted video record, may be null.
     * @param requestedContentTypes Content types to generate; the others are skipped.
     * @return Snapshot of the fresh session.
     */
    public ProcessingSession beginProcessing(String videoId, String userId, String videoRecordId,
                                             Collection<String> requestedContentTypes) {
        List<String> supported = contentTypeCatalog.getSupportedContentTypes();
        ProcessingSession session = statusTracker.initialize(videoId, userId, videoRecordId,
                requestedContentTypes, supported);

        Map<String, String> payload = new HashMap<>();
        if (videoRecordId != null) {
            payload.put(VIDEO_RECORD_ID_KEY, videoRecordId);
        }
        taskQueue.enqueue(videoId, TaskTypes.EXTRACT_TRANSCRIPT, TaskTypes.priorityOf(TaskTypes.EXTRACT_TRANSCRIPT), payload);
        log.info("Processing started for video {} by user {}", videoId, userId);
        return session;
    }

    /**
     * Cancels a video owned by the user. Tasks already running finish, but their results are ignored.
     *
     * @return false if the video is not tracked for this user.
     */
    public boolean cancel(String videoId, String userId) {
        if (getVideoStatus(videoId, userId).isEmpty()) {
            return false;
        }
        return statusTracker.cancel(videoId);
    }

    /**
     * Status of a video, only if it belongs to the given user.
     */
    public Optional<ProcessingSession> getVideoStatus(String videoId, String userId) {
        return statusTracker.getVideoStatus(videoId)
                .filter(session -> session.getUserId().equals(userId));
    }

    public List<ProcessingSession> getUserSessions(String userId) {
        return statusTracker.getUserSessions(userId);
    }

    public int forceClear(String userId) {
        return statusTracker.forceClearForUser(userId);
    }

    public void connect(String userId, SseEmitter emitter) {
        notificationFanout.register(userId, emitter);
    }

    /**
     * Enqueues an arbitrary task.
     *
     * @param priority Queue priority; null picks the default for the task type.
     */
    public QueueItem enqueue(String videoId, String taskType, Integer priority, Map<String, String> payload) {
        int effectivePriority = priority != null ? priority : TaskTypes.priorityOf(taskType);
        return taskQueue.enqueue(videoId, taskType, effectivePriority, payload);
    }

    public QueueStatus getQueueStatus() {
        return taskQueue.getQueueStatus();
    }

    public int retryFailedTasks() {
        return taskQueue.retryFailedTasks();
    }

    public int cleanupQueue(int maxAgeHours) {
        return taskQueue.cleanup(maxAgeHours);
    }

    public ProcessingStatistics getStatistics() {
        return new ProcessingStatistics(statusTracker.getStatistics(),
                notificationFanout.getActiveConnectionCount(),
                taskQueue.getQueueStatus());
    }

    @EventListener
    public void onTaskFinished(TaskFinishedEvent event) {
        String videoId = event.getVideoId();
        TaskOutcome outcome = event.getOutcome();
        switch (event.getTaskType()) {
            case TaskTypes.EXTRACT_TRANSCRIPT -> {
                if (outcome.success()) {
                    onTranscriptReady(videoId, event.getPayload());
                } else {
                    onTranscriptFailed(videoId, outcome);
                }
            }
            case TaskTypes.GENERATE_CONTENT -> {
                String contentType = event.getPayload().get(TaskTypes.CONTENT_TYPE_KEY);
                if (contentType == null) {
                    log.warn("generate_content task for video {} finished without a {} payload",
                            videoId, TaskTypes.CONTENT_TYPE_KEY);
                    return;
                }
                if (outcome.success()) {
                    statusTracker.updateContentStatus(videoId, contentType, State.COMPLETED, null, null);
                } else {
                    statusTracker.updateContentStatus(videoId, contentType, State.FAILED,
                            outcome.failureReason(), outcome.metadata());
                }
            }
            default -> log.debug("Task {} for video {} finished (success: {})",
                    event.getTaskType(), videoId, outcome.success());
        }
    }

    @Scheduled(initialDelayString = "${processing.maintenance.interval-ms:3600000}",
            fixedDelayString = "${processing.maintenance.interval-ms:3600000}")
    public void runMaintenance() {
        int purged = statusTracker.purgeStale(staleMaxAge);
        int deleted = taskQueue.cleanup(queueCleanupMaxAgeHours);
        log.info("Maintenance finished: {} stale sessions purged, {} completed queue items deleted", purged, deleted);
    }

    // Lifecycle: the queue loop runs while the application context is running

    @Override
    public void start() {
        taskQueue.start();
    }

    @Override
    public void stop() {
        taskQueue.stop();
    }

    @Override
    public boolean isRunning() {
        return taskQueue.isLoopActive();
    }

    // Helper methods

    private void onTranscriptReady(String videoId, Map<String, String> transcriptPayload) {
        statusTracker.updateTranscriptStatus(videoId, State.COMPLETED, null);

        Optional<ProcessingSession> session = statusTracker.getVideoStatus(videoId);
        if (session.isEmpty() || session.get().isCompleted()) {
            log.debug("Not enqueuing content generation for video {}: session gone or completed", videoId);
            return;
        }
        List<String> pendingTypes = pendingContentTypes(session.get());
        for (String contentType : pendingTypes) {
            Map<String, String> payload = new HashMap<>(transcriptPayload);
            payload.put(TaskTypes.CONTENT_TYPE_KEY, contentType);
            taskQueue.enqueue(videoId, TaskTypes.GENERATE_CONTENT, TaskTypes.priorityOf(TaskTypes.GENERATE_CONTENT), payload);
        }
        log.info("Transcript ready for video {}, enqueued {} content tasks", videoId, pendingTypes.size());
    }

    private void onTranscriptFailed(String videoId, TaskOutcome outcome) {
        statusTracker.updateTranscriptStatus(videoId, State.FAILED, outcome.failureReason());

        Optional<ProcessingSession> session = statusTracker.getVideoStatus(videoId);
        if (session.isEmpty()) {
            return;
        }
        String reason = "Transcript extraction failed: " + outcome.failureReason();
        for (String contentType : pendingContentTypes(session.get())) {
            statusTracker.updateContentStatus(videoId, contentType, State.FAILED, reason, outcome.metadata());
        }
    }

    private static List<String> pendingContentTypes(ProcessingSession session) {
        return session.getContent().entrySet().stream()
                .filter(entry -> entry.getValue().getStatus() == SubTaskStatus.State.PENDING)
                .map(Map.Entry::getKey)
                .toList();
    }
}
