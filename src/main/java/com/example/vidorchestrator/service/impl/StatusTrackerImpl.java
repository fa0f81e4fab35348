package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.domain.SessionStatistics;
import com.example.vidorchestrator.domain.SubTaskMetadata;
import com.example.vidorchestrator.domain.SubTaskStatus;
import com.example.vidorchestrator.domain.SubTaskStatus.State;
import com.example.vidorchestrator.events.ProcessingCompletedEvent;
import com.example.vidorchestrator.events.ProcessingStatusChangedEvent;
import com.example.vidorchestrator.exceptions.ProcessingValidationException;
import com.example.vidorchestrator.service.StatusTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Predicate;

@Service
public class StatusTrackerImpl implements StatusTracker {

    private static final Logger log = LoggerFactory.getLogger(StatusTrackerImpl.class);

    private final Map<String, ProcessingSession> processingVideos = new ConcurrentHashMap<>();

    private final ApplicationEventPublisher eventPublisher;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration completedTtl;
    private final Duration cancelGrace;
    private final Duration recentWindow;

    @Autowired
    public StatusTrackerImpl(ApplicationEventPublisher eventPublisher,
                             TaskScheduler taskScheduler,
                             Clock clock,
                             @Value("${processing.status.completed-ttl-minutes:30}") long completedTtlMinutes,
                             @Value("${processing.status.cancel-grace-ms:5000}") long cancelGraceMs,
                             @Value("${processing.status.recent-window-minutes:5}") long recentWindowMinutes) {
        this.eventPublisher = eventPublisher;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.completedTtl = Duration.ofMinutes(completedTtlMinutes);
        this.cancelGrace = Duration.ofMillis(cancelGraceMs);
        this.recentWindow = Duration.ofMinutes(recentWindowMinutes);
    }

    @Override
    public ProcessingSession initialize(String videoId, String userId, String videoRecordId,
                                        Collection<String> requestedContentTypes,
                                        Collection<String> allSupportedContentTypes) {
        requireText(videoId, "videoId");
        requireText(userId, "userId");
        if (allSupportedContentTypes == null) {
            throw new ProcessingValidationException("Supported content types must be provided");
        }
        Collection<String> requested = requestedContentTypes != null ? requestedContentTypes : List.of();
        List<String> unknown = requested.stream()
                .filter(type -> !allSupportedContentTypes.contains(type))
                .toList();
        if (!unknown.isEmpty()) {
            log.warn("Ignoring requested content types {} for video {}: not supported", unknown, videoId);
        }

        ProcessingSession session = ProcessingSession.create(videoId, videoRecordId, userId,
                requested, allSupportedContentTypes, clock.instant());

        synchronized (session) {
            ProcessingSession previous = processingVideos.put(videoId, session);
            if (previous != null) {
                previous.cancelRemoval();
                log.info("Re-initialized processing status for video {}; previous session replaced", videoId);
            }
            log.info("Initialized processing status for video {} (user: {}, record: {}, requested: {}, supported: {})",
                    videoId, userId, videoRecordId, requested.size(), allSupportedContentTypes.size());
            // Nothing requested and no transcript yet: still pending, completion waits for the transcript
            return applyAndPublish(session);
        }
    }

    @Override
    public void updateTranscriptStatus(String videoId, State status, String error) {
        requireStatus(status);
        withCurrentSession(videoId, "transcript", session -> {
            if (session.isCompleted()) {
                log.debug("Ignoring transcript update to {} for video {}: session already completed (cancelled: {})",
                        status.value(), videoId, session.isCancelled());
                return;
            }
            session.getTranscript().apply(status, error, null, clock.instant());
            log.debug("Updated transcript status for {}: {}", videoId, status.value());
            applyAndPublish(session);
        });
    }

    @Override
    public void updateContentStatus(String videoId, String contentType, State status,
                                    String error, SubTaskMetadata metadata) {
        requireStatus(status);
        withCurrentSession(videoId, contentType, session -> {
            SubTaskStatus contentStatus = session.getContentStatus(contentType);
            if (contentStatus == null) {
                log.warn("Content type {} not found for video {}. Available: {}",
                        contentType, videoId, session.getContent().keySet());
                return;
            }
            if (session.isCompleted()) {
                log.debug("Ignoring {} update to {} for video {}: session already completed (cancelled: {})",
                        contentType, status.value(), videoId, session.isCancelled());
                return;
            }
            if (contentStatus.getStatus() == State.SKIPPED) {
                log.warn("Ignoring {} update to {} for video {}: content type was not requested",
                        contentType, status.value(), videoId);
                return;
            }
            contentStatus.apply(status, error, metadata, clock.instant());
            log.debug("Updated {} status for {}: {}", contentType, videoId, status.value());
            applyAndPublish(session);
        });
    }

    @Override
    public boolean cancel(String videoId) {
        boolean[] found = {false};
        withCurrentSession(videoId, "cancel", session -> {
            found[0] = true;
            int cancelledEntries = session.cancelPending(clock.instant());
            log.info("Cancelled processing for video {} ({} pending entries cancelled)", videoId, cancelledEntries);
            publishStatus(session.snapshot());
            session.replaceRemovalHandle(scheduleRemoval(videoId, session, cancelGrace, "cancelled"));
        });
        return found[0];
    }

    @Override
    public Optional<ProcessingSession> getVideoStatus(String videoId) {
        if (videoId == null) {
            return Optional.empty();
        }
        ProcessingSession session = processingVideos.get(videoId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.snapshot());
        }
    }

    @Override
    public List<ProcessingSession> getUserSessions(String userId) {
        List<ProcessingSession> userVideos = new ArrayList<>();
        forEachUserSession(userId, userVideos::add);
        return userVideos;
    }

    @Override
    public void forEachUserSession(String userId, Consumer<ProcessingSession> action) {
        Instant recentCutoff = clock.instant().minus(recentWindow);
        List<ProcessingSession> owned = new ArrayList<>();
        for (ProcessingSession session : processingVideos.values()) {
            if (session.getUserId().equals(userId)) {
                owned.add(session);
            }
        }
        owned.sort(Comparator.comparing(ProcessingSession::getStartTime).reversed());

        for (ProcessingSession session : owned) {
            synchronized (session) {
                // Replaced or removed while we were collecting
                if (processingVideos.get(session.getVideoId()) != session) {
                    continue;
                }
                boolean inFlight = !session.isCompleted();
                boolean recentlyCompleted = session.isCompleted()
                        && session.getCompletedAt() != null
                        && session.getCompletedAt().isAfter(recentCutoff);
                if (inFlight || recentlyCompleted) {
                    action.accept(session.snapshot());
                }
            }
        }
    }

    @Override
    public int clearCompletedForUser(String userId) {
        int cleared = removeWhere(session -> session.getUserId().equals(userId) && session.isCompleted());
        if (cleared > 0) {
            log.info("Cleared {} completed processing sessions for user {} (no active connections)", cleared, userId);
        }
        return cleared;
    }

    @Override
    public int forceClearForUser(String userId) {
        int cleared = removeWhere(session -> session.getUserId().equals(userId));
        if (cleared > 0) {
            log.warn("Force-cleared {} processing sessions for user {}; late task callbacks will be dropped",
                    cleared, userId);
        }
        return cleared;
    }

    @Override
    public SessionStatistics getStatistics() {
        int total = 0;
        int completed = 0;
        int processing = 0;
        int failedContent = 0;
        for (ProcessingSession session : processingVideos.values()) {
            ProcessingSession snapshot;
            synchronized (session) {
                snapshot = session.snapshot();
            }
            total++;
            if (snapshot.isCompleted()) {
                completed++;
            } else {
                processing++;
            }
            failedContent += (int) snapshot.getContent().values().stream()
                    .filter(status -> status.getStatus() == State.FAILED)
                    .count();
        }
        return new SessionStatistics(total, completed, processing, failedContent);
    }

    @Override
    public int purgeStale(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int purged = removeWhere(session -> session.getLastUpdate().isBefore(cutoff));
        if (purged > 0) {
            log.info("Cleaned up {} processing sessions with no update since {}", purged, cutoff);
        }
        return purged;
    }

    // Helper methods

    /**
     * Runs the completion check on a session that was just mutated, publishes the resulting
     * snapshot and, on first completion, the completed event and the TTL timer.
     * Caller holds the session monitor.
     */
    private ProcessingSession applyAndPublish(ProcessingSession session) {
        Instant now = clock.instant();
        session.touch(now);
        boolean justCompleted = false;
        if (!session.isCompleted() && session.allSubTasksTerminal()) {
            session.markCompleted(now);
            justCompleted = true;
        }

        ProcessingSession snapshot = session.snapshot();
        publishStatus(snapshot);

        if (justCompleted) {
            log.info("All processing completed for video {}", session.getVideoId());
            publishCompleted(snapshot);
            session.replaceRemovalHandle(scheduleRemoval(session.getVideoId(), session, completedTtl, "completed"));
        }
        return snapshot;
    }

    /**
     * Looks up the live session and runs the action under its monitor. If the session was
     * replaced between lookup and lock, the lookup is repeated so the action hits the current one.
     */
    private void withCurrentSession(String videoId, String target, Consumer<ProcessingSession> action) {
        while (true) {
            ProcessingSession session = videoId != null ? processingVideos.get(videoId) : null;
            if (session == null) {
                log.warn("No video status found for {} when updating {}", videoId, target);
                return;
            }
            synchronized (session) {
                if (processingVideos.get(videoId) == session) {
                    action.accept(session);
                    return;
                }
            }
        }
    }

    private ScheduledFuture<?> scheduleRemoval(String videoId, ProcessingSession session, Duration delay, String reason) {
        Instant removeAt = clock.instant().plus(delay);
        return taskScheduler.schedule(() -> {
            if (processingVideos.remove(videoId, session)) {
                log.info("Removed {} video {} from processing status", reason, videoId);
            } else {
                log.debug("Skipped removal of {} video {}: session already replaced or removed", reason, videoId);
            }
        }, removeAt);
    }

    private int removeWhere(Predicate<ProcessingSession> condition) {
        int removed = 0;
        for (Map.Entry<String, ProcessingSession> entry : Set.copyOf(processingVideos.entrySet())) {
            ProcessingSession session = entry.getValue();
            if (condition.test(session) && processingVideos.remove(entry.getKey(), session)) {
                session.cancelRemoval();
                removed++;
            }
        }
        return removed;
    }

    private void publishStatus(ProcessingSession snapshot) {
        try {
            eventPublisher.publishEvent(new ProcessingStatusChangedEvent(
                    this, snapshot.getUserId(), snapshot.getVideoId(), snapshot));
        } catch (Exception e) {
            log.error("Failed to publish ProcessingStatusChangedEvent [Video: {}, User: {}]: {}",
                    snapshot.getVideoId(), snapshot.getUserId(), e.getMessage(), e);
        }
    }

    private void publishCompleted(ProcessingSession snapshot) {
        try {
            eventPublisher.publishEvent(new ProcessingCompletedEvent(this, snapshot));
        } catch (Exception e) {
            log.error("Failed to publish ProcessingCompletedEvent [Video: {}]: {}",
                    snapshot.getVideoId(), e.getMessage(), e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ProcessingValidationException(name + " is required");
        }
    }

    private static void requireStatus(State status) {
        if (status == null) {
            throw new ProcessingValidationException("status is required");
        }
    }
}
