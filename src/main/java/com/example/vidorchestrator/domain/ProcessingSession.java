package com.example.vidorchestrator.domain;

import com.example.vidorchestrator.domain.SubTaskStatus.State;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory processing record for one video: the transcript plus one entry per
 * content type known at initialization time.
 * <p>
 * Live instances are owned by the status tracker and mutated only while holding
 * the instance monitor. Callers outside the tracker receive {@link #snapshot()} copies.
 */
public class ProcessingSession {

    private final String videoId;
    private final String videoRecordId;
    private final String userId;
    private final Instant startTime;
    private volatile Instant lastUpdate;
    private Instant completedAt;
    private volatile boolean completed;
    private volatile boolean cancelled;
    private final SubTaskStatus transcript;
    private final Map<String, SubTaskStatus> content;

    @JsonIgnore
    private volatile ScheduledFuture<?> removalHandle;

    public ProcessingSession(String videoId, String videoRecordId, String userId, Instant startTime) {
        this(videoId, videoRecordId, userId, startTime, new SubTaskStatus(State.PENDING), new LinkedHashMap<>());
    }

    private ProcessingSession(String videoId, String videoRecordId, String userId, Instant startTime,
                              SubTaskStatus transcript, Map<String, SubTaskStatus> content) {
        this.videoId = videoId;
        this.videoRecordId = videoRecordId;
        this.userId = userId;
        this.startTime = startTime;
        this.lastUpdate = startTime;
        this.transcript = transcript;
        this.content = content;
    }

    /**
     * Transcript is terminal and every content entry is terminal.
     */
    public boolean allSubTasksTerminal() {
        if (!transcript.getStatus().isTerminal()) {
            return false;
        }
        return content.values().stream().allMatch(status -> status.getStatus().isTerminal());
    }

    public boolean hasPendingWork() {
        return transcript.getStatus() == State.PENDING
                || content.values().stream().anyMatch(status -> status.getStatus() == State.PENDING);
    }

    public void markCompleted(Instant now) {
        this.completed = true;
        this.completedAt = now;
        this.lastUpdate = now;
    }

    /**
     * Forces every pending entry to cancelled and closes the session.
     *
     * @return number of entries that were still pending
     */
    public int cancelPending(Instant now) {
        int cancelledEntries = 0;
        if (transcript.getStatus() == State.PENDING) {
            transcript.apply(State.CANCELLED, null, null, now);
            cancelledEntries++;
        }
        for (SubTaskStatus status : content.values()) {
            if (status.getStatus() == State.PENDING) {
                status.apply(State.CANCELLED, null, null, now);
                cancelledEntries++;
            }
        }
        this.cancelled = true;
        if (!completed) {
            this.completed = true;
            this.completedAt = now;
        }
        this.lastUpdate = now;
        return cancelledEntries;
    }

    public void touch(Instant now) {
        this.lastUpdate = now;
    }

    /**
     * Deep copy without the removal handle, safe to hand to serializers and other threads.
     */
    public ProcessingSession snapshot() {
        Map<String, SubTaskStatus> contentCopy = new LinkedHashMap<>();
        content.forEach((type, status) -> contentCopy.put(type, status.copy()));
        ProcessingSession copy = new ProcessingSession(videoId, videoRecordId, userId, startTime,
                transcript.copy(), contentCopy);
        copy.lastUpdate = lastUpdate;
        copy.completedAt = completedAt;
        copy.completed = completed;
        copy.cancelled = cancelled;
        return copy;
    }

    /**
     * Replaces the pending removal timer, cancelling the previous one.
     */
    public void replaceRemovalHandle(ScheduledFuture<?> handle) {
        cancelRemoval();
        this.removalHandle = handle;
    }

    /**
     * Safe to call without holding the monitor.
     */
    public void cancelRemoval() {
        ScheduledFuture<?> handle = removalHandle;
        if (handle != null) {
            handle.cancel(false);
            removalHandle = null;
        }
    }

    public String getVideoId() {
        return videoId;
    }

    public String getVideoRecordId() {
        return videoRecordId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public SubTaskStatus getTranscript() {
        return transcript;
    }

    public Map<String, SubTaskStatus> getContent() {
        return Collections.unmodifiableMap(content);
    }

    @JsonIgnore
    public SubTaskStatus getContentStatus(String contentType) {
        return content.get(contentType);
    }

    void putContent(String contentType, SubTaskStatus status) {
        content.put(contentType, status);
    }

    /**
     * Builds a fresh session. Every supported type that was not requested starts as
     * {@link State#SKIPPED} and never transitions.
     */
    public static ProcessingSession create(String videoId, String videoRecordId, String userId,
                                           Collection<String> requestedContentTypes,
                                           Collection<String> allSupportedContentTypes,
                                           Instant now) {
        ProcessingSession session = new ProcessingSession(videoId, videoRecordId, userId, now);
        for (String contentType : allSupportedContentTypes) {
            SubTaskStatus status = new SubTaskStatus(State.PENDING);
            if (!requestedContentTypes.contains(contentType)) {
                status.apply(State.SKIPPED, null, null, now);
            }
            session.putContent(contentType, status);
        }
        return session;
    }
}
