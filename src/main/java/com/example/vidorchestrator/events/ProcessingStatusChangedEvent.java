package com.example.vidorchestrator.events;

import com.example.vidorchestrator.domain.ProcessingSession;
import org.springframework.context.ApplicationEvent;

/**
 * Event published after every mutation of a tracked processing session.
 * Published synchronously while the session is locked, so listeners observe
 * changes to one video in the order they were applied.
 */
public class ProcessingStatusChangedEvent extends ApplicationEvent {

    private final String userId;
    private final String videoId;
    private final ProcessingSession snapshot;

    /**
     * Create a new ProcessingStatusChangedEvent.
     *
     * @param source   The component that published the event (usually 'this').
     * @param userId   The owner of the session.
     * @param videoId  The external video ID.
     * @param snapshot A detached copy of the session after the mutation.
     */
    public ProcessingStatusChangedEvent(Object source, String userId, String videoId, ProcessingSession snapshot) {
        super(source);
        if (userId == null || videoId == null || snapshot == null) {
            throw new IllegalArgumentException("Event details (userId, videoId, snapshot) cannot be null");
        }
        this.userId = userId;
        this.videoId = videoId;
        this.snapshot = snapshot;
    }

    public String getUserId() {
        return userId;
    }

    public String getVideoId() {
        return videoId;
    }

    public ProcessingSession getSnapshot() {
        return snapshot;
    }
}
