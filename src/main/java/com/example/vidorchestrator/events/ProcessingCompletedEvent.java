package com.example.vidorchestrator.events;

import com.example.vidorchestrator.domain.ProcessingSession;
import org.springframework.context.ApplicationEvent;

/**
 * Event published once when a session reaches completion on its own (not by cancellation).
 */
public class ProcessingCompletedEvent extends ApplicationEvent {

    private final ProcessingSession snapshot;

    public ProcessingCompletedEvent(Object source, ProcessingSession snapshot) {
        super(source);
        if (snapshot == null) {
            throw new IllegalArgumentException("Completed session snapshot cannot be null");
        }
        this.snapshot = snapshot;
    }

    public ProcessingSession getSnapshot() {
        return snapshot;
    }

    public String getVideoId() {
        return snapshot.getVideoId();
    }

    public String getVideoRecordId() {
        return snapshot.getVideoRecordId();
    }
}
