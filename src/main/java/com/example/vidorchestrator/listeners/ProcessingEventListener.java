package com.example.vidorchestrator.listeners;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.events.ProcessingCompletedEvent;
import com.example.vidorchestrator.events.ProcessingStatusChangedEvent;
import com.example.vidorchestrator.service.NotificationFanout;
import com.example.vidorchestrator.service.VideoRecordFinalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
public class ProcessingEventListener {

    private static final Logger log = LoggerFactory.getLogger(ProcessingEventListener.class);

    private final NotificationFanout notificationFanout;
    private final ObjectProvider<VideoRecordFinalizer> videoRecordFinalizer;

    public ProcessingEventListener(NotificationFanout notificationFanout,
                                   ObjectProvider<VideoRecordFinalizer> videoRecordFinalizer) {
        this.notificationFanout = notificationFanout;
        this.videoRecordFinalizer = videoRecordFinalizer;
    }

    /**
     * Pushes the snapshot to the owner's connections. Runs synchronously on the publishing
     * thread, which holds the session monitor, so pushes for one video arrive in mutation order.
     *
     * @param event The ProcessingStatusChangedEvent containing the snapshot.
     */
    @EventListener
    public void handleStatusChange(ProcessingStatusChangedEvent event) {
        try {
            notificationFanout.emit(event.getUserId(), event.getVideoId(), event.getSnapshot());
            log.debug("Triggered status push for event: [Video: {}, User: {}]", event.getVideoId(), event.getUserId());
        } catch (Exception e) {
            log.error("Unexpected error in ProcessingEventListener while pushing status for user {}: {}",
                    event.getUserId(), e.getMessage(), e);
        }
    }

    /**
     * Hands a naturally completed session to the finalizer, if one is configured.
     * Marked @Async so a slow record store does not hold up the task that completed the session.
     *
     * @param event The ProcessingCompletedEvent.
     */
    @Async
    @EventListener
    public void handleProcessingCompleted(ProcessingCompletedEvent event) {
        ProcessingSession session = event.getSnapshot();
        VideoRecordFinalizer finalizer = videoRecordFinalizer.getIfAvailable();
        if (finalizer == null) {
            log.debug("No VideoRecordFinalizer configured; completion of video {} not persisted", event.getVideoId());
            return;
        }
        if (event.getVideoRecordId() == null) {
            log.warn("Video {} completed without a video record id; skipping finalization", event.getVideoId());
            return;
        }
        try {
            finalizer.finalizeProcessing(session);
            log.info("Finalized processing for video {} (record: {})", event.getVideoId(), event.getVideoRecordId());
        } catch (Exception e) {
            log.error("Failed to finalize processing for video {} (record: {}): {}",
                    event.getVideoId(), event.getVideoRecordId(), e.getMessage(), e);
        }
    }
}
