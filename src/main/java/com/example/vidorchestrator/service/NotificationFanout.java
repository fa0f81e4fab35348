package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.ProcessingSession;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Registry of live SSE connections per user and push of session snapshots to them.
 */
public interface NotificationFanout {

    String STATUS_EVENT_NAME = "processing-status-update";

    /**
     * Registers a connection and immediately pushes the user's current sessions to it only.
     *
     * @param userId  The connected user.
     * @param emitter The SseEmitter instance.
     */
    void register(String userId, SseEmitter emitter);

    /**
     * Removes a connection. When the user's last connection goes away, the user's
     * completed sessions are cleared from the tracker.
     *
     * @param userId  The user.
     * @param emitter The emitter to remove.
     */
    void unregister(String userId, SseEmitter emitter);

    /**
     * Pushes {@code {videoId, status}} to every live connection of the user. A connection that
     * fails to receive it is unregistered; delivery to the others continues.
     *
     * @param userId  The target user.
     * @param videoId The video the snapshot belongs to.
     * @param session The session snapshot.
     */
    void emit(String userId, String videoId, ProcessingSession session);

    int getActiveConnectionCount();
}
