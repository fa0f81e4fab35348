package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.service.NotificationFanout;
import com.example.vidorchestrator.service.StatusTracker;
import com.example.vidorchestrator.web.dto.StatusUpdatePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class SseNotificationFanout implements NotificationFanout {

    private static final Logger log = LoggerFactory.getLogger(SseNotificationFanout.class);
    private final Map<String, CopyOnWriteArrayList<SseEmitter>> userEmitters = new ConcurrentHashMap<>();

    private final StatusTracker statusTracker;

    public SseNotificationFanout(StatusTracker statusTracker) {
        this.statusTracker = statusTracker;
    }

    @Override
    public void register(String userId, SseEmitter emitter) {
        CopyOnWriteArrayList<SseEmitter> emitters = this.userEmitters.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>());
        emitters.add(emitter);
        log.info("Added SSE emitter for user: {}. Total emitters for user: {}", userId, emitters.size());

        Runnable cleanup = () -> {
            log.debug("SSE emitter cleanup triggered for user: {}", userId);
            unregister(userId, emitter);
        };

        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(e -> {
            log.warn("SSE emitter error for user: {}. Removing emitter. Error: {}", userId, e.getMessage());
            cleanup.run();
        });

        // Catch-up for the new connection only; other connections are already current.
        // Each snapshot is sent under its session lock so no newer event can overtake it.
        boolean[] failed = {false};
        int[] sent = {0};
        statusTracker.forEachUserSession(userId, session -> {
            if (failed[0]) {
                return;
            }
            if (send(userId, emitter, session.getVideoId(), session)) {
                sent[0]++;
            } else {
                failed[0] = true;
            }
        });
        log.debug("Sent {} current sessions to new emitter for user: {}", sent[0], userId);
    }

    @Override
    public void unregister(String userId, SseEmitter emitter) {
        if (userId == null || emitter == null) {
            log.warn("Attempted to unregister null userId or emitter.");
            return;
        }
        boolean[] removed = {false};
        boolean[] lastConnection = {false};
        this.userEmitters.computeIfPresent(userId, (key, emitters) -> {
            removed[0] = emitters.remove(emitter);
            if (emitters.isEmpty()) {
                lastConnection[0] = true;
                return null;
            }
            return emitters;
        });

        if (!removed[0]) {
            log.debug("Emitter for user {} was already unregistered.", userId);
            return;
        }
        log.info("Removed SSE emitter for user: {}", userId);
        if (lastConnection[0]) {
            log.info("No SSE emitters remain for user: {}, clearing completed sessions", userId);
            statusTracker.clearCompletedForUser(userId);
        }
    }

    @Override
    public void emit(String userId, String videoId, ProcessingSession session) {
        List<SseEmitter> emitters = this.userEmitters.get(userId);
        if (emitters == null || emitters.isEmpty()) {
            log.debug("No active SSE emitters found for user: {} when sending status of video {}", userId, videoId);
            return;
        }

        log.debug("Sending status of video {} to {} emitters of user: {}", videoId, emitters.size(), userId);
        for (SseEmitter emitter : List.copyOf(emitters)) {
            send(userId, emitter, videoId, session);
        }
    }

    @Override
    public int getActiveConnectionCount() {
        return userEmitters.values().stream().mapToInt(List::size).sum();
    }

    @Scheduled(fixedRateString = "${sse.heartbeat.interval-ms:20000}")
    public void sendHeartbeat() {
        if (userEmitters.isEmpty()) {
            return;
        }
        log.trace("Sending SSE heartbeats to {} users.", userEmitters.size());
        for (Map.Entry<String, CopyOnWriteArrayList<SseEmitter>> entry : userEmitters.entrySet()) {
            String userId = entry.getKey();
            for (SseEmitter emitter : List.copyOf(entry.getValue())) {
                try {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                } catch (IOException e) {
                    log.warn("Failed to send heartbeat to user: {}. Removing emitter. Error: {}", userId, e.getMessage());
                    unregister(userId, emitter);
                } catch (Exception e) {
                    log.error("Unexpected error sending heartbeat to user: {}. Removing emitter.", userId, e);
                    unregister(userId, emitter);
                }
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down notification fanout. Completing all active emitters...");
        int completedCount = 0;
        for (Map.Entry<String, CopyOnWriteArrayList<SseEmitter>> entry : Map.copyOf(userEmitters).entrySet()) {
            for (SseEmitter emitter : List.copyOf(entry.getValue())) {
                try {
                    emitter.complete();
                    completedCount++;
                } catch (Exception e) {
                    log.warn("Error completing emitter for user {} during shutdown: {}", entry.getKey(), e.getMessage());
                }
            }
        }
        userEmitters.clear();
        log.info("Notification fanout shutdown complete. Completed {} emitters.", completedCount);
    }

    /**
     * @return false if the emitter failed and was unregistered
     */
    private boolean send(String userId, SseEmitter emitter, String videoId, ProcessingSession session) {
        try {
            emitter.send(SseEmitter.event()
                    .name(STATUS_EVENT_NAME)
                    .data(new StatusUpdatePayload(videoId, session)));
            return true;
        } catch (IOException e) {
            log.warn("Failed to send status of video {} to an emitter for user: {}. Removing emitter. Error: {}",
                    videoId, userId, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error sending status of video {} to an emitter for user: {}. Removing emitter.",
                    videoId, userId, e);
        }
        unregister(userId, emitter);
        return false;
    }
}
