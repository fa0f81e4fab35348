package com.example.vidorchestrator.web.controller;

import com.example.vidorchestrator.service.ProcessingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

@RestController
@RequestMapping("/api/sse")
public class SseController {

    private static final Logger log = LoggerFactory.getLogger(SseController.class);

    private final ProcessingOrchestrator processingOrchestrator;
    private final long sseEmitterTimeout;

    public SseController(ProcessingOrchestrator processingOrchestrator,
                         @Value("${sse.emitter.timeout.ms:1800000}") long sseEmitterTimeout) {
        this.processingOrchestrator = processingOrchestrator;
        this.sseEmitterTimeout = sseEmitterTimeout;
    }

    @GetMapping(path = "/subscribe", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> subscribe(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            log.warn("Attempt to subscribe to SSE without authentication.");
            return ResponseEntity.status(401).build();
        }

        String userId = authentication.getName();
        log.info("SSE subscription request received for user: {}", userId);

        SseEmitter emitter = new SseEmitter(sseEmitterTimeout);

        try {
            emitter.send(SseEmitter.event().comment("SSE connection established"));
        } catch (IOException e) {
            log.error("Failed to send initial SSE comment to user: {}. Error: {}", userId, e.getMessage(), e);
            emitter.completeWithError(e);
            return ResponseEntity.internalServerError().build();
        }

        // Registration pushes the user's current sessions to this emitter
        processingOrchestrator.connect(userId, emitter);

        log.info("SSE emitter created and registered successfully for user: {}", userId);
        return ResponseEntity.ok(emitter);
    }
}
