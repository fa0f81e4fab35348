package com.example.vidorchestrator.web.controller;

import com.example.vidorchestrator.domain.ProcessingSession;
import com.example.vidorchestrator.domain.ProcessingStatistics;
import com.example.vidorchestrator.service.ProcessingOrchestrator;
import com.example.vidorchestrator.web.dto.QueueActionResponse;
import com.example.vidorchestrator.web.dto.StartProcessingRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/processing")
public class ProcessingController {

    private static final Logger log = LoggerFactory.getLogger(ProcessingController.class);

    private final ProcessingOrchestrator processingOrchestrator;

    public ProcessingController(ProcessingOrchestrator processingOrchestrator) {
        this.processingOrchestrator = processingOrchestrator;
    }

    @PostMapping("/videos")
    public ResponseEntity<ProcessingSession> startProcessing(@Valid @RequestBody StartProcessingRequest request,
                                                             Authentication authentication) {
        String userId = authentication.getName();
        log.info("Start processing request for video {} from user {}", request.videoId(), userId);
        ProcessingSession session = processingOrchestrator.beginProcessing(request.videoId(), userId,
                request.videoRecordId(), request.contentTypes());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(session);
    }

    @GetMapping("/videos/{videoId}")
    public ResponseEntity<ProcessingSession> getVideoStatus(@PathVariable String videoId,
                                                            Authentication authentication) {
        return processingOrchestrator.getVideoStatus(videoId, authentication.getName())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/videos/{videoId}/cancel")
    public ResponseEntity<Void> cancelProcessing(@PathVariable String videoId, Authentication authentication) {
        String userId = authentication.getName();
        if (!processingOrchestrator.cancel(videoId, userId)) {
            log.debug("Cancel request for untracked video {} from user {}", videoId, userId);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/sessions")
    public List<ProcessingSession> getUserSessions(Authentication authentication) {
        return processingOrchestrator.getUserSessions(authentication.getName());
    }

    @DeleteMapping("/sessions")
    public QueueActionResponse forceClear(Authentication authentication) {
        int cleared = processingOrchestrator.forceClear(authentication.getName());
        return new QueueActionResponse("force-clear", cleared);
    }

    @GetMapping("/statistics")
    public ProcessingStatistics getStatistics() {
        return processingOrchestrator.getStatistics();
    }
}
