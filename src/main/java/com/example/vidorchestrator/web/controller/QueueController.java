package com.example.vidorchestrator.web.controller;

import com.example.vidorchestrator.domain.QueueItem;
import com.example.vidorchestrator.domain.QueueStatus;
import com.example.vidorchestrator.service.ProcessingOrchestrator;
import com.example.vidorchestrator.web.dto.EnqueueTaskRequest;
import com.example.vidorchestrator.web.dto.QueueActionResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/queue")
@Validated
public class QueueController {

    private final ProcessingOrchestrator processingOrchestrator;

    public QueueController(ProcessingOrchestrator processingOrchestrator) {
        this.processingOrchestrator = processingOrchestrator;
    }

    @PostMapping("/tasks")
    public ResponseEntity<QueueItem> enqueue(@Valid @RequestBody EnqueueTaskRequest request) {
        QueueItem item = processingOrchestrator.enqueue(request.videoId(), request.taskType(),
                request.priority(), request.payload());
        // Directly executed items have already run
        HttpStatus status = item.isDirect() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(item);
    }

    @GetMapping("/status")
    public QueueStatus getQueueStatus() {
        return processingOrchestrator.getQueueStatus();
    }

    @PostMapping("/retry-failed")
    public QueueActionResponse retryFailed() {
        return new QueueActionResponse("retry-failed", processingOrchestrator.retryFailedTasks());
    }

    @PostMapping("/cleanup")
    public QueueActionResponse cleanup(@RequestParam(defaultValue = "24")
                                       @Min(value = 1, message = "maxAgeHours must be at least 1")
                                       @Max(value = 8760, message = "maxAgeHours cannot exceed 8760") int maxAgeHours) {
        return new QueueActionResponse("cleanup", processingOrchestrator.cleanupQueue(maxAgeHours));
    }
}
