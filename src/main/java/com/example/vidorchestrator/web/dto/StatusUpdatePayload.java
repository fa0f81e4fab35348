package com.example.vidorchestrator.web.dto;

import com.example.vidorchestrator.domain.ProcessingSession;

/**
 * Data of a {@code processing-status-update} SSE event.
 */
public record StatusUpdatePayload(String videoId, ProcessingSession status) {
}
