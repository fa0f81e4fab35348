package com.example.vidorchestrator.web.dto;

/**
 * Result of a bulk queue or session operation.
 */
public record QueueActionResponse(String action, int affected) {
}
