package com.example.vidorchestrator.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * A required argument to start tracking or to enqueue a task was missing or invalid.
 * Rejected synchronously; nothing is tracked or queued.
 */
public class ProcessingValidationException extends ResponseStatusException {

    public ProcessingValidationException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }

    public ProcessingValidationException(String reason, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, reason, cause);
    }
}
