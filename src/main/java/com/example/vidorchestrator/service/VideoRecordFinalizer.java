package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.ProcessingSession;

/**
 * Persists the final outcome of a completed session to the video record store.
 * Optional: when no bean is present, completion is only logged.
 */
public interface VideoRecordFinalizer {

    void finalizeProcessing(ProcessingSession completedSession);
}
