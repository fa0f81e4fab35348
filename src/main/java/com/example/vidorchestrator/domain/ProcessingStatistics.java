package com.example.vidorchestrator.domain;

/**
 * Session counts plus live connections and the queue snapshot.
 */
public record ProcessingStatistics(
        SessionStatistics sessions,
        int activeConnections,
        QueueStatus queue
) {
}
