package com.example.vidorchestrator.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Item counts per queue status plus whether the backing store and the scheduler loop are up.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueueStatus(
        boolean available,
        boolean loopActive,
        long queued,
        long processing,
        long completed,
        long failed,
        long total,
        Instant lastUpdate,
        String message
) {

    public static QueueStatus of(boolean loopActive, long queued, long processing, long completed, long failed,
                                 Instant now) {
        return new QueueStatus(true, loopActive, queued, processing, completed, failed,
                queued + processing + completed + failed, now, null);
    }

    public static QueueStatus unavailable(boolean loopActive, String message, Instant now) {
        return new QueueStatus(false, loopActive, 0, 0, 0, 0, 0, now, message);
    }
}
