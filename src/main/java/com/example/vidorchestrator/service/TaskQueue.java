package com.example.vidorchestrator.service;

import com.example.vidorchestrator.domain.QueueItem;
import com.example.vidorchestrator.domain.QueueStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Schedules discrete units of work, retries them with backoff and executes them through the
 * {@link ProcessingTaskExecutor}. Backed by a store; when the store is unavailable,
 * enqueued tasks run directly.
 */
public interface TaskQueue {

    /**
     * Adds a task to the queue and wakes the scheduler loop.
     * If the backing store cannot be reached, the task is executed synchronously instead and a
     * synthetic item (not persisted, {@link QueueItem#isDirect()} true) is returned.
     *
     * @param videoId  The video the task belongs to.
     * @param taskType The task type, routed by the executor.
     * @param priority Higher runs first.
     * @param payload  Task arguments, may be null.
     * @return The queued (or directly executed) item.
     * @throws com.example.vidorchestrator.exceptions.ProcessingValidationException if videoId or taskType is blank.
     */
    QueueItem enqueue(String videoId, String taskType, int priority, Map<String, String> payload);

    /**
     * Claims the next eligible item (highest priority, then oldest) and marks it processing.
     *
     * @return The claimed item, or empty if nothing is eligible.
     */
    Optional<QueueItem> dequeueNext();

    /**
     * Runs one item and records the outcome: completed, requeued for retry, or failed for good.
     *
     * @param item The item to run.
     */
    void execute(QueueItem item);

    /**
     * Resets permanently failed items back to queued, keeping their retry counter.
     *
     * @return number of items reset.
     */
    int retryFailedTasks();

    QueueStatus getQueueStatus();

    /**
     * Deletes completed items older than the given age.
     *
     * @return number of items deleted.
     */
    int cleanup(int maxAgeHours);

    void start();

    void stop();

    boolean isLoopActive();
}
