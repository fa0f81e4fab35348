package com.example.vidorchestrator.service.impl;

import com.example.vidorchestrator.config.AsyncConfig;
import com.example.vidorchestrator.domain.QueueItem;
import com.example.vidorchestrator.domain.QueueItem.QueueItemStatus;
import com.example.vidorchestrator.domain.QueueStatus;
import com.example.vidorchestrator.events.TaskFinishedEvent;
import com.example.vidorchestrator.exceptions.ProcessingValidationException;
import com.example.vidorchestrator.exceptions.TaskExecutionException;
import com.example.vidorchestrator.repository.QueueItemRepository;
import com.example.vidorchestrator.service.ProcessingTaskExecutor;
import com.example.vidorchestrator.service.TaskOutcome;
import com.example.vidorchestrator.service.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

@Service
public class TaskQueueImpl implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueueImpl.class);

    // Delay before retry 1, 2 and 3 of a transiently failed item
    static final List<Duration> RETRY_DELAYS = List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(15));

    private final QueueItemRepository queueItemRepository;
    private final ProcessingTaskExecutor taskExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final AsyncTaskExecutor workerExecutor;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration activeInterval;
    private final Duration idleInterval;
    private final int workerPoolSize;

    private final ReentrantLock dequeueLock = new ReentrantLock();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean ticking = new AtomicBoolean();
    private final AtomicBoolean wakePending = new AtomicBoolean();
    private volatile boolean loopActive;
    private ScheduledFuture<?> nextTick; // guarded by this

    @Autowired
    public TaskQueueImpl(QueueItemRepository queueItemRepository,
                         ProcessingTaskExecutor taskExecutor,
                         ApplicationEventPublisher eventPublisher,
                         @Qualifier(AsyncConfig.QUEUE_WORKER_EXECUTOR) AsyncTaskExecutor workerExecutor,
                         TaskScheduler taskScheduler,
                         Clock clock,
                         @Value("${processing.queue.active-interval-ms:10000}") long activeIntervalMs,
                         @Value("${processing.queue.idle-interval-ms:30000}") long idleIntervalMs,
                         @Value("${processing.queue.worker-pool-size:3}") int workerPoolSize) {
        this.queueItemRepository = queueItemRepository;
        this.taskExecutor = taskExecutor;
        this.eventPublisher = eventPublisher;
        this.workerExecutor = workerExecutor;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.activeInterval = Duration.ofMillis(activeIntervalMs);
        this.idleInterval = Duration.ofMillis(idleIntervalMs);
        this.workerPoolSize = workerPoolSize;
    }

    @Override
    public QueueItem enqueue(String videoId, String taskType, int priority, Map<String, String> payload) {
        if (videoId == null || videoId.isBlank()) {
            throw new ProcessingValidationException("videoId is required");
        }
        if (taskType == null || taskType.isBlank()) {
            throw new ProcessingValidationException("taskType is required");
        }

        QueueItem item = new QueueItem(videoId, taskType, priority, payload, clock.instant());
        try {
            QueueItem saved = queueItemRepository.save(item);
            log.info("Enqueued {} for video {} (id: {}, priority: {})", taskType, videoId, saved.getId(), priority);
            wakeUp();
            return saved;
        } catch (DataAccessException e) {
            log.warn("Queue store unavailable, executing {} for video {} directly: {}",
                    taskType, videoId, e.getMessage());
            return executeDirectly(item);
        }
    }

    @Override
    public Optional<QueueItem> dequeueNext() {
        dequeueLock.lock();
        try {
            Instant now = clock.instant();
            List<QueueItem> ready = queueItemRepository.findReady(QueueItemStatus.QUEUED, now, PageRequest.of(0, 1));
            if (ready.isEmpty()) {
                return Optional.empty();
            }
            QueueItem item = ready.get(0);
            item.markProcessing(now);
            return Optional.of(queueItemRepository.save(item));
        } catch (DataAccessException e) {
            log.warn("Could not dequeue next item: {}", e.getMessage());
            return Optional.empty();
        } finally {
            dequeueLock.unlock();
        }
    }

    @Override
    public void execute(QueueItem item) {
        if (item.getStatus() != QueueItemStatus.PROCESSING) {
            item.markProcessing(clock.instant());
            item = saveQuietly(item);
        }
        log.debug("Executing {} for video {} (id: {}, attempt: {})",
                item.getTaskType(), item.getVideoId(), item.getId(), item.getRetryCount() + 1);

        TaskOutcome outcome = runTask(item);
        Instant now = clock.instant();

        if (outcome.success()) {
            item.markCompleted(now);
            saveQuietly(item);
            log.info("Completed {} for video {} (id: {})", item.getTaskType(), item.getVideoId(), item.getId());
            publishFinished(item, outcome);
        } else if (item.hasRetriesLeft()) {
            Duration delay = RETRY_DELAYS.get(Math.min(item.getRetryCount(), RETRY_DELAYS.size() - 1));
            item.markRetry(outcome.failureReason(), now.plus(delay));
            saveQuietly(item);
            log.warn("Task {} for video {} failed (retry {}/{} in {}s): {}",
                    item.getTaskType(), item.getVideoId(), item.getRetryCount(), QueueItem.MAX_RETRIES,
                    delay.toSeconds(), outcome.failureReason());
        } else {
            item.markFailed(outcome.failureReason(), now);
            saveQuietly(item);
            log.error("Task {} for video {} failed permanently after {} retries: {}",
                    item.getTaskType(), item.getVideoId(), item.getRetryCount(), outcome.failureReason());
            publishFinished(item, outcome);
        }
    }

    @Override
    public int retryFailedTasks() {
        try {
            List<QueueItem> failed = queueItemRepository
                    .findByStatusAndRetryCountLessThanEqualOrderByCreatedAtAsc(QueueItemStatus.FAILED, QueueItem.MAX_RETRIES);
            if (failed.isEmpty()) {
                return 0;
            }
            Instant now = clock.instant();
            failed.forEach(item -> item.resetForRetry(now));
            queueItemRepository.saveAll(failed);
            log.info("Reset {} failed tasks for retry", failed.size());
            wakeUp();
            return failed.size();
        } catch (DataAccessException e) {
            log.warn("Could not retry failed tasks, queue store unavailable: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public QueueStatus getQueueStatus() {
        Instant now = clock.instant();
        try {
            return QueueStatus.of(loopActive,
                    queueItemRepository.countByStatus(QueueItemStatus.QUEUED),
                    queueItemRepository.countByStatus(QueueItemStatus.PROCESSING),
                    queueItemRepository.countByStatus(QueueItemStatus.COMPLETED),
                    queueItemRepository.countByStatus(QueueItemStatus.FAILED),
                    now);
        } catch (DataAccessException e) {
            log.warn("Could not read queue status: {}", e.getMessage());
            return QueueStatus.unavailable(loopActive, "Queue store unavailable", now);
        }
    }

    @Override
    public int cleanup(int maxAgeHours) {
        if (maxAgeHours <= 0) {
            throw new ProcessingValidationException("maxAgeHours must be positive");
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        try {
            int deleted = queueItemRepository.deleteByStatusAndCompletedAtBefore(QueueItemStatus.COMPLETED, cutoff);
            if (deleted > 0) {
                log.info("Cleaned up {} completed queue items older than {}h", deleted, maxAgeHours);
            }
            return deleted;
        } catch (DataAccessException e) {
            log.warn("Could not clean up queue, store unavailable: {}", e.getMessage());
            return 0;
        }
    }

    @Override
    public void start() {
        if (loopActive) {
            return;
        }
        loopActive = true;
        log.info("Queue scheduler started (workers: {}, active: {}ms, idle: {}ms)",
                workerPoolSize, activeInterval.toMillis(), idleInterval.toMillis());
        scheduleNextTick(Duration.ZERO);
    }

    @Override
    public void stop() {
        if (!loopActive) {
            return;
        }
        loopActive = false;
        synchronized (this) {
            if (nextTick != null) {
                nextTick.cancel(false);
                nextTick = null;
            }
        }
        log.info("Queue scheduler stopped ({} tasks still running)", inFlight.get());
    }

    @Override
    public boolean isLoopActive() {
        return loopActive;
    }

    // Scheduler loop

    private void tick() {
        if (!loopActive) {
            return;
        }
        if (!ticking.compareAndSet(false, true)) {
            wakePending.set(true);
            return;
        }
        boolean dispatched = false;
        try {
            dispatched = dispatchAvailable();
        } catch (RuntimeException e) {
            log.error("Unexpected error in queue scheduler loop: {}", e.getMessage(), e);
        } finally {
            ticking.set(false);
        }

        if (wakePending.getAndSet(false)) {
            scheduleNextTick(Duration.ZERO);
        } else if (dispatched || inFlight.get() > 0 || hasQueuedItems()) {
            scheduleNextTick(activeInterval);
        } else {
            scheduleNextTick(idleInterval);
        }
    }

    private boolean dispatchAvailable() {
        boolean dispatched = false;
        while (loopActive && inFlight.get() < workerPoolSize) {
            Optional<QueueItem> next = dequeueNext();
            if (next.isEmpty()) {
                break;
            }
            if (!dispatch(next.get())) {
                break;
            }
            dispatched = true;
        }
        return dispatched;
    }

    private boolean dispatch(QueueItem item) {
        inFlight.incrementAndGet();
        try {
            workerExecutor.execute(() -> {
                try {
                    execute(item);
                } catch (RuntimeException e) {
                    log.error("Unexpected error executing queue item {}: {}", item.getId(), e.getMessage(), e);
                } finally {
                    inFlight.decrementAndGet();
                    wakeUp();
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            inFlight.decrementAndGet();
            log.warn("Worker pool rejected queue item {}, releasing it: {}", item.getId(), e.getMessage());
            item.releaseClaim();
            saveQuietly(item);
            return false;
        }
    }

    private void wakeUp() {
        if (loopActive) {
            scheduleNextTick(Duration.ZERO);
        }
    }

    private synchronized void scheduleNextTick(Duration delay) {
        if (!loopActive) {
            return;
        }
        if (nextTick != null) {
            nextTick.cancel(false);
        }
        nextTick = taskScheduler.schedule(this::tick, clock.instant().plus(delay));
    }

    private boolean hasQueuedItems() {
        try {
            return queueItemRepository.countByStatus(QueueItemStatus.QUEUED) > 0;
        } catch (DataAccessException e) {
            log.debug("Could not count queued items: {}", e.getMessage());
            return false;
        }
    }

    // Helper methods

    private QueueItem executeDirectly(QueueItem item) {
        item.setDirect(true);
        item.markProcessing(clock.instant());
        TaskOutcome outcome = runTask(item);
        if (outcome.success()) {
            item.markCompleted(clock.instant());
            log.info("Direct execution of {} for video {} completed", item.getTaskType(), item.getVideoId());
        } else {
            item.markFailed(outcome.failureReason(), clock.instant());
            log.error("Direct execution of {} for video {} failed: {}",
                    item.getTaskType(), item.getVideoId(), outcome.failureReason());
        }
        publishFinished(item, outcome);
        return item;
    }

    private TaskOutcome runTask(QueueItem item) {
        try {
            TaskOutcome outcome = taskExecutor.execute(item.getVideoId(), item.getTaskType(), item.getPayload());
            return outcome != null ? outcome : TaskOutcome.failure("Task returned no outcome");
        } catch (TaskExecutionException e) {
            return TaskOutcome.failure(e.getMessage(), e.getMetadata());
        } catch (RuntimeException e) {
            log.error("Task {} for video {} threw: {}", item.getTaskType(), item.getVideoId(), e.getMessage(), e);
            return TaskOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private QueueItem saveQuietly(QueueItem item) {
        if (item.isDirect()) {
            return item;
        }
        try {
            return queueItemRepository.save(item);
        } catch (DataAccessException e) {
            log.error("Failed to persist queue item {} ({} -> {}): {}",
                    item.getId(), item.getTaskType(), item.getStatus(), e.getMessage());
            return item;
        }
    }

    private void publishFinished(QueueItem item, TaskOutcome outcome) {
        try {
            eventPublisher.publishEvent(new TaskFinishedEvent(
                    this, item.getVideoId(), item.getTaskType(), item.getPayload(), outcome));
        } catch (Exception e) {
            log.error("Failed to handle TaskFinishedEvent [Video: {}, Task: {}]: {}",
                    item.getVideoId(), item.getTaskType(), e.getMessage(), e);
        }
    }
}
