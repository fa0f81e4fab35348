package com.example.vidorchestrator.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "processing_queue",
        indexes = {
                @Index(name = "idx_queue_status_priority", columnList = "status, priority, createdAt"),
                @Index(name = "idx_queue_video", columnList = "videoId")
        })
public class QueueItem {

    public static final int MAX_RETRIES = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String videoId;

    @Column(nullable = false, length = 64)
    private String taskType;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueueItemStatus status = QueueItemStatus.QUEUED;

    @Column(nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;

    private Instant completedAt;

    // Earliest time a requeued item may be picked up again (retry backoff)
    private Instant availableAt;

    @Column(length = 2000)
    private String errorMessage;

    @Convert(converter = PayloadConverter.class)
    @Column(length = 4000)
    private Map<String, String> payload = new HashMap<>();

    @Version
    private Long version;

    // Set on items executed in-process because the backing store was unavailable; never persisted
    @Transient
    private boolean direct;

    public enum QueueItemStatus {
        QUEUED,
        PROCESSING,
        COMPLETED,
        FAILED
    }

    public QueueItem() {
    }

    public QueueItem(String videoId, String taskType, int priority, Map<String, String> payload, Instant createdAt) {
        this.videoId = videoId;
        this.taskType = taskType;
        this.priority = priority;
        this.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
        this.createdAt = createdAt;
        this.availableAt = createdAt;
        // Status defaults to QUEUED via field initializer
    }

    public void markProcessing(Instant now) {
        this.status = QueueItemStatus.PROCESSING;
        this.startedAt = now;
    }

    public void markCompleted(Instant now) {
        this.status = QueueItemStatus.COMPLETED;
        this.completedAt = now;
        this.errorMessage = null;
    }

    /**
     * Requeues after a transient failure, incrementing the retry counter.
     */
    public void markRetry(String errorMessage, Instant availableAt) {
        this.retryCount++;
        this.status = QueueItemStatus.QUEUED;
        this.errorMessage = errorMessage;
        this.availableAt = availableAt;
        this.startedAt = null;
    }

    public void markFailed(String errorMessage, Instant now) {
        this.status = QueueItemStatus.FAILED;
        this.errorMessage = errorMessage;
        this.completedAt = now;
    }

    /**
     * Puts a permanently failed item back in the queue; the retry counter is kept.
     */
    public void resetForRetry(Instant now) {
        this.status = QueueItemStatus.QUEUED;
        this.errorMessage = null;
        this.completedAt = null;
        this.startedAt = null;
        this.availableAt = now;
    }

    /**
     * Gives a claimed item back to the queue without counting an attempt.
     */
    public void releaseClaim() {
        this.status = QueueItemStatus.QUEUED;
        this.startedAt = null;
    }

    public boolean hasRetriesLeft() {
        return retryCount < MAX_RETRIES;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getTaskType() {
        return taskType;
    }

    public int getPriority() {
        return priority;
    }

    public QueueItemStatus getStatus() {
        return status;
    }

    public void setStatus(QueueItemStatus status) {
        this.status = status;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getAvailableAt() {
        return availableAt;
    }

    public void setAvailableAt(Instant availableAt) {
        this.availableAt = availableAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, String> getPayload() {
        return payload;
    }

    public boolean isDirect() {
        return direct;
    }

    public void setDirect(boolean direct) {
        this.direct = direct;
    }
}
