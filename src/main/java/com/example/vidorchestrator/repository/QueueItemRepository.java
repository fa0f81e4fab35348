package com.example.vidorchestrator.repository;

import com.example.vidorchestrator.domain.QueueItem;
import com.example.vidorchestrator.domain.QueueItem.QueueItemStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface QueueItemRepository extends CrudRepository<QueueItem, Long> {

    /**
     * Items in the given status that are eligible to run at {@code now}, highest priority first,
     * oldest first within a priority. Callers pass {@code PageRequest.of(0, 1)} to get the next item.
     *
     * @param status   The status to select.
     * @param now      Items whose retry backoff ends after this instant are skipped.
     * @param pageable Page size limit.
     * @return Matching items in dequeue order.
     */
    @Query("SELECT q FROM QueueItem q WHERE q.status = :status " +
            "AND (q.availableAt IS NULL OR q.availableAt <= :now) " +
            "ORDER BY q.priority DESC, q.createdAt ASC")
    List<QueueItem> findReady(@Param("status") QueueItemStatus status,
                              @Param("now") Instant now,
                              Pageable pageable);

    List<QueueItem> findByStatusAndRetryCountLessThanEqualOrderByCreatedAtAsc(QueueItemStatus status, int retryCount);

    long countByStatus(QueueItemStatus status);

    @Modifying
    @Transactional
    @Query("DELETE FROM QueueItem q WHERE q.status = :status AND q.completedAt < :cutoff")
    int deleteByStatusAndCompletedAtBefore(@Param("status") QueueItemStatus status,
                                           @Param("cutoff") Instant cutoff);
}
