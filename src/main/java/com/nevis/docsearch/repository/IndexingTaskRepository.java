package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexingTask;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface IndexingTaskRepository {
    IndexingTask enqueue(IndexAction action, Long documentId, Long tenantId);
    Optional<IndexingTask> findById(Long id);

    /**
     * Moves a due PENDING task to PROCESSING and bumps its attempt counter. Empty when the
     * task is not due, already taken, or locked by another worker.
     */
    Optional<IndexingTask> claim(Long id);

    void markCompleted(Long id);
    void scheduleRetry(Long id, String error, OffsetDateTime nextAttemptAt);
    void markDead(Long id, String error);
    List<Long> findDue(int limit);
    List<Long> resetStale(int staleThresholdMinutes);
}
