package com.nevis.docsearch.job;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.model.IndexingTask;
import com.nevis.docsearch.repository.IndexingTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Claims a task, runs the matching job and records the outcome: completed, rescheduled with
 * exponential backoff, or dead once the attempt budget is spent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexingTaskRunner {

    private final IndexingTaskRepository taskRepository;
    private final IndexDocumentJob indexDocumentJob;
    private final DeleteDocumentJob deleteDocumentJob;
    private final IndexingProperties indexingProperties;
    private final Clock clock;

    public void run(Long taskId) {
        Optional<IndexingTask> claimed = taskRepository.claim(taskId);
        if (claimed.isEmpty()) {
            log.debug("Task {} is not claimable, skipping", taskId);
            return;
        }

        IndexingTask task = claimed.get();
        try {
            switch (task.action()) {
                case INDEX -> indexDocumentJob.perform(task.documentId(), task.tenantId(), task.attempts());
                case DELETE -> deleteDocumentJob.perform(task.documentId(), task.tenantId(), task.attempts());
            }
            taskRepository.markCompleted(task.id());
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (task.attempts() >= indexingProperties.maxAttempts()) {
                taskRepository.markDead(task.id(), error);
                log.error("Task {} ({} document {}) is dead after {} attempts",
                    task.id(), task.action(), task.documentId(), task.attempts());
            } else {
                Duration delay = indexingProperties.backoffFor(task.attempts());
                taskRepository.scheduleRetry(task.id(), error, OffsetDateTime.now(clock).plus(delay));
                log.warn("Task {} ({} document {}) failed on attempt {}, retrying in {}",
                    task.id(), task.action(), task.documentId(), task.attempts(), delay);
            }
        }
    }
}
