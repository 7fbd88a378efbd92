package com.nevis.docsearch.job;

import com.nevis.docsearch.event.IndexingTaskScheduledEvent;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexingTask;
import com.nevis.docsearch.repository.IndexingTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point of the background job system. A task row is the durable record of the work;
 * execution starts once the inserting transaction commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexingTaskService {

    private final IndexingTaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IndexingTask enqueue(IndexAction action, Long documentId, Long tenantId) {
        IndexingTask task = taskRepository.enqueue(action, documentId, tenantId);
        log.debug("Enqueued {} task {} for document {} (tenant {})", action, task.id(), documentId, tenantId);
        eventPublisher.publishEvent(new IndexingTaskScheduledEvent(task.id()));
        return task;
    }
}
