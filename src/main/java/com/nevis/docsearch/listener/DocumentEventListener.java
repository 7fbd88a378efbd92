package com.nevis.docsearch.listener;

import com.nevis.docsearch.event.DocumentChangedEvent;
import com.nevis.docsearch.event.IndexingTaskRetryEvent;
import com.nevis.docsearch.event.IndexingTaskScheduledEvent;
import com.nevis.docsearch.event.TenantDestroyedEvent;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.job.IndexingTaskRunner;
import com.nevis.docsearch.messaging.DocumentMessageProducer;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexMessage;
import com.nevis.docsearch.service.CacheKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentEventListener {

    private final DocumentMessageProducer messageProducer;
    private final IndexingTaskRunner taskRunner;
    private final CacheStore cacheStore;
    private final RateLimiter rateLimiter;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleDocumentChanged(DocumentChangedEvent event) {
        log.debug("Publishing {} for document {}", event.action(), event.documentId());
        IndexMessage message = new IndexMessage(event.documentId(), event.tenantId(), event.action());
        messageProducer.publish(event.action().topic(), message, String.valueOf(event.documentId()));

        long removed = cacheStore.scanDelete(CacheKeys.tenantSearches(event.tenantId()));
        log.debug("Invalidated {} cached searches of tenant {}", removed, event.tenantId());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleTenantDestroyed(TenantDestroyedEvent event) {
        log.info("Cleaning up after tenant {} ({} documents)", event.tenantId(), event.documentIds().size());
        for (Long documentId : event.documentIds()) {
            messageProducer.publish(IndexAction.DELETE.topic(),
                IndexMessage.delete(documentId, event.tenantId()), String.valueOf(documentId));
        }
        cacheStore.scanDelete(CacheKeys.tenantSearches(event.tenantId()));
        rateLimiter.reset(event.tenantId());
    }

    @Async("indexingTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleScheduledTask(IndexingTaskScheduledEvent event) {
        taskRunner.run(event.taskId());
    }

    @Async("indexingTaskExecutor")
    @EventListener
    public void handleRetry(IndexingTaskRetryEvent event) {
        taskRunner.run(event.taskId());
    }
}
