package com.nevis.docsearch.listener;

import com.nevis.docsearch.event.DocumentChangedEvent;
import com.nevis.docsearch.event.IndexingTaskRetryEvent;
import com.nevis.docsearch.event.IndexingTaskScheduledEvent;
import com.nevis.docsearch.event.TenantDestroyedEvent;
import com.nevis.docsearch.infra.CacheStore;
import com.nevis.docsearch.infra.RateLimiter;
import com.nevis.docsearch.job.IndexingTaskRunner;
import com.nevis.docsearch.messaging.DocumentMessageProducer;
import com.nevis.docsearch.messaging.Topics;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.mockito.Mockito.verify;

class DocumentEventListenerTest {

    private final DocumentMessageProducer producer = Mockito.mock(DocumentMessageProducer.class);
    private final IndexingTaskRunner runner = Mockito.mock(IndexingTaskRunner.class);
    private final CacheStore cacheStore = Mockito.mock(CacheStore.class);
    private final RateLimiter rateLimiter = Mockito.mock(RateLimiter.class);
    private final DocumentEventListener listener = new DocumentEventListener(producer, runner, cacheStore, rateLimiter);

    @Test
    @DisplayName("A document change should publish its intent and invalidate the tenant's searches")
    void shouldPublishAndInvalidate() {
        listener.handleDocumentChanged(new DocumentChangedEvent(42L, 9L, IndexAction.INDEX));

        verify(producer).publish(Topics.DOCUMENT_INDEX, new IndexMessage(42L, 9L, IndexAction.INDEX), "42");
        verify(cacheStore).scanDelete("search:9:*");
    }

    @Test
    @DisplayName("A destroyed tenant should get delete messages, cache invalidation and a limiter reset")
    void shouldCleanUpDestroyedTenant() {
        listener.handleTenantDestroyed(new TenantDestroyedEvent(9L, List.of(1L, 2L)));

        verify(producer).publish(Topics.DOCUMENT_DELETE, IndexMessage.delete(1L, 9L), "1");
        verify(producer).publish(Topics.DOCUMENT_DELETE, IndexMessage.delete(2L, 9L), "2");
        verify(cacheStore).scanDelete("search:9:*");
        verify(rateLimiter).reset(9L);
    }

    @Test
    @DisplayName("Scheduled and retried tasks should both go to the runner")
    void shouldRunTasks() {
        listener.handleScheduledTask(new IndexingTaskScheduledEvent(5L));
        listener.handleRetry(new IndexingTaskRetryEvent(6L));

        verify(runner).run(5L);
        verify(runner).run(6L);
    }
}
