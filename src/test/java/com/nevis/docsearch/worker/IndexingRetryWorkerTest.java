package com.nevis.docsearch.worker;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.event.IndexingTaskRetryEvent;
import com.nevis.docsearch.repository.IndexingTaskRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class IndexingRetryWorkerTest {

    private final IndexingTaskRepository taskRepository = Mockito.mock(IndexingTaskRepository.class);
    private final ApplicationEventPublisher eventPublisher = Mockito.mock(ApplicationEventPublisher.class);
    private final IndexingRetryWorker worker = new IndexingRetryWorker(taskRepository, eventPublisher,
        new IndexingProperties(5, Duration.ofSeconds(5), Duration.ofMinutes(10), 7, 50));

    @Test
    @DisplayName("Should reset stale tasks first, then dispatch every due task")
    void shouldResetStaleThenDispatchDue() {
        when(taskRepository.resetStale(7)).thenReturn(List.of(3L));
        when(taskRepository.findDue(50)).thenReturn(List.of(1L, 3L));

        worker.dispatchDueTasks();

        InOrder order = inOrder(taskRepository, eventPublisher);
        order.verify(taskRepository).resetStale(7);
        order.verify(taskRepository).findDue(50);
        order.verify(eventPublisher).publishEvent(new IndexingTaskRetryEvent(1L));
        order.verify(eventPublisher).publishEvent(new IndexingTaskRetryEvent(3L));
    }

    @Test
    @DisplayName("Nothing due should publish nothing")
    void shouldStayQuietWhenNothingDue() {
        when(taskRepository.resetStale(7)).thenReturn(List.of());
        when(taskRepository.findDue(50)).thenReturn(List.of());

        worker.dispatchDueTasks();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
