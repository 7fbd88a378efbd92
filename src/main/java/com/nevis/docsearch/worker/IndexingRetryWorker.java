package com.nevis.docsearch.worker;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.event.IndexingTaskRetryEvent;
import com.nevis.docsearch.repository.IndexingTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Re-dispatches tasks whose backoff elapsed, tasks that never reached an executor, and
 * tasks abandoned in PROCESSING by a crashed worker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexingRetryWorker {

    private final IndexingTaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final IndexingProperties indexingProperties;

    @Scheduled(
        fixedDelayString = "${app.indexing.poll-interval-ms:15000}",
        initialDelayString = "${app.indexing.poll-interval-ms:15000}"
    )
    public void dispatchDueTasks() {
        log.debug("Checking for due or stale indexing tasks...");

        List<Long> stale = taskRepository.resetStale(indexingProperties.staleThresholdMinutes());
        if (!stale.isEmpty()) {
            log.warn("Reset {} stale indexing tasks", stale.size());
        }

        List<Long> due = taskRepository.findDue(indexingProperties.batchSize());
        if (!due.isEmpty()) {
            log.info("Dispatching {} due indexing tasks", due.size());
            due.forEach(id -> eventPublisher.publishEvent(new IndexingTaskRetryEvent(id)));
        }
    }
}
