package com.nevis.docsearch.job;

import com.nevis.docsearch.config.IndexingProperties;
import com.nevis.docsearch.exception.SearchEngineException;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexingTask;
import com.nevis.docsearch.model.TaskStatus;
import com.nevis.docsearch.repository.IndexingTaskRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IndexingTaskRunnerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final IndexingTaskRepository taskRepository = Mockito.mock(IndexingTaskRepository.class);
    private final IndexDocumentJob indexJob = Mockito.mock(IndexDocumentJob.class);
    private final DeleteDocumentJob deleteJob = Mockito.mock(DeleteDocumentJob.class);
    private final IndexingTaskRunner runner = new IndexingTaskRunner(taskRepository, indexJob, deleteJob,
        new IndexingProperties(3, Duration.ofSeconds(5), Duration.ofMinutes(10), 5, 100),
        Clock.fixed(NOW, ZoneOffset.UTC));

    private static IndexingTask task(IndexAction action, int attempts) {
        return new IndexingTask(1L, action, 42L, 9L, TaskStatus.PROCESSING, attempts, null, null, null, null);
    }

    @Test
    @DisplayName("Should run the index job with the claimed attempt number and complete the task")
    void shouldRunIndexJob() {
        when(taskRepository.claim(1L)).thenReturn(Optional.of(task(IndexAction.INDEX, 1)));

        runner.run(1L);

        verify(indexJob).perform(42L, 9L, 1);
        verify(taskRepository).markCompleted(1L);
    }

    @Test
    @DisplayName("Should run the delete job for deletion tasks")
    void shouldRunDeleteJob() {
        when(taskRepository.claim(1L)).thenReturn(Optional.of(task(IndexAction.DELETE, 2)));

        runner.run(1L);

        verify(deleteJob).perform(42L, 9L, 2);
        verifyNoInteractions(indexJob);
        verify(taskRepository).markCompleted(1L);
    }

    @Test
    @DisplayName("A task that cannot be claimed should not run")
    void shouldSkipUnclaimableTask() {
        when(taskRepository.claim(1L)).thenReturn(Optional.empty());

        runner.run(1L);

        verifyNoInteractions(indexJob, deleteJob);
        verify(taskRepository, never()).markCompleted(anyLong());
    }

    @Test
    @DisplayName("A failure should be rescheduled with exponential backoff")
    void shouldScheduleRetryWithBackoff() {
        when(taskRepository.claim(1L)).thenReturn(Optional.of(task(IndexAction.INDEX, 2)));
        doThrow(new SearchEngineException("engine down")).when(indexJob).perform(42L, 9L, 2);

        runner.run(1L);

        OffsetDateTime expected = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusSeconds(10);
        verify(taskRepository).scheduleRetry(1L, "engine down", expected);
        verify(taskRepository, never()).markCompleted(anyLong());
        verify(taskRepository, never()).markDead(anyLong(), anyString());
    }

    @Test
    @DisplayName("A failure on the last attempt should mark the task dead")
    void shouldMarkDeadWhenAttemptsExhausted() {
        when(taskRepository.claim(1L)).thenReturn(Optional.of(task(IndexAction.INDEX, 3)));
        doThrow(new SearchEngineException("engine down")).when(indexJob).perform(42L, 9L, 3);

        runner.run(1L);

        verify(taskRepository).markDead(1L, "engine down");
        verify(taskRepository, never()).scheduleRetry(anyLong(), anyString(), any());
    }
}
