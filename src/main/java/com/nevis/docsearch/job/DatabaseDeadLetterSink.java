package com.nevis.docsearch.job;

import com.nevis.docsearch.model.DeadLetter;
import com.nevis.docsearch.repository.DeadLetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseDeadLetterSink implements DeadLetterSink {

    private final DeadLetterRepository deadLetterRepository;

    @Override
    @Retryable(retryFor = DataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    public void record(String jobKind, Long subjectId, Long tenantId, String errorMessage) {
        DeadLetter saved = deadLetterRepository.save(
            new DeadLetter(null, jobKind, subjectId, tenantId, errorMessage, null));
        log.warn("Dead-lettered {} job for subject {} (tenant {}) as #{}: {}",
            jobKind, subjectId, tenantId, saved.id(), errorMessage);
    }

    @Recover
    public void recover(DataAccessException e, String jobKind, Long subjectId, Long tenantId, String errorMessage) {
        log.error("Could not persist dead letter for {} job, subject {} (tenant {}), original error '{}': {}",
            jobKind, subjectId, tenantId, errorMessage, e.getMessage());
    }
}
