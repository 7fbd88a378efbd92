package com.nevis.docsearch.repository;

import com.nevis.docsearch.exception.EntityNotFoundException;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexingTask;
import com.nevis.docsearch.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcIndexingTaskRepository implements IndexingTaskRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<IndexingTask> taskRowMapper = (rs, rowNum) -> new IndexingTask(
        rs.getLong("id"),
        IndexAction.valueOf(rs.getString("action")),
        rs.getObject("document_id", Long.class),
        rs.getObject("tenant_id", Long.class),
        TaskStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getObject("next_attempt_at", OffsetDateTime.class),
        rs.getString("last_error"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public IndexingTask enqueue(IndexAction action, Long documentId, Long tenantId) {
        return jdbcClient.sql("""
                INSERT INTO indexing_tasks (action, document_id, tenant_id, status)
                VALUES (:action, :documentId, :tenantId, 'PENDING')
                RETURNING *
                """)
            .param("action", action.name())
            .param("documentId", documentId)
            .param("tenantId", tenantId)
            .query(taskRowMapper)
            .single();
    }

    @Override
    public Optional<IndexingTask> findById(Long id) {
        return jdbcClient.sql("SELECT * FROM indexing_tasks WHERE id = :id")
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public Optional<IndexingTask> claim(Long id) {
        String sql = """
            UPDATE indexing_tasks
            SET status = 'PROCESSING',
                attempts = attempts + 1,
                updated_at = NOW()
            WHERE id = (
                SELECT id FROM indexing_tasks
                WHERE id = :id
                  AND status = 'PENDING'
                  AND next_attempt_at <= NOW()
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """;

        return jdbcClient.sql(sql)
            .param("id", id)
            .query(taskRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public void markCompleted(Long id) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'COMPLETED',
                    last_error = NULL,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Indexing task", id);
        }
    }

    @Override
    @Transactional
    public void scheduleRetry(Long id, String error, OffsetDateTime nextAttemptAt) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'PENDING',
                    last_error = :error,
                    next_attempt_at = :nextAttemptAt,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("error", error)
            .param("nextAttemptAt", nextAttemptAt)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Indexing task", id);
        }
    }

    @Override
    @Transactional
    public void markDead(Long id, String error) {
        int rowsAffected = jdbcClient.sql("""
                UPDATE indexing_tasks
                SET status = 'DEAD',
                    last_error = :error,
                    updated_at = NOW()
                WHERE id = :id
                """)
            .param("error", error)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Indexing task", id);
        }
    }

    @Override
    public List<Long> findDue(int limit) {
        return jdbcClient.sql("""
                SELECT id FROM indexing_tasks
                WHERE status = 'PENDING' AND next_attempt_at <= NOW()
                ORDER BY next_attempt_at, id
                LIMIT :limit
                """)
            .param("limit", limit)
            .query(Long.class)
            .list();
    }

    @Override
    @Transactional
    public List<Long> resetStale(int staleThresholdMinutes) {
        String sql = """
            UPDATE indexing_tasks
            SET status = 'PENDING',
                next_attempt_at = NOW(),
                updated_at = NOW()
            WHERE id IN (
                SELECT id
                FROM indexing_tasks
                WHERE status = 'PROCESSING'
                  AND updated_at < NOW() - (INTERVAL '1 minute' * :staleMins)
                FOR UPDATE SKIP LOCKED
            )
            RETURNING id
            """;

        return jdbcClient.sql(sql)
            .param("staleMins", staleThresholdMinutes)
            .query(Long.class)
            .list();
    }
}
