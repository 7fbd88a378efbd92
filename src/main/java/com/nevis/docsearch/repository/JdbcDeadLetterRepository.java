package com.nevis.docsearch.repository;

import com.nevis.docsearch.model.DeadLetter;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcDeadLetterRepository implements DeadLetterRepository {

    private final JdbcClient jdbcClient;

    private final RowMapper<DeadLetter> deadLetterRowMapper = (rs, rowNum) -> new DeadLetter(
        rs.getLong("id"),
        rs.getString("job_kind"),
        rs.getObject("subject_id", Long.class),
        rs.getObject("tenant_id", Long.class),
        rs.getString("error_message"),
        rs.getObject("created_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public DeadLetter save(DeadLetter deadLetter) {
        return jdbcClient.sql("""
                INSERT INTO dead_letters (job_kind, subject_id, tenant_id, error_message)
                VALUES (:jobKind, :subjectId, :tenantId, :errorMessage)
                RETURNING *
                """)
            .param("jobKind", deadLetter.jobKind())
            .param("subjectId", deadLetter.subjectId())
            .param("tenantId", deadLetter.tenantId())
            .param("errorMessage", deadLetter.errorMessage())
            .query(deadLetterRowMapper)
            .single();
    }

    @Override
    public List<DeadLetter> findRecent(int limit) {
        return jdbcClient.sql("SELECT * FROM dead_letters ORDER BY created_at DESC, id DESC LIMIT :limit")
            .param("limit", limit)
            .query(deadLetterRowMapper)
            .list();
    }
}
