package com.nevis.docsearch.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.model.Document;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentRepository implements DocumentRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;

    private final ObjectMapper objectMapper;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getLong("id"),
        rs.getLong("tenant_id"),
        rs.getString("title"),
        rs.getString("content"),
        readMetadata(rs.getString("metadata")),
        rs.getString("content_hash"),
        rs.getObject("indexed_at", OffsetDateTime.class),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class)
    );

    @Override
    @Transactional
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (tenant_id, title, content, metadata, content_hash)
                VALUES (:tenantId, :title, :content, CAST(:metadata AS jsonb), :contentHash)
                RETURNING *
                """)
            .param("tenantId", document.tenantId())
            .param("title", document.title())
            .param("content", document.content())
            .param("metadata", writeMetadata(document.metadata()))
            .param("contentHash", document.contentHash())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<Document> findById(Long id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Optional<Document> findByIdAndTenant(Long id, Long tenantId) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id AND tenant_id = :tenantId")
            .param("id", id)
            .param("tenantId", tenantId)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public Optional<Document> update(Document document) {
        return jdbcClient.sql("""
                UPDATE documents
                SET title = :title,
                    content = :content,
                    metadata = CAST(:metadata AS jsonb),
                    content_hash = :contentHash,
                    updated_at = clock_timestamp()
                WHERE id = :id AND tenant_id = :tenantId
                RETURNING *
                """)
            .param("title", document.title())
            .param("content", document.content())
            .param("metadata", writeMetadata(document.metadata()))
            .param("contentHash", document.contentHash())
            .param("id", document.id())
            .param("tenantId", document.tenantId())
            .query(documentRowMapper)
            .optional();
    }

    @Override
    @Transactional
    public boolean deleteByIdAndTenant(Long id, Long tenantId) {
        return jdbcClient.sql("DELETE FROM documents WHERE id = :id AND tenant_id = :tenantId")
            .param("id", id)
            .param("tenantId", tenantId)
            .update() > 0;
    }

    @Override
    public List<Long> findIdsByTenant(Long tenantId) {
        return jdbcClient.sql("SELECT id FROM documents WHERE tenant_id = :tenantId ORDER BY id")
            .param("tenantId", tenantId)
            .query(Long.class)
            .list();
    }

    @Override
    public long countByTenant(Long tenantId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM documents WHERE tenant_id = :tenantId")
            .param("tenantId", tenantId)
            .query(Long.class)
            .single();
    }

    @Override
    @Transactional
    public boolean markIndexed(Long id, OffsetDateTime expectedUpdatedAt) {
        return jdbcClient.sql("""
                UPDATE documents
                SET indexed_at = clock_timestamp()
                WHERE id = :id AND updated_at = :updatedAt
                """)
            .param("id", id)
            .param("updatedAt", expectedUpdatedAt)
            .update() > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> searchByText(Long tenantId, String query, int limit, int offset) {
        return jdbcClient.sql("""
                SELECT * FROM documents
                WHERE tenant_id = :tenantId
                  AND (title ILIKE :pattern ESCAPE '\\' OR content ILIKE :pattern ESCAPE '\\')
                ORDER BY created_at DESC, id DESC
                LIMIT :limit OFFSET :offset
                """)
            .param("tenantId", tenantId)
            .param("pattern", likePattern(query))
            .param("limit", limit)
            .param("offset", offset)
            .query(documentRowMapper)
            .list();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByText(Long tenantId, String query) {
        return jdbcClient.sql("""
                SELECT COUNT(*) FROM documents
                WHERE tenant_id = :tenantId
                  AND (title ILIKE :pattern ESCAPE '\\' OR content ILIKE :pattern ESCAPE '\\')
                """)
            .param("tenantId", tenantId)
            .param("pattern", likePattern(query))
            .query(Long.class)
            .single();
    }

    static String likePattern(String query) {
        String escaped = query
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private Map<String, Object> readMetadata(String raw) throws SQLException {
        if (raw == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Unreadable document metadata", e);
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata != null ? metadata : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document metadata is not serializable", e);
        }
    }
}
