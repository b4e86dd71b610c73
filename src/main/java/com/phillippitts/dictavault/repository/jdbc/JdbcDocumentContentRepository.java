package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.repository.DocumentContentRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class JdbcDocumentContentRepository implements DocumentContentRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcDocumentContentRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(String documentId, String content, int versionNumber) {
        Timestamp now = Timestamp.from(Instant.now());
        int updated = jdbcTemplate.update(
                "UPDATE document_contents SET content = ?, version_number = ?, updated_at = ? "
                        + "WHERE document_id = ?",
                content, versionNumber, now, documentId);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO document_contents (document_id, content, version_number, updated_at) "
                            + "VALUES (?, ?, ?, ?)",
                    documentId, content, versionNumber, now);
        }
    }

    @Override
    public Optional<String> findContent(String documentId) {
        return jdbcTemplate.query(
                "SELECT content FROM document_contents WHERE document_id = ?",
                (rs, rowNum) -> rs.getString("content"), documentId).stream().findFirst();
    }
}
