package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.domain.Version;
import com.phillippitts.dictavault.repository.VersionRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcVersionRepository implements VersionRepository {

    private static final String COLUMNS =
            "id, document_id, version_number, version_type, content, created_at";

    private static final RowMapper<Version> ROW_MAPPER = (rs, rowNum) -> new Version(
            rs.getString("id"),
            rs.getString("document_id"),
            rs.getInt("version_number"),
            rs.getString("version_type"),
            rs.getString("content"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcVersionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public int findMaxVersionNumber(String documentId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(version_number), 0) FROM document_versions WHERE document_id = ?",
                Integer.class, documentId);
        return max == null ? 0 : max;
    }

    @Override
    public void insert(Version version) {
        jdbcTemplate.update(
                "INSERT INTO document_versions (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                version.id(),
                version.documentId(),
                version.versionNumber(),
                version.versionType(),
                version.content(),
                Timestamp.from(version.createdAt()));
    }

    @Override
    public List<Version> findAllByDocumentIdDesc(String documentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM document_versions WHERE document_id = ? "
                        + "ORDER BY version_number DESC",
                ROW_MAPPER, documentId);
    }

    @Override
    public Optional<Version> findLatest(String documentId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM document_versions WHERE document_id = ? "
                        + "ORDER BY version_number DESC LIMIT 1",
                ROW_MAPPER, documentId).stream().findFirst();
    }

    @Override
    public Optional<Version> find(String documentId, int versionNumber) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM document_versions WHERE document_id = ? AND version_number = ?",
                ROW_MAPPER, documentId, versionNumber).stream().findFirst();
    }
}
