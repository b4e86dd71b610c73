package com.phillippitts.dictavault.repository.jdbc;

import com.phillippitts.dictavault.domain.PrivacyTag;
import com.phillippitts.dictavault.domain.TagStatus;
import com.phillippitts.dictavault.repository.PrivacyTagRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

@Repository
public class JdbcPrivacyTagRepository implements PrivacyTagRepository {

    private static final String COLUMNS =
            "id, session_id, start_offset, end_offset, status, tag_type, created_at";

    private static final RowMapper<PrivacyTag> ROW_MAPPER = (rs, rowNum) -> new PrivacyTag(
            rs.getString("id"),
            rs.getString("session_id"),
            rs.getInt("start_offset"),
            rs.getInt("end_offset"),
            TagStatus.fromStorageValue(rs.getString("status")),
            rs.getString("tag_type"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcPrivacyTagRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insertAll(List<PrivacyTag> tags) {
        if (tags.isEmpty()) {
            return;
        }
        jdbcTemplate.batchUpdate(
                "INSERT INTO privacy_tags (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                tags, tags.size(), (ps, tag) -> {
                    ps.setString(1, tag.id());
                    ps.setString(2, tag.sessionId());
                    ps.setInt(3, tag.startOffset());
                    ps.setInt(4, tag.endOffset());
                    ps.setString(5, tag.status().storageValue());
                    ps.setString(6, tag.tagType());
                    ps.setTimestamp(7, Timestamp.from(tag.createdAt()));
                });
    }

    @Override
    public List<PrivacyTag> findBySession(String sessionId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM privacy_tags WHERE session_id = ? "
                        + "ORDER BY start_offset, end_offset",
                ROW_MAPPER, sessionId);
    }

    @Override
    public boolean existsForSession(String sessionId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM privacy_tags WHERE session_id = ?", Integer.class, sessionId);
        return count != null && count > 0;
    }

    @Override
    public boolean updateStatus(String tagId, TagStatus status) {
        return jdbcTemplate.update(
                "UPDATE privacy_tags SET status = ? WHERE id = ?",
                status.storageValue(), tagId) > 0;
    }

    @Override
    public int countBySessionAndStatus(String sessionId, TagStatus status) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM privacy_tags WHERE session_id = ? AND status = ?",
                Integer.class, sessionId, status.storageValue());
        return count == null ? 0 : count;
    }

    @Override
    public int deleteBySession(String sessionId) {
        return jdbcTemplate.update("DELETE FROM privacy_tags WHERE session_id = ?", sessionId);
    }
}
